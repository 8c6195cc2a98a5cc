package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.DocumentType;
import com.flamingo.ai.manualkb.domain.enums.ExtractionEngine;
import java.time.LocalDateTime;
import lombok.Builder;

/**
 * Document-level facts captured once per extraction run.
 *
 * @param title PDF title, or the filename stem when the PDF has none
 * @param author PDF author, may be null
 * @param creationDate parsed PDF creation date, may be null
 * @param pageCount number of pages in the file
 * @param fileSize file size in bytes
 * @param fileName original filename
 * @param documentType keyword-derived document type
 * @param language ISO 639-1 code or {@code unknown}
 * @param languageConfidence detector probability, 0 when unknown
 * @param engineUsed backend that produced the page texts
 * @param fallbackUsed whether the alternate backend or OCR had to step in
 * @param pagesFailed pages that yielded no text
 */
@Builder(toBuilder = true)
public record DocumentMetadata(
    String title,
    String author,
    LocalDateTime creationDate,
    int pageCount,
    long fileSize,
    String fileName,
    DocumentType documentType,
    String language,
    double languageConfidence,
    ExtractionEngine engineUsed,
    boolean fallbackUsed,
    int pagesFailed) {

  public static final String UNKNOWN_LANGUAGE = "unknown";
}
