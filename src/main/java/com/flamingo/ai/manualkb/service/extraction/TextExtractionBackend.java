package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.domain.enums.ExtractionEngine;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Strategy interface for PDF text extraction backends.
 *
 * <p>Implementations skip pages that fail individually and report them in {@link
 * BackendExtraction#failedPages()}. A whole-document failure is signalled by an exception so the
 * caller can try another backend.
 */
public interface TextExtractionBackend {

  ExtractionEngine engine();

  /**
   * Extracts per-page text and metadata.
   *
   * @param pdf path of the PDF file
   * @return raw extraction output
   * @throws IOException when the document cannot be opened or parsed at all
   */
  BackendExtraction extract(Path pdf) throws IOException;
}
