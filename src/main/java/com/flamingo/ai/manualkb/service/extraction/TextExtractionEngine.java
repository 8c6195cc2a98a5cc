package com.flamingo.ai.manualkb.service.extraction;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.ExtractionEngine;
import com.flamingo.ai.manualkb.domain.model.DocumentMetadata;
import com.flamingo.ai.manualkb.domain.model.TextExtractionResult;
import com.flamingo.ai.manualkb.exception.ExtractionFailureException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts per-page text, structured table lines and metadata from a PDF.
 *
 * <p>Degradation order:
 *
 * <ol>
 *   <li>the preferred backend; pages that fail are skipped,
 *   <li>the alternate backend when the preferred one fails for the whole document or finds no
 *       text at all,
 *   <li>OCR for the individual pages still without text, when enabled.
 * </ol>
 *
 * <p>Only when all of these leave every page empty does extraction fail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractionEngine {

  private final List<TextExtractionBackend> backends;
  private final StructuredLayoutScanner structuredLayoutScanner;
  private final LanguageDetectionService languageDetectionService;
  private final OcrFallback ocrFallback;
  private final ManualKbConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts text from a PDF.
   *
   * @param path PDF file
   * @param documentId owning document, used for logging and errors
   * @return page texts, structured texts and metadata
   * @throws ExtractionFailureException when no text could be obtained from any page
   */
  @Timed(value = "text.extraction", description = "Time to extract the text of a manual")
  public TextExtractionResult extract(Path path, UUID documentId) {
    ExtractionEngine preferred =
        ExtractionEngine.fromValue(config.getExtraction().getPreferredEngine());
    log.info(
        "Extracting text from {} with {} (document {})", path.getFileName(), preferred, documentId);

    Exception failure = null;
    BackendExtraction raw = null;
    boolean fallbackUsed = false;
    try {
      raw = runBackend(preferred, path);
    } catch (IOException | RuntimeException e) {
      log.warn("{} failed for {}: {}", preferred, path.getFileName(), e.getMessage());
      failure = e;
    }

    if ((raw == null || !raw.hasText()) && config.getExtraction().isFallbackEnabled()) {
      ExtractionEngine alternate = preferred.alternate();
      try {
        BackendExtraction alternateRaw = runBackend(alternate, path);
        if (raw == null || alternateRaw.hasText()) {
          raw = alternateRaw;
          fallbackUsed = true;
          log.info("Using {} output for {}", alternate, path.getFileName());
        }
      } catch (IOException | RuntimeException e) {
        log.warn("{} failed for {}: {}", alternate, path.getFileName(), e.getMessage());
        if (failure == null) {
          failure = e;
        }
      }
    }

    if (raw == null) {
      throw new ExtractionFailureException(
          documentId, "No extraction backend could read " + path.getFileName(), failure);
    }

    Map<Integer, String> pageTexts = new HashMap<>();
    TreeSet<Integer> failedPages = new TreeSet<>(raw.failedPages());
    raw.pageTexts()
        .forEach(
            (page, text) -> {
              String cleaned = TextCleaner.clean(text);
              if (cleaned.isEmpty()) {
                failedPages.add(page);
              } else {
                pageTexts.put(page, cleaned);
              }
            });

    if (!failedPages.isEmpty() && ocrFallback.isAvailable()) {
      Map<Integer, String> recovered = ocrFallback.recover(path, failedPages);
      recovered.forEach(
          (page, text) -> {
            String cleaned = TextCleaner.clean(text);
            if (!cleaned.isEmpty()) {
              pageTexts.put(page, cleaned);
              failedPages.remove(page);
            }
          });
      fallbackUsed |= !recovered.isEmpty();
    }

    if (!failedPages.isEmpty()) {
      log.warn(
          "{} of {} pages yielded no text: {}", failedPages.size(), raw.pageCount(), failedPages);
      meterRegistry.counter("extraction.pages.failed").increment(failedPages.size());
    }
    if (fallbackUsed) {
      meterRegistry.counter("extraction.fallback.used").increment();
    }

    if (pageTexts.isEmpty()) {
      throw new ExtractionFailureException(
          documentId, "No text could be extracted from " + path.getFileName(), failure);
    }

    Map<Integer, String> structuredTexts = scanStructured(raw);
    DetectedLanguage language = languageDetectionService.detect(new TreeMap<>(pageTexts));
    DocumentMetadata metadata =
        buildMetadata(path, raw, language, fallbackUsed, failedPages.size());

    log.info(
        "Extracted {} pages ({} failed, {} with structured lines) from {} via {}",
        pageTexts.size(),
        failedPages.size(),
        structuredTexts.size(),
        path.getFileName(),
        raw.engine());
    return new TextExtractionResult(pageTexts, structuredTexts, metadata);
  }

  // ---- private helpers ----

  private BackendExtraction runBackend(ExtractionEngine engine, Path path) throws IOException {
    Optional<TextExtractionBackend> backend =
        backends.stream().filter(b -> b.engine() == engine).findFirst();
    if (backend.isEmpty()) {
      throw new IOException("No backend registered for " + engine);
    }
    return backend.get().extract(path);
  }

  private Map<Integer, String> scanStructured(BackendExtraction raw) {
    Map<Integer, String> structured = new HashMap<>();
    if (!config.getStructuredScan().isEnabled()) {
      return structured;
    }
    raw.pageLines()
        .forEach(
            (page, lines) ->
                structuredLayoutScanner.scan(lines).ifPresent(text -> structured.put(page, text)));
    return structured;
  }

  private DocumentMetadata buildMetadata(
      Path path,
      BackendExtraction raw,
      DetectedLanguage language,
      boolean fallbackUsed,
      int failed) {
    String fileName = path.getFileName().toString();
    String title = raw.title() != null ? raw.title() : fileStem(fileName);
    return DocumentMetadata.builder()
        .title(title)
        .author(raw.author())
        .creationDate(raw.creationDate())
        .pageCount(raw.pageCount())
        .fileSize(fileSize(path))
        .fileName(fileName)
        .documentType(DocumentTypeClassifier.classify(raw.title(), fileName))
        .language(language.language())
        .languageConfidence(language.confidence())
        .engineUsed(raw.engine())
        .fallbackUsed(fallbackUsed)
        .pagesFailed(failed)
        .build();
  }

  private static String fileStem(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  private static long fileSize(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      log.warn("Could not read size of {}: {}", path.getFileName(), e.getMessage());
      return 0L;
    }
  }
}
