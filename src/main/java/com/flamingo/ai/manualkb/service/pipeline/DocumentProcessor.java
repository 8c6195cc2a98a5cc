package com.flamingo.ai.manualkb.service.pipeline;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.DocumentStatus;
import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;
import com.flamingo.ai.manualkb.domain.model.DocumentMetadata;
import com.flamingo.ai.manualkb.domain.model.DocumentVersion;
import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.domain.model.ManufacturerDetection;
import com.flamingo.ai.manualkb.domain.model.PageImage;
import com.flamingo.ai.manualkb.domain.model.Part;
import com.flamingo.ai.manualkb.domain.model.ProcessingResult;
import com.flamingo.ai.manualkb.domain.model.ProcessingStatistics;
import com.flamingo.ai.manualkb.domain.model.ProductModel;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import com.flamingo.ai.manualkb.domain.model.TextExtractionResult;
import com.flamingo.ai.manualkb.domain.model.ValidationIssue;
import com.flamingo.ai.manualkb.exception.DocumentProcessingException;
import com.flamingo.ai.manualkb.exception.ExtractionFailureException;
import com.flamingo.ai.manualkb.exception.PersistenceFailureException;
import com.flamingo.ai.manualkb.exception.UnknownManufacturerException;
import com.flamingo.ai.manualkb.service.chunking.SmartChunker;
import com.flamingo.ai.manualkb.service.collaborator.EmbeddingClient;
import com.flamingo.ai.manualkb.service.entity.ErrorCodeExtractor;
import com.flamingo.ai.manualkb.service.entity.PartsExtractor;
import com.flamingo.ai.manualkb.service.entity.ProductExtractor;
import com.flamingo.ai.manualkb.service.entity.VersionExtractor;
import com.flamingo.ai.manualkb.service.extraction.TextExtractionEngine;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerDetector;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.media.ImageStorageService;
import com.flamingo.ai.manualkb.service.media.LinkExtractor;
import com.flamingo.ai.manualkb.service.media.PdfImageExtractor;
import com.flamingo.ai.manualkb.service.persistence.KnowledgeBaseWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns a service-manual PDF into knowledge base records.
 *
 * <p>Stages run strictly in sequence: text extraction, manufacturer detection, products, parts,
 * error codes, versions, images and links, chunking, chunk deduplication, error-code to chunk
 * linking, statistics and persistence. Only the first stage is fatal: a document without any text
 * yields a failed result. Every later stage that throws is recorded as a validation issue and the
 * run continues with that stage's output empty. Per-page entity extraction runs on the bounded
 * page executor; results keep page order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessor {

  static final String AUTO = "AUTO";

  private final TextExtractionEngine textExtractionEngine;
  private final ManufacturerDetector manufacturerDetector;
  private final ManufacturerNormalizer manufacturerNormalizer;
  private final ProductExtractor productExtractor;
  private final PartsExtractor partsExtractor;
  private final ErrorCodeExtractor errorCodeExtractor;
  private final VersionExtractor versionExtractor;
  private final PdfImageExtractor pdfImageExtractor;
  private final ImageStorageService imageStorageService;
  private final LinkExtractor linkExtractor;
  private final SmartChunker smartChunker;
  private final EntityChunkLinker entityChunkLinker;
  private final StatisticsCalculator statisticsCalculator;
  private final PageWorkerPool pageWorkerPool;
  private final KnowledgeBaseWriter knowledgeBaseWriter;
  private final Optional<EmbeddingClient> embeddingClient;
  private final ManualKbConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a document on the document executor.
   *
   * @param pdf PDF file
   * @param documentId document id, generated when null
   * @return future completed with the processing result
   */
  @Async("documentProcessingExecutor")
  public CompletableFuture<ProcessingResult> processAsync(Path pdf, UUID documentId) {
    return CompletableFuture.completedFuture(process(pdf, documentId, null));
  }

  public ProcessingResult process(Path pdf, UUID documentId) {
    return process(pdf, documentId, null);
  }

  /**
   * Processes a document.
   *
   * @param pdf PDF file
   * @param documentId document id, generated when null
   * @param manufacturer manufacturer override; null or {@code AUTO} uses the configured setting
   * @return result of the run; {@link ProcessingResult#success()} is false only when no text
   *     could be extracted
   */
  public ProcessingResult process(Path pdf, UUID documentId, String manufacturer) {
    Timer.Sample sample = Timer.start(meterRegistry);
    ProcessingResult result = processDocument(pdf, documentId, manufacturer);
    sample.stop(
        Timer.builder("document.process")
            .description("Time to process a manual")
            .tag("status", result.status().name().toLowerCase(Locale.ROOT))
            .register(meterRegistry));
    return result;
  }

  private ProcessingResult processDocument(Path pdf, UUID documentId, String manufacturer) {
    UUID id = documentId != null ? documentId : UUID.randomUUID();
    long started = System.currentTimeMillis();
    List<ValidationIssue> issues = new ArrayList<>();
    log.info("Processing {} as document {}", pdf.getFileName(), id);

    // --- 1. Text extraction (fatal) ---
    TextExtractionResult extraction = extractText(pdf, id, issues);
    if (extraction == null) {
      meterRegistry.counter("document.processing.failure").increment();
      return ProcessingResult.failed(
          id, issues.get(0).message(), issues, System.currentTimeMillis() - started);
    }
    if (!extraction.hasText()) {
      meterRegistry.counter("document.processing.failure").increment();
      return ProcessingResult.failed(
          id, "No text extracted from document", issues, System.currentTimeMillis() - started);
    }
    DocumentMetadata metadata = extraction.metadata();
    if (metadata.pagesFailed() > 0) {
      issues.add(
          new ValidationIssue(
              "text_extraction",
              "pages_failed",
              String.valueOf(metadata.pagesFailed()),
              metadata.pagesFailed() + " pages yielded no text",
              IssueSeverity.WARNING));
    }

    // --- 2. Manufacturer ---
    ManufacturerDetection detection =
        stage(
            "manufacturer_detection",
            issues,
            () -> resolveManufacturer(extraction, manufacturer),
            ManufacturerDetection.none());
    String mfr = detection.manufacturer();

    // --- 3-6. Entities ---
    List<ProductModel> products =
        stage(
            "product_extraction",
            issues,
            () -> extractProducts(extraction, mfr, issues),
            List.of());
    List<Part> parts =
        stage("parts_extraction", issues, () -> extractParts(extraction, mfr, issues), List.of());
    List<ErrorCode> errorCodes =
        stage(
            "error_code_extraction",
            issues,
            () -> extractErrorCodes(extraction, mfr, issues),
            List.of());
    List<DocumentVersion> versions =
        stage(
            "version_extraction",
            issues,
            () -> extractVersions(extraction, mfr, issues),
            List.of());

    // --- 7. Images and links ---
    List<PageImage> images =
        stage("image_extraction", issues, () -> extractImages(pdf, id, issues), List.of());
    LinkExtractor.LinkExtraction links =
        stage(
            "link_extraction",
            issues,
            () -> linkExtractor.extract(pdf, extraction.pageTexts()),
            new LinkExtractor.LinkExtraction(List.of(), List.of()));

    // --- 8-9. Chunks ---
    List<TextChunk> chunks =
        stage(
            "chunking",
            issues,
            () -> smartChunker.deduplicate(smartChunker.chunk(extraction.pageTexts(), id)),
            List.of());

    // --- 10. Link error codes to chunks ---
    List<ErrorCode> linkedCodes =
        stage(
            "entity_linking",
            issues,
            () -> entityChunkLinker.link(errorCodes, chunks),
            errorCodes);

    Map<String, float[]> embeddings =
        stage("embedding", issues, () -> embedChunks(chunks), Map.of());

    // --- 11. Statistics ---
    ProcessingResult draft =
        ProcessingResult.builder()
            .success(true)
            .status(DocumentStatus.COMPLETED)
            .documentId(id)
            .metadata(metadata)
            .manufacturer(detection)
            .products(products)
            .parts(parts)
            .errorCodes(linkedCodes)
            .versions(versions)
            .chunks(chunks)
            .images(images)
            .links(links.links())
            .videos(links.videos())
            .validationIssues(issues)
            .processingTimeMillis(System.currentTimeMillis() - started)
            .build();
    ProcessingStatistics statistics =
        stage(
            "statistics",
            issues,
            () -> statisticsCalculator.calculate(draft, extraction.pageTexts()),
            null);
    ProcessingResult result =
        draft.toBuilder()
            .clearValidationIssues()
            .validationIssues(issues)
            .statistics(statistics)
            .build();

    // --- 12. Persistence ---
    try {
      knowledgeBaseWriter.write(result, embeddings);
    } catch (PersistenceFailureException e) {
      log.warn("Persistence of document {} failed: {}", id, e.getMessage());
      result =
          result.toBuilder()
              .validationIssue(
                  new ValidationIssue(
                      "persistence",
                      e.getKind() == null ? "persistence" : e.getKind().name(),
                      e.getNaturalKey(),
                      e.getMessage(),
                      IssueSeverity.ERROR))
              .build();
    }

    recordMetrics(result);
    log.info(
        "Processed document {} in {} ms: {} products, {} parts, {} error codes, {} chunks,"
            + " {} issues",
        id,
        System.currentTimeMillis() - started,
        result.products().size(),
        result.parts().size(),
        result.errorCodes().size(),
        result.chunks().size(),
        result.validationIssues().size());
    return result;
  }

  // ---- private helpers ----

  /** Runs text extraction; null when no backend produced any text. */
  private TextExtractionResult extractText(Path pdf, UUID id, List<ValidationIssue> issues) {
    try {
      return textExtractionEngine.extract(pdf, id);
    } catch (ExtractionFailureException e) {
      log.error("No text extracted from {}: {}", pdf.getFileName(), e.getMessage());
      issues.add(ValidationIssue.stageFailure("text_extraction", e));
      return null;
    }
  }

  private <T> T stage(
      String name, List<ValidationIssue> issues, Supplier<T> body, T fallback) {
    try {
      return body.get();
    } catch (RuntimeException e) {
      log.warn("Stage {} failed, continuing without it: {}", name, e.getMessage());
      issues.add(ValidationIssue.stageFailure(name, e));
      return fallback;
    }
  }

  private ManufacturerDetection resolveManufacturer(
      TextExtractionResult extraction, String override) {
    String requested =
        override == null || override.isBlank() ? config.getPipeline().getManufacturer() : override;
    if (requested != null && !requested.isBlank() && !AUTO.equalsIgnoreCase(requested)) {
      String canonical = manufacturerNormalizer.normalize(requested).orElse(requested);
      log.info("Using configured manufacturer {}", canonical);
      return ManufacturerDetection.configured(canonical);
    }
    DocumentMetadata metadata = extraction.metadata();
    return manufacturerDetector.detect(
        metadata.fileName(), metadata.author(), metadata.title(), extraction.pageTexts());
  }

  private List<ProductModel> extractProducts(
      TextExtractionResult extraction, String manufacturer, List<ValidationIssue> issues) {
    if (manufacturer == null) {
      return List.of();
    }
    String title = extraction.metadata().title();
    Map<Integer, String> pages =
        leadingPages(extraction, config.getPipeline().getProductPages());
    PageWorkerPool.PageResults<ProductModel> found =
        pageWorkerPool.run(
            "product_extraction",
            pages,
            (page, text) -> productExtractor.extract(text, page, manufacturer, title));
    issues.addAll(found.issues());
    List<ProductModel> products =
        keepBest(found.items(), p -> p.model().toUpperCase(Locale.ROOT), ProductModel::confidence);

    if (products.isEmpty()) {
      String sample = String.join("\n\n", pages.values());
      int firstPage = pages.keySet().stream().findFirst().orElse(1);
      products = productExtractor.extractWithInference(sample, firstPage, manufacturer);
    }
    if (products.isEmpty()) {
      products =
          productExtractor
              .extractFromFilename(extraction.metadata().fileName(), manufacturer)
              .map(List::of)
              .orElse(List.of());
    }
    log.info("Found {} product models", products.size());
    return products;
  }

  private List<Part> extractParts(
      TextExtractionResult extraction, String manufacturer, List<ValidationIssue> issues) {
    if (manufacturer == null) {
      return List.of();
    }
    PageWorkerPool.PageResults<Part> found =
        pageWorkerPool.run(
            "parts_extraction",
            extractionTexts(extraction),
            (page, text) -> partsExtractor.extract(text, page, manufacturer));
    issues.addAll(found.issues());
    List<Part> parts = keepBest(found.items(), Part::partNumber, Part::confidence);
    log.info("Found {} parts", parts.size());
    return parts;
  }

  private List<ErrorCode> extractErrorCodes(
      TextExtractionResult extraction, String manufacturer, List<ValidationIssue> issues) {
    if (manufacturer == null) {
      log.info("No manufacturer resolved, skipping error code extraction");
      return List.of();
    }
    if (!errorCodeExtractor.supports(manufacturer)) {
      throw new UnknownManufacturerException(manufacturer, "error code");
    }
    PageWorkerPool.PageResults<ErrorCode> found =
        pageWorkerPool.run(
            "error_code_extraction",
            extractionTexts(extraction),
            (page, text) -> errorCodeExtractor.extract(text, page, manufacturer).orElseThrow());
    issues.addAll(found.issues());
    List<ErrorCode> codes = keepBest(found.items(), ErrorCode::code, ErrorCode::confidence);

    if (config.getPipeline().isEnrichErrorCodes()) {
      codes = errorCodeExtractor.enrichFromDocument(codes, extraction.fullText(), manufacturer);
    }
    List<ErrorCode> valid = new ArrayList<>(codes.size());
    for (ErrorCode code : codes) {
      List<ValidationIssue> codeIssues = errorCodeExtractor.validate(code, manufacturer);
      issues.addAll(codeIssues);
      if (codeIssues.stream().noneMatch(ValidationIssue::isBlocking)) {
        valid.add(code);
      }
    }
    log.info(
        "Found {} error codes ({} rejected by validation)",
        valid.size(),
        codes.size() - valid.size());
    return valid;
  }

  private List<DocumentVersion> extractVersions(
      TextExtractionResult extraction, String manufacturer, List<ValidationIssue> issues) {
    PageWorkerPool.PageResults<DocumentVersion> found =
        pageWorkerPool.run(
            "version_extraction",
            leadingPages(extraction, config.getPipeline().getVersionPages()),
            (page, text) ->
                versionExtractor.extract(text, page, manufacturer).map(List::of).orElse(List.of()));
    issues.addAll(found.issues());
    Optional<DocumentVersion> best = VersionExtractor.best(found.items());
    best.ifPresent(v -> log.info("Document version {} (page {})", v.version(), v.pageNumber()));
    return best.map(List::of).orElse(List.of());
  }

  private List<PageImage> extractImages(Path pdf, UUID id, List<ValidationIssue> issues) {
    List<PageImage> images;
    try {
      images = pdfImageExtractor.extract(pdf);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          id, "Could not read images of " + pdf.getFileName() + ": " + e.getMessage(), e);
    }
    if (images.isEmpty()) {
      return images;
    }
    ImageStorageService.StoredImages stored = imageStorageService.store(images);
    issues.addAll(stored.issues());
    return stored.images();
  }

  private Map<String, float[]> embedChunks(List<TextChunk> chunks) {
    if (!config.getPipeline().isEmbeddingsEnabled()
        || embeddingClient.isEmpty()
        || chunks.isEmpty()) {
      return Map.of();
    }
    List<float[]> vectors =
        embeddingClient.get().embed(chunks.stream().map(TextChunk::text).toList());
    if (vectors.size() != chunks.size()) {
      throw new IllegalStateException(
          "Expected " + chunks.size() + " embeddings, got " + vectors.size());
    }
    Map<String, float[]> byKey = new LinkedHashMap<>();
    for (int i = 0; i < chunks.size(); i++) {
      byKey.put(chunks.get(i).naturalKey(), vectors.get(i));
    }
    return byKey;
  }

  private void recordMetrics(ProcessingResult result) {
    meterRegistry.counter("document.processing.success").increment();
    count(EntityKind.PRODUCT, result.products().size());
    count(EntityKind.PART, result.parts().size());
    count(EntityKind.ERROR_CODE, result.errorCodes().size());
    count(EntityKind.VERSION, result.versions().size());
    count(EntityKind.CHUNK, result.chunks().size());
    count(EntityKind.IMAGE, result.images().size());
    count(EntityKind.LINK, result.links().size());
    count(EntityKind.VIDEO, result.videos().size());
  }

  private void count(EntityKind kind, int amount) {
    meterRegistry
        .counter("entities.extracted", "kind", kind.name().toLowerCase(Locale.ROOT))
        .increment(amount);
  }

  private static Map<Integer, String> extractionTexts(TextExtractionResult extraction) {
    Map<Integer, String> texts = new LinkedHashMap<>();
    for (Integer page : extraction.pageTexts().keySet()) {
      texts.put(page, extraction.extractionText(page));
    }
    return texts;
  }

  /** First {@code limit} pages in page order; all pages when the limit is not positive. */
  private static Map<Integer, String> leadingPages(TextExtractionResult extraction, int limit) {
    Map<Integer, String> texts = extractionTexts(extraction);
    if (limit <= 0) {
      return texts;
    }
    return texts.entrySet().stream()
        .limit(limit)
        .collect(
            Collectors.toMap(
                Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
  }

  /**
   * Keeps one entity per key: highest confidence, earliest occurrence on ties. The result is
   * sorted by confidence, descending.
   */
  private static <T> List<T> keepBest(
      List<T> entities, Function<T, String> key, ToDoubleFunction<T> score) {
    Map<String, T> best = new LinkedHashMap<>();
    for (T entity : entities) {
      best.merge(
          key.apply(entity),
          entity,
          (existing, candidate) ->
              score.applyAsDouble(candidate) > score.applyAsDouble(existing)
                  ? candidate
                  : existing);
    }
    return best.values().stream()
        .sorted(Comparator.comparingDouble(score).reversed())
        .toList();
  }
}
