package com.flamingo.ai.manualkb.service.persistence;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.model.DocumentMetadata;
import com.flamingo.ai.manualkb.domain.model.ExtractedEntity;
import com.flamingo.ai.manualkb.domain.model.PersistedRecord;
import com.flamingo.ai.manualkb.domain.model.ProcessingResult;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import com.flamingo.ai.manualkb.domain.repository.KnowledgeBaseRepository;
import com.flamingo.ai.manualkb.exception.PersistenceFailureException;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes the outcome of a pipeline run to the knowledge base.
 *
 * <p>Every record is an upsert under its natural key, which makes a retried batch safe: records
 * written before the failure are simply replaced by identical ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseWriter {

  static final String RETRY_NAME = "knowledgeBase";

  private final KnowledgeBaseRepository repository;
  private final MeterRegistry meterRegistry;

  /**
   * Persists a successful processing result.
   *
   * @param result pipeline result
   * @param chunkEmbeddings embedding vectors keyed by chunk natural key, may be empty
   * @return counts of inserted and replaced records
   * @throws PersistenceFailureException when a record cannot be written after all retries
   */
  @Timed(value = "knowledge_base.write", description = "Time to persist a processed manual")
  @Retry(name = RETRY_NAME, fallbackMethod = "writeFallback")
  public PersistenceSummary write(ProcessingResult result, Map<String, float[]> chunkEmbeddings) {
    List<PersistedRecord> records = records(result, chunkEmbeddings);
    int inserted = 0;
    for (PersistedRecord record : records) {
      try {
        if (repository.upsert(record)) {
          inserted++;
        }
      } catch (RuntimeException e) {
        throw new PersistenceFailureException(
            record.kind(),
            record.naturalKey(),
            "Failed to write " + record.kind() + " " + record.naturalKey(),
            e);
      }
      String kind = record.kind().name().toLowerCase(Locale.ROOT);
      meterRegistry.counter("persistence.records.written", "kind", kind).increment();
    }
    PersistenceSummary summary = new PersistenceSummary(inserted, records.size() - inserted);
    log.info(
        "Persisted document {}: {} records inserted, {} replaced",
        result.documentId(),
        summary.inserted(),
        summary.replaced());
    return summary;
  }

  /**
   * Builds every record of a result: the document first, then entities, chunks, images, links and
   * videos.
   */
  public static List<PersistedRecord> records(
      ProcessingResult result, Map<String, float[]> chunkEmbeddings) {
    UUID documentId = result.documentId();
    String manufacturer =
        result.manufacturer() == null ? null : result.manufacturer().manufacturer();

    List<PersistedRecord> records = new ArrayList<>();
    records.add(documentRecord(result, manufacturer));
    List<ExtractedEntity> entities = new ArrayList<>(result.products());
    entities.addAll(result.parts());
    entities.addAll(result.errorCodes());
    entities.addAll(result.versions());
    entities.forEach(entity -> records.add(entity.toRecord(documentId, manufacturer)));
    for (TextChunk chunk : result.chunks()) {
      records.add(withEmbedding(chunk.toRecord(), chunkEmbeddings.get(chunk.naturalKey())));
    }
    result.images().forEach(image -> records.add(image.toRecord(documentId)));
    result.links().forEach(link -> records.add(link.toRecord(documentId)));
    result.videos().forEach(video -> records.add(video.toRecord(documentId)));
    return records;
  }

  // ---- private helpers ----

  @SuppressWarnings("unused")
  private PersistenceSummary writeFallback(
      ProcessingResult result, Map<String, float[]> chunkEmbeddings, Exception e) {
    log.error("Giving up persisting document {}: {}", result.documentId(), e.getMessage());
    if (e instanceof PersistenceFailureException failure) {
      throw failure;
    }
    throw new PersistenceFailureException(
        EntityKind.DOCUMENT,
        String.valueOf(result.documentId()),
        "Failed to persist document " + result.documentId(),
        e);
  }

  private static PersistedRecord documentRecord(ProcessingResult result, String manufacturer) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    DocumentMetadata metadata = result.metadata();
    if (metadata != null) {
      attributes.put("filename", metadata.fileName());
      attributes.put("title", metadata.title());
      attributes.put("author", metadata.author());
      attributes.put(
          "creation_date",
          metadata.creationDate() == null ? null : metadata.creationDate().toString());
      attributes.put("page_count", metadata.pageCount());
      attributes.put("file_size", metadata.fileSize());
      attributes.put(
          "document_type",
          metadata.documentType() == null ? null : metadata.documentType().getValue());
      attributes.put("language", metadata.language());
      attributes.put("language_confidence", metadata.languageConfidence());
      attributes.put(
          "engine_used", metadata.engineUsed() == null ? null : metadata.engineUsed().getValue());
      attributes.put("fallback_used", metadata.fallbackUsed());
      attributes.put("pages_failed", metadata.pagesFailed());
    }
    attributes.put("manufacturer", manufacturer);
    attributes.put(
        "manufacturer_score", result.manufacturer() == null ? 0.0 : result.manufacturer().score());
    attributes.put(
        "version", result.primaryVersion() == null ? null : result.primaryVersion().version());
    attributes.put("processing_status", result.status() == null ? null : result.status().name());
    attributes.put("processing_time_ms", result.processingTimeMillis());
    attributes.put("chunk_count", result.chunks().size());
    attributes.put("validation_issue_count", result.validationIssues().size());
    return new PersistedRecord(
        EntityKind.DOCUMENT, String.valueOf(result.documentId()), result.documentId(), attributes);
  }

  private static PersistedRecord withEmbedding(PersistedRecord record, float[] embedding) {
    if (embedding == null) {
      return record;
    }
    Map<String, Object> attributes = new LinkedHashMap<>(record.attributes());
    attributes.put("embedding", embedding.clone());
    return new PersistedRecord(
        record.kind(), record.naturalKey(), record.documentId(), attributes);
  }

  // ---- inner types ----

  /**
   * Outcome of a write.
   *
   * @param inserted records that did not exist before
   * @param replaced records that overwrote an existing one
   */
  public record PersistenceSummary(int inserted, int replaced) {}
}
