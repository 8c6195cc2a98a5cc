package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.enums.Severity;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * An error code recovered from manual text.
 *
 * @param code code as printed, e.g. {@code 13.A1.B2}
 * @param description short human-readable description
 * @param solution remediation text, null when none was recovered
 * @param severity keyword-derived severity
 * @param confidence score in [0,1]
 * @param pageNumber 1-based page
 * @param context text window around the match
 * @param extractionMethod rule that matched
 * @param chunkKey natural key of the chunk covering the page, null until linked
 */
@Builder(toBuilder = true)
public record ErrorCode(
    String code,
    String description,
    String solution,
    Severity severity,
    double confidence,
    int pageNumber,
    String context,
    String extractionMethod,
    String chunkKey)
    implements ExtractedEntity {

  public ErrorCode {
    Confidence.requireValid(confidence);
    if (severity == null) {
      severity = Severity.MEDIUM;
    }
  }

  public boolean hasSolution() {
    return solution != null && !solution.isBlank();
  }

  public boolean isLinked() {
    return chunkKey != null;
  }

  public ErrorCode withChunkKey(String key) {
    return toBuilder().chunkKey(key).build();
  }

  @Override
  public EntityKind kind() {
    return EntityKind.ERROR_CODE;
  }

  @Override
  public String naturalKey(UUID documentId, String manufacturer) {
    return code + "|" + manufacturer + "|" + documentId;
  }

  @Override
  public PersistedRecord toRecord(UUID documentId, String manufacturer) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("error_code", code);
    attributes.put("manufacturer", manufacturer);
    attributes.put("error_description", description);
    attributes.put("solution_text", solution);
    attributes.put("severity_level", severity.getValue());
    attributes.put("confidence", confidence);
    attributes.put("page_number", pageNumber);
    attributes.put("context_text", context);
    attributes.put("extraction_method", extractionMethod);
    attributes.put("chunk_key", chunkKey);
    return new PersistedRecord(
        kind(), naturalKey(documentId, manufacturer), documentId, attributes);
  }
}
