package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.UUID;

/**
 * Common contract of entities produced by the pattern-based extractors.
 *
 * <p>Each variant serializes itself through {@link #toRecord(UUID, String)}; callers never inspect
 * the concrete type to build persistence rows.
 */
public interface ExtractedEntity {

  /** Page sentinel for entities derived from the filename rather than page text. */
  int FILENAME_PAGE = 0;

  EntityKind kind();

  /** Confidence in [0,1]. */
  double confidence();

  /** 1-based page number, or {@link #FILENAME_PAGE}. */
  int pageNumber();

  /** Tag naming the extraction technique (pattern name, {@code filename_parsing}, ...). */
  String extractionMethod();

  String context();

  /**
   * Key under which the entity is deduplicated and upserted.
   *
   * @param documentId owning document
   * @param manufacturer canonical manufacturer name, may be null
   * @return natural key
   */
  String naturalKey(UUID documentId, String manufacturer);

  /**
   * Serializes the entity into a repository record.
   *
   * @param documentId owning document
   * @param manufacturer canonical manufacturer name, may be null
   * @return record with all persisted fields
   */
  PersistedRecord toRecord(UUID documentId, String manufacturer);
}
