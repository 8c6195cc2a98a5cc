package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Normalized record handed to the knowledge base repository.
 *
 * @param kind entity kind
 * @param naturalKey business key used for idempotent upserts
 * @param documentId owning document (null for records shared across documents)
 * @param attributes column values in insertion order
 */
public record PersistedRecord(
    EntityKind kind, String naturalKey, UUID documentId, Map<String, Object> attributes) {

  public PersistedRecord {
    if (naturalKey == null || naturalKey.isBlank()) {
      throw new IllegalArgumentException("Natural key is required for " + kind);
    }
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
