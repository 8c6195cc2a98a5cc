package com.flamingo.ai.manualkb.domain.repository;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.model.PersistedRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store for knowledge base records. Writes are upserts keyed by {@code (kind, naturalKey)}, so
 * processing the same document twice leaves exactly one record per key.
 */
public interface KnowledgeBaseRepository {

  /**
   * Inserts a record or replaces the one stored under the same kind and natural key.
   *
   * @return true when the record was new
   */
  boolean upsert(PersistedRecord record);

  Optional<PersistedRecord> find(EntityKind kind, String naturalKey);

  List<PersistedRecord> findAll(EntityKind kind);

  List<PersistedRecord> findByDocument(UUID documentId);

  long count(EntityKind kind);
}
