package com.flamingo.ai.manualkb.domain.repository;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.model.PersistedRecord;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/** Process-local repository; records keep their first insertion order. */
@Repository
@Slf4j
public class InMemoryKnowledgeBaseRepository implements KnowledgeBaseRepository {

  private final Map<EntityKind, Map<String, PersistedRecord>> records =
      new EnumMap<>(EntityKind.class);

  @Override
  public synchronized boolean upsert(PersistedRecord record) {
    Objects.requireNonNull(record, "record");
    PersistedRecord previous =
        records
            .computeIfAbsent(record.kind(), kind -> new LinkedHashMap<>())
            .put(record.naturalKey(), record);
    if (previous != null) {
      log.debug("Replaced {} record {}", record.kind(), record.naturalKey());
    }
    return previous == null;
  }

  @Override
  public synchronized Optional<PersistedRecord> find(EntityKind kind, String naturalKey) {
    return Optional.ofNullable(records.getOrDefault(kind, Map.of()).get(naturalKey));
  }

  @Override
  public synchronized List<PersistedRecord> findAll(EntityKind kind) {
    return List.copyOf(records.getOrDefault(kind, Map.of()).values());
  }

  @Override
  public synchronized List<PersistedRecord> findByDocument(UUID documentId) {
    List<PersistedRecord> owned = new ArrayList<>();
    for (Map<String, PersistedRecord> byKey : records.values()) {
      byKey.values().stream()
          .filter(r -> Objects.equals(documentId, r.documentId()))
          .forEach(owned::add);
    }
    return owned;
  }

  @Override
  public synchronized long count(EntityKind kind) {
    return records.getOrDefault(kind, Map.of()).size();
  }
}
