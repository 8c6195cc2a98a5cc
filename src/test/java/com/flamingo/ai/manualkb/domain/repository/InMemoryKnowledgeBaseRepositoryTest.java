package com.flamingo.ai.manualkb.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.model.PersistedRecord;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryKnowledgeBaseRepositoryTest {

  private InMemoryKnowledgeBaseRepository repository;

  @BeforeEach
  void setUp() {
    repository = new InMemoryKnowledgeBaseRepository();
  }

  @Test
  @DisplayName("Should insert once and replace on the same natural key")
  void shouldUpsertByNaturalKey() {
    // Given
    UUID documentId = UUID.randomUUID();
    PersistedRecord first =
        new PersistedRecord(EntityKind.PART, "CF259A|HP Inc.", documentId, Map.of("v", 1));
    PersistedRecord second =
        new PersistedRecord(EntityKind.PART, "CF259A|HP Inc.", documentId, Map.of("v", 2));

    // When
    boolean firstInserted = repository.upsert(first);
    boolean secondInserted = repository.upsert(second);

    // Then
    assertThat(firstInserted).isTrue();
    assertThat(secondInserted).isFalse();
    assertThat(repository.count(EntityKind.PART)).isEqualTo(1);
    assertThat(repository.find(EntityKind.PART, "CF259A|HP Inc."))
        .hasValueSatisfying(r -> assertThat(r.attributes()).containsEntry("v", 2));
  }

  @Test
  @DisplayName("Should keep kinds apart and list records per document")
  void shouldSeparateKindsAndDocuments() {
    // Given
    UUID documentA = UUID.randomUUID();
    UUID documentB = UUID.randomUUID();
    repository.upsert(new PersistedRecord(EntityKind.LINK, "same-key", documentA, Map.of()));
    repository.upsert(new PersistedRecord(EntityKind.VIDEO, "same-key", documentA, Map.of()));
    repository.upsert(new PersistedRecord(EntityKind.LINK, "other-key", documentB, Map.of()));

    // When / Then
    assertThat(repository.count(EntityKind.LINK)).isEqualTo(2);
    assertThat(repository.count(EntityKind.VIDEO)).isEqualTo(1);
    assertThat(repository.count(EntityKind.CHUNK)).isZero();
    assertThat(repository.findAll(EntityKind.LINK))
        .extracting(PersistedRecord::naturalKey)
        .containsExactly("same-key", "other-key");
    assertThat(repository.findByDocument(documentA))
        .extracting(PersistedRecord::kind)
        .containsExactlyInAnyOrder(EntityKind.LINK, EntityKind.VIDEO);
    assertThat(repository.find(EntityKind.CHUNK, "same-key")).isEmpty();
  }

  @Test
  @DisplayName("Should reject records without a natural key")
  void shouldRejectBlankNaturalKey() {
    assertThatThrownBy(
            () -> new PersistedRecord(EntityKind.PART, " ", UUID.randomUUID(), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> repository.upsert(null)).isInstanceOf(NullPointerException.class);
  }
}
