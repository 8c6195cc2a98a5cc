package com.flamingo.ai.manualkb.service.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.flamingo.ai.manualkb.domain.enums.ChunkType;
import com.flamingo.ai.manualkb.domain.enums.ConfidenceTier;
import com.flamingo.ai.manualkb.domain.enums.DocumentStatus;
import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.enums.LinkType;
import com.flamingo.ai.manualkb.domain.enums.Severity;
import com.flamingo.ai.manualkb.domain.model.DocumentMetadata;
import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.domain.model.ExtractedLink;
import com.flamingo.ai.manualkb.domain.model.ManufacturerDetection;
import com.flamingo.ai.manualkb.domain.model.Part;
import com.flamingo.ai.manualkb.domain.model.PersistedRecord;
import com.flamingo.ai.manualkb.domain.model.ProcessingResult;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import com.flamingo.ai.manualkb.domain.repository.InMemoryKnowledgeBaseRepository;
import com.flamingo.ai.manualkb.exception.PersistenceFailureException;
import com.flamingo.ai.manualkb.service.persistence.KnowledgeBaseWriter.PersistenceSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KnowledgeBaseWriterTest {

  private static final UUID DOCUMENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000042");

  private InMemoryKnowledgeBaseRepository repository;
  private MeterRegistry meterRegistry;
  private KnowledgeBaseWriter writer;

  @BeforeEach
  void setUp() {
    repository = spy(new InMemoryKnowledgeBaseRepository());
    meterRegistry = new SimpleMeterRegistry();
    writer = new KnowledgeBaseWriter(repository, meterRegistry);
  }

  @Test
  @DisplayName("Should build the document record first, followed by entities and chunks")
  void shouldBuildRecordsInOrder() {
    // When
    List<PersistedRecord> records = KnowledgeBaseWriter.records(result(), Map.of());

    // Then
    assertThat(records)
        .extracting(PersistedRecord::kind)
        .containsExactly(
            EntityKind.DOCUMENT,
            EntityKind.PART,
            EntityKind.ERROR_CODE,
            EntityKind.CHUNK,
            EntityKind.LINK);
    PersistedRecord document = records.get(0);
    assertThat(document.naturalKey()).isEqualTo(DOCUMENT_ID.toString());
    assertThat(document.attributes())
        .containsEntry("filename", "HP_M607_SM.pdf")
        .containsEntry("manufacturer", "HP Inc.")
        .containsEntry("processing_status", "COMPLETED")
        .containsEntry("chunk_count", 1);
    assertThat(records.get(2).naturalKey()).isEqualTo("13.A1.B2|HP Inc.|" + DOCUMENT_ID);
  }

  @Test
  @DisplayName("Should attach embeddings to matching chunk records")
  void shouldAttachEmbeddings() {
    // Given
    ProcessingResult result = result();
    String chunkKey = result.chunks().get(0).naturalKey();
    float[] vector = {0.1f, 0.2f};

    // When
    List<PersistedRecord> records =
        KnowledgeBaseWriter.records(result, Map.of(chunkKey, vector));

    // Then
    PersistedRecord chunk =
        records.stream().filter(r -> r.kind() == EntityKind.CHUNK).findFirst().orElseThrow();
    assertThat((float[]) chunk.attributes().get("embedding")).containsExactly(0.1f, 0.2f);
  }

  @Test
  @DisplayName("Should insert on the first run and only replace on a second run")
  void shouldBeIdempotent() {
    // Given
    ProcessingResult result = result();

    // When
    PersistenceSummary first = writer.write(result, Map.of());
    PersistenceSummary second = writer.write(result, Map.of());

    // Then
    assertThat(first).isEqualTo(new PersistenceSummary(5, 0));
    assertThat(second).isEqualTo(new PersistenceSummary(0, 5));
    assertThat(repository.findByDocument(DOCUMENT_ID)).hasSize(5);
    assertThat(meterRegistry.counter("persistence.records.written", "kind", "part").count())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should report the record that could not be written")
  void shouldWrapRepositoryFailures() {
    // Given
    doThrow(new IllegalStateException("connection reset"))
        .when(repository)
        .upsert(argThat(r -> r.kind() == EntityKind.PART));

    // When / Then
    assertThatThrownBy(() -> writer.write(result(), Map.of()))
        .isInstanceOf(PersistenceFailureException.class)
        .hasRootCauseMessage("connection reset")
        .satisfies(
            e -> {
              PersistenceFailureException failure = (PersistenceFailureException) e;
              assertThat(failure.getKind()).isEqualTo(EntityKind.PART);
              assertThat(failure.getNaturalKey()).isEqualTo("CF259A|HP Inc.");
            });
    assertThat(repository.count(EntityKind.DOCUMENT)).isEqualTo(1);
  }

  private static ProcessingResult result() {
    TextChunk chunk =
        TextChunk.builder()
            .chunkIndex(0)
            .documentId(DOCUMENT_ID)
            .pageStart(1)
            .pageEnd(1)
            .text("Replace the fuser assembly CF259A when error 13.A1.B2 persists.")
            .fingerprint("f1")
            .chunkType(ChunkType.TEXT)
            .build();
    return ProcessingResult.builder()
        .success(true)
        .status(DocumentStatus.COMPLETED)
        .documentId(DOCUMENT_ID)
        .metadata(DocumentMetadata.builder().fileName("HP_M607_SM.pdf").pageCount(1).build())
        .manufacturer(
            new ManufacturerDetection("HP Inc.", 12.0, ConfidenceTier.HIGH, List.of(), Map.of()))
        .part(
            Part.builder()
                .partNumber("CF259A")
                .name("Toner cartridge")
                .confidence(0.9)
                .pageNumber(1)
                .extractionMethod("hp_pattern")
                .build())
        .errorCode(
            ErrorCode.builder()
                .code("13.A1.B2")
                .description("Paper jam in tray 2")
                .severity(Severity.MEDIUM)
                .confidence(0.7)
                .pageNumber(1)
                .extractionMethod("hp_pattern")
                .build())
        .chunk(chunk)
        .link(
            ExtractedLink.builder()
                .url("https://support.hp.com/")
                .pageNumber(1)
                .linkType(LinkType.SUPPORT)
                .category("support")
                .confidence(0.9)
                .source("text")
                .build())
        .build();
  }
}
