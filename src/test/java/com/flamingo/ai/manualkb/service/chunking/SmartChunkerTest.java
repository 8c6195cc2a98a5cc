package com.flamingo.ai.manualkb.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.ChunkType;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SmartChunkerTest {

  private static final UUID DOCUMENT_ID = UUID.fromString("6f1c1d1e-0000-4000-8000-000000000001");

  private ManualKbConfig config;
  private SmartChunker chunker;

  @BeforeEach
  void setUp() {
    config = new ManualKbConfig();
    chunker = new SmartChunker(config);
  }

  private static String sentences(int count) {
    return IntStream.rangeClosed(1, count)
        .mapToObj(i -> "Sentence " + i + " explains one maintenance detail.")
        .collect(Collectors.joining(" "));
  }

  @Nested
  @DisplayName("chunk")
  class Chunk {

    @Test
    @DisplayName("Should respect size and overlap bounds and keep indices contiguous")
    void shouldBoundChunks() {
      // Given
      config.getChunking().setSize(100);
      config.getChunking().setOverlap(20);
      String text = sentences(50);

      // When
      List<TextChunk> chunks = chunker.chunk(Map.of(1, text), DOCUMENT_ID);

      // Then
      assertThat(chunks).hasSizeGreaterThan(10);
      assertThat(chunks).allSatisfy(
          c -> {
            assertThat(c.text().length()).isLessThanOrEqualTo(100 + 20 + 1);
            assertThat(c.pageStart()).isEqualTo(1);
            assertThat(c.pageEnd()).isEqualTo(1);
            assertThat(c.documentId()).isEqualTo(DOCUMENT_ID);
            assertThat(c.fingerprint()).isEqualTo(SmartChunker.fingerprint(c.text()));
          });
      assertThat(chunks)
          .extracting(TextChunk::chunkIndex)
          .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());
    }

    @Test
    @DisplayName("Should cover the source sentences and carry an overlap into the next chunk")
    void shouldCoverSourceText() {
      // Given
      config.getChunking().setSize(100);
      config.getChunking().setOverlap(20);

      // When
      List<TextChunk> chunks = chunker.chunk(Map.of(1, sentences(50)), DOCUMENT_ID);

      // Then
      String joined = chunks.stream().map(TextChunk::text).collect(Collectors.joining(" "));
      long covered =
          IntStream.rangeClosed(1, 50)
              .filter(i -> joined.contains("Sentence " + i + " explains"))
              .count();
      assertThat(covered).isGreaterThanOrEqualTo(40);
      for (int i = 1; i < chunks.size(); i++) {
        String tail = SmartChunker.overlapTail(chunks.get(i - 1).text(), 20);
        assertThat(chunks.get(i).text()).startsWith(tail);
      }
    }

    @Test
    @DisplayName("Should produce identical chunks for identical input")
    void shouldBeDeterministic() {
      config.getChunking().setSize(200);
      config.getChunking().setOverlap(30);
      Map<Integer, String> pages = Map.of(1, sentences(20), 2, sentences(15), 3, sentences(5));

      List<String> first =
          chunker.chunk(pages, DOCUMENT_ID).stream().map(TextChunk::fingerprint).toList();
      List<String> second =
          chunker.chunk(pages, DOCUMENT_ID).stream().map(TextChunk::fingerprint).toList();

      assertThat(first).isNotEmpty().containsExactlyElementsOf(second);
    }

    @Test
    @DisplayName("Should let a chunk span consecutive pages")
    void shouldSpanPages() {
      // Given
      String pageOne =
          "The fuser heats the toner so that it bonds to the paper. It is located at the rear"
              + " of the printer.";
      String pageTwo =
          "The transfer roller moves the toner image from the drum onto the paper as it passes"
              + " underneath.";

      // When
      List<TextChunk> chunks = chunker.chunk(Map.of(2, pageOne, 3, pageTwo), DOCUMENT_ID);

      // Then
      assertThat(chunks).singleElement().satisfies(
          c -> {
            assertThat(c.pageStart()).isEqualTo(2);
            assertThat(c.pageEnd()).isEqualTo(3);
            assertThat(c.coversPage(3)).isTrue();
            assertThat(c.text()).contains("fuser").contains("transfer roller");
            assertThat(c.chunkType()).isEqualTo(ChunkType.INTRODUCTION);
            assertThat(c.metadata())
                .containsEntry("char_count", c.text().length())
                .containsEntry("has_error_codes", false)
                .containsEntry("chunk_type", "introduction");
          });
    }

    @Test
    @DisplayName("Should drop chunks below the minimum size")
    void shouldDropTinyChunks() {
      assertThat(chunker.chunk(Map.of(1, "Too short."), DOCUMENT_ID)).isEmpty();
      assertThat(chunker.chunk(Map.of(), DOCUMENT_ID)).isEmpty();
    }
  }

  @Nested
  @DisplayName("classify")
  class Classify {

    @Test
    @DisplayName("Should classify chunks from their dominant cues")
    void shouldClassifyByCues() {
      assertThat(SmartChunker.classify("Event 13.A1.B2 Paper jam in tray 2", false))
          .isEqualTo(ChunkType.ERROR_CODE);
      assertThat(SmartChunker.classify("Error 49.38 occurs after an update", false))
          .isEqualTo(ChunkType.ERROR_CODE);
      assertThat(SmartChunker.classify("Symptom: noise. Cause: worn gear. Remedy: swap", false))
          .isEqualTo(ChunkType.TROUBLESHOOTING);
      assertThat(SmartChunker.classify("1. Open the door\n2. Remove the drum", false))
          .isEqualTo(ChunkType.PROCEDURE);
      assertThat(SmartChunker.classify("Weight 20 kg and dimension 400 mm", false))
          .isEqualTo(ChunkType.SPECIFICATION);
      assertThat(SmartChunker.classify("Plain running text about the printer", true))
          .isEqualTo(ChunkType.INTRODUCTION);
      assertThat(SmartChunker.classify("Plain running text about the printer", false))
          .isEqualTo(ChunkType.TEXT);
    }
  }

  @Nested
  @DisplayName("overlap and fingerprints")
  class OverlapAndFingerprint {

    @Test
    @DisplayName("Should start the overlap tail on a word boundary")
    void shouldCutTailAtWordBoundary() {
      assertThat(SmartChunker.overlapTail("alpha beta gamma delta", 8)).isEqualTo("delta");
      assertThat(SmartChunker.overlapTail("abc", 10)).isEqualTo("abc");
      assertThat(SmartChunker.overlapTail("abcdefghij", 4)).isEqualTo("ghij");
      assertThat(SmartChunker.overlapTail("alpha beta", 0)).isEmpty();
    }

    @Test
    @DisplayName("Should fingerprint normalized text as 16 hex characters")
    void shouldFingerprintNormalizedText() {
      String fingerprint = SmartChunker.fingerprint("Hello   World\n");

      assertThat(fingerprint).hasSize(16).matches("[0-9a-f]{16}");
      assertThat(SmartChunker.fingerprint("hello world")).isEqualTo(fingerprint);
      assertThat(SmartChunker.fingerprint("hello there")).isNotEqualTo(fingerprint);
    }

    @Test
    @DisplayName("Should drop repeated chunks and re-index the rest")
    void shouldDeduplicate() {
      // Given
      TextChunk a = chunk(0, "Remove the fuser before cleaning.");
      TextChunk b = chunk(1, "Install the new fuser.");
      TextChunk repeat = chunk(2, "remove the   fuser before cleaning.");
      TextChunk c = chunk(3, "Restart the printer.");

      // When
      List<TextChunk> unique = chunker.deduplicate(List.of(a, b, repeat, c));

      // Then
      assertThat(unique).extracting(TextChunk::text)
          .containsExactly(a.text(), b.text(), c.text());
      assertThat(unique).extracting(TextChunk::chunkIndex).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Should reject a page span that ends before it starts")
    void shouldRejectInvertedPageSpan() {
      assertThatThrownBy(
              () ->
                  TextChunk.builder()
                      .documentId(DOCUMENT_ID)
                      .pageStart(4)
                      .pageEnd(3)
                      .text("x")
                      .build())
          .isInstanceOf(IllegalArgumentException.class);
    }

    private TextChunk chunk(int index, String text) {
      return TextChunk.builder()
          .chunkIndex(index)
          .documentId(DOCUMENT_ID)
          .pageStart(1)
          .pageEnd(1)
          .text(text)
          .fingerprint(SmartChunker.fingerprint(text))
          .chunkType(ChunkType.TEXT)
          .build();
    }
  }
}
