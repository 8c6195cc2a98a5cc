package com.flamingo.ai.manualkb.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StructuredLayoutScannerTest {

  private ManualKbConfig config;
  private StructuredLayoutScanner scanner;

  @BeforeEach
  void setUp() {
    config = new ManualKbConfig();
    scanner = new StructuredLayoutScanner(config);
  }

  @Test
  @DisplayName("Should keep only lines carrying an error code and drop dot leaders")
  void shouldKeepCodeLines() {
    // Given
    List<PositionedLine> lines =
        List.of(
            new PositionedLine(700f, "Error code table"),
            new PositionedLine(686f, "13.A1.B2 ............ Paper jam in tray 2"),
            new PositionedLine(672f, "Remove the jammed paper"),
            new PositionedLine(658f, "49.38.07 …… Firmware error"));

    // When
    List<String> kept = scanner.scanLines(lines);

    // Then
    assertThat(kept).containsExactly("13.A1.B2 Paper jam in tray 2", "49.38.07 Firmware error");
  }

  @Test
  @DisplayName("Should recognize codes split by stray spaces")
  void shouldMatchCodeWithSpaces() {
    Optional<String> text = scanner.scan(List.of(new PositionedLine(1f, "13. A1 .B2 Jam")));

    assertThat(text).contains("13. A1 .B2 Jam");
  }

  @Test
  @DisplayName("Should deduplicate lines and respect the line cap")
  void shouldCapLines() {
    // Given
    config.getStructuredScan().setMaxLines(3);
    List<PositionedLine> lines = new ArrayList<>();
    lines.add(new PositionedLine(10f, "10.00.01 First"));
    lines.add(new PositionedLine(11f, "10.00.01 First"));
    for (int i = 2; i < 10; i++) {
      lines.add(new PositionedLine(10f + i, "10.00.0" + i + " Entry " + i));
    }

    // When
    List<String> kept = scanner.scanLines(lines);

    // Then
    assertThat(kept).hasSize(3).doesNotHaveDuplicates();
    assertThat(kept.get(0)).isEqualTo("10.00.01 First");
  }

  @Test
  @DisplayName("Should truncate long lines with an ellipsis")
  void shouldTruncateLongLines() {
    // Given
    config.getStructuredScan().setMaxLineLength(20);
    String longLine = "13.A1.B2 " + "very long description ".repeat(5);

    // When
    List<String> kept = scanner.scanLines(List.of(new PositionedLine(1f, longLine)));

    // Then
    assertThat(kept).singleElement().satisfies(
        line -> {
          assertThat(line).hasSizeLessThanOrEqualTo(20).endsWith("…");
          assertThat(line).startsWith("13.A1.B2");
        });
  }

  @Test
  @DisplayName("Should return nothing when no line has a code")
  void shouldReturnEmpty_whenNoCodes() {
    assertThat(scanner.scan(List.of(new PositionedLine(1f, "Chapter 4 Maintenance")))).isEmpty();
    assertThat(scanner.scan(List.of())).isEmpty();
  }
}
