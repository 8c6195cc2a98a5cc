package com.flamingo.ai.manualkb.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LanguageDetectionServiceTest {

  private static final String ENGLISH =
      "This service manual describes how to maintain and repair the printer. Before you start,"
          + " turn the printer off and disconnect the power cord. Open the front door and remove"
          + " the toner cartridge carefully. Clean the transfer roller with a dry cloth and check"
          + " the pickup roller for wear. When the paper jams repeatedly, replace the separation"
          + " pad and the pickup roller together. Always use genuine replacement parts.";

  private static final String GERMAN =
      "Dieses Wartungshandbuch beschreibt, wie der Drucker gewartet und repariert wird. Bevor"
          + " Sie beginnen, schalten Sie den Drucker aus und ziehen Sie das Netzkabel. Öffnen Sie"
          + " die vordere Klappe und entnehmen Sie vorsichtig die Tonerkartusche. Reinigen Sie die"
          + " Transferwalze mit einem trockenen Tuch und prüfen Sie die Einzugsrolle auf"
          + " Verschleiß."
          + " Verwenden Sie immer Originalersatzteile.";

  private ManualKbConfig config;
  private LanguageDetectionService service;

  @BeforeEach
  void setUp() {
    config = new ManualKbConfig();
    service = new LanguageDetectionService(config);
  }

  @Test
  @DisplayName("Should detect English and German manuals")
  void shouldDetectLanguage() {
    DetectedLanguage english = service.detect(new TreeMap<>(Map.of(1, ENGLISH, 2, ENGLISH)));
    DetectedLanguage german = service.detect(Map.of(1, GERMAN));

    assertThat(english.language()).isEqualTo("en");
    assertThat(english.confidence()).isGreaterThanOrEqualTo(0.8);
    assertThat(german.language()).isEqualTo("de");
  }

  @Test
  @DisplayName("Should report unknown when disabled or given no text")
  void shouldReturnUnknown_whenDisabledOrEmpty() {
    assertThat(service.detect(Map.of()).isKnown()).isFalse();
    assertThat(service.detect(Map.of(1, "   ")).isKnown()).isFalse();

    config.getLanguage().setEnabled(false);
    assertThat(service.detect(Map.of(1, ENGLISH))).isEqualTo(DetectedLanguage.unknown());
  }

  @Test
  @DisplayName("Should sample a bounded number of pages and characters")
  void shouldBoundSample() {
    String sample =
        LanguageDetectionService.buildSample(
            new TreeMap<>(Map.of(1, "aaaa", 2, "bbbb", 3, "cccc")), 2, 100);
    String truncated = LanguageDetectionService.buildSample(Map.of(1, "a".repeat(50)), 5, 10);

    assertThat(sample).contains("aaaa").doesNotContain("cccc");
    assertThat(truncated).hasSize(10);
  }
}
