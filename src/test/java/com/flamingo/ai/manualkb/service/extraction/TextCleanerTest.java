package com.flamingo.ai.manualkb.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextCleanerTest {

  @Test
  @DisplayName("Should collapse horizontal whitespace and trim lines")
  void shouldCollapseWhitespace() {
    String cleaned = TextCleaner.clean("  Fuser   unit\t\tassembly  \r\n   Replace  it  ");

    assertThat(cleaned).isEqualTo("Fuser unit assembly\nReplace it");
  }

  @Test
  @DisplayName("Should keep paragraph breaks but collapse longer runs of blank lines")
  void shouldCollapseBlankLines() {
    String cleaned = TextCleaner.clean("First paragraph\n\n\n\n\nSecond paragraph\n\nThird");

    assertThat(cleaned).isEqualTo("First paragraph\n\nSecond paragraph\n\nThird");
  }

  @Test
  @DisplayName("Should strip NUL characters and return empty text for null input")
  void shouldHandleNulAndNull() {
    assertThat(TextCleaner.clean("Err\u0000or 13.A1.B2")).isEqualTo("Error 13.A1.B2");
    assertThat(TextCleaner.clean(null)).isEmpty();
    assertThat(TextCleaner.clean(" \n \n ")).isEmpty();
  }
}
