package com.flamingo.ai.manualkb.service.entity;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.manualkb.domain.enums.VersionType;
import com.flamingo.ai.manualkb.domain.model.DocumentVersion;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.RuleSetLoader;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class VersionExtractorTest {

  private static VersionExtractor extractor;

  @BeforeAll
  static void setUp() {
    ExtractionRules rules = new RuleSetLoader().loadDefaults();
    extractor = new VersionExtractor(rules, new ManufacturerNormalizer(rules));
  }

  @Test
  @DisplayName("Should prefer the HP edition-and-date pattern")
  void shouldExtractHpEdition() {
    // When
    Optional<DocumentVersion> version =
        extractor.extract("LaserJet service manual\nEdition 3, 5/2021\nwww.hp.com", 2, "HP");

    // Then
    assertThat(version).hasValueSatisfying(
        v -> {
          assertThat(v.version()).isEqualTo("Edition 3, 5/2021");
          assertThat(v.versionType()).isEqualTo(VersionType.EDITION);
          assertThat(v.confidence()).isEqualTo(0.95);
          assertThat(v.extractionMethod()).isEqualTo("hp_edition_date");
          assertThat(v.pageNumber()).isEqualTo(2);
        });
  }

  @Test
  @DisplayName("Should use manufacturer date patterns")
  void shouldExtractKonicaMinoltaDate() {
    Optional<DocumentVersion> version =
        extractor.extract("bizhub C658 Service Manual 2021/03/15", 1, "Konica Minolta");

    assertThat(version).hasValueSatisfying(
        v -> {
          assertThat(v.version()).isEqualTo("2021/03/15");
          assertThat(v.versionType()).isEqualTo(VersionType.DATE);
          assertThat(v.extractionMethod()).isEqualTo("km_date_slash");
        });
  }

  @Test
  @DisplayName("Should fall back to generic patterns without a known manufacturer")
  void shouldUseGenericPatterns() {
    Optional<DocumentVersion> firmware =
        extractor.extract("Firmware version 2.1.3 is required", 1, null);
    Optional<DocumentVersion> revision =
        extractor.extract("Service guide Rev. B2 notes", 1, "Acme");

    assertThat(firmware).hasValueSatisfying(
        v -> {
          assertThat(v.version()).isEqualTo("Firmware version 2.1.3");
          assertThat(v.versionType()).isEqualTo(VersionType.FIRMWARE);
          assertThat(v.confidence()).isEqualTo(0.8);
        });
    assertThat(revision).hasValueSatisfying(
        v -> assertThat(v.versionType()).isEqualTo(VersionType.REVISION));
  }

  @Test
  @DisplayName("Should judge forbidden words on the matched string only")
  void shouldCheckForbiddenWordsOnMatch() {
    Optional<DocumentVersion> version =
        extractor.extract("Copyright 2021 HP Development Company. Edition 4", 1, "HP");

    assertThat(version).hasValueSatisfying(v -> assertThat(v.version()).isEqualTo("Edition 4"));
  }

  @Test
  @DisplayName("Should return empty for short or version-less text")
  void shouldReturnEmpty_whenNoVersion() {
    assertThat(extractor.extract("short", 1, "HP")).isEmpty();
    assertThat(extractor.extract("Remove the fuser and clean the rollers", 1, "HP")).isEmpty();
  }

  @Test
  @DisplayName("Should pick the most confident candidate, then the earliest page")
  void shouldPickBestCandidate() {
    // Given
    DocumentVersion late = version("Edition 3, 5/2021", 0.95, 9);
    DocumentVersion early = version("Edition 3, 5/2021", 0.95, 2);
    DocumentVersion weak = version("Version 1.0", 0.8, 1);

    // When / Then
    assertThat(VersionExtractor.best(List.of(weak, late, early))).contains(early);
    assertThat(VersionExtractor.best(List.of())).isEmpty();
  }

  private static DocumentVersion version(String text, double confidence, int page) {
    return DocumentVersion.builder()
        .version(text)
        .versionType(VersionType.EDITION)
        .confidence(confidence)
        .pageNumber(page)
        .extractionMethod("test")
        .build();
  }
}
