package com.flamingo.ai.manualkb.service.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;
import com.flamingo.ai.manualkb.domain.enums.Severity;
import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.domain.model.ValidationIssue;
import com.flamingo.ai.manualkb.exception.UnknownManufacturerException;
import com.flamingo.ai.manualkb.exception.ValidationException;
import com.flamingo.ai.manualkb.service.manufacturer.ManufacturerNormalizer;
import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.RuleSetLoader;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ErrorCodeExtractorTest {

  private static final String HP_PAGE =
      "Error 13.A1.B2: Paper jam in tray 2. Remove paper from tray 2 and restart printer.";

  private static ErrorCodeExtractor extractor;

  @BeforeAll
  static void setUp() {
    ExtractionRules rules = new RuleSetLoader().loadDefaults();
    extractor = new ErrorCodeExtractor(rules, new ManufacturerNormalizer(rules));
  }

  @Nested
  @DisplayName("extract")
  class Extract {

    @Test
    @DisplayName("Should extract an HP code with description, solution and confidence")
    void shouldExtractHpCode() {
      // When
      ErrorCodeExtraction extraction = extractor.extract(HP_PAGE, 1, "HP");

      // Then
      assertThat(extraction.kind()).isEqualTo(ErrorCodeExtraction.Kind.EXTRACTED);
      assertThat(extraction.codes()).singleElement().satisfies(
          code -> {
            assertThat(code.code()).isEqualTo("13.A1.B2");
            assertThat(code.description()).isEqualTo("Paper jam in tray 2");
            assertThat(code.solution())
                .isEqualTo("Remove paper from tray 2 and restart printer.");
            assertThat(code.confidence()).isEqualTo(0.7);
            assertThat(code.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(code.pageNumber()).isEqualTo(1);
            assertThat(code.extractionMethod()).isEqualTo("hp_pattern");
            assertThat(code.context()).contains("13.A1.B2");
          });
    }

    @Test
    @DisplayName("Should accept any known spelling of the manufacturer")
    void shouldResolveManufacturerAliases() {
      assertThat(extractor.extract(HP_PAGE, 1, "Hewlett-Packard").codes()).hasSize(1);
      assertThat(extractor.supports("HP Inc.")).isTrue();
      assertThat(extractor.supports("Acme")).isFalse();
    }

    @Test
    @DisplayName("Should report an unknown manufacturer instead of guessing")
    void shouldReportUnknownManufacturer() {
      // When
      ErrorCodeExtraction extraction = extractor.extract(HP_PAGE, 1, "Acme");

      // Then
      assertThat(extraction.kind()).isEqualTo(ErrorCodeExtraction.Kind.UNKNOWN_MANUFACTURER);
      assertThat(extraction.codes()).isEmpty();
      assertThatThrownBy(extraction::orElseThrow)
          .isInstanceOf(UnknownManufacturerException.class)
          .hasMessageContaining("Acme");
      assertThatThrownBy(() -> extractor.extractOrThrow(HP_PAGE, 1, "Acme"))
          .isInstanceOf(UnknownManufacturerException.class);
    }

    @Test
    @DisplayName("Should skip extraction when no manufacturer is given")
    void shouldSkip_whenNoManufacturer() {
      ErrorCodeExtraction extraction = extractor.extract(HP_PAGE, 1, null);

      assertThat(extraction.kind()).isEqualTo(ErrorCodeExtraction.Kind.NO_MANUFACTURER);
      assertThat(extraction.orElseThrow()).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for short text or excluded context")
    void shouldReturnEmpty_whenTextUnsuitable() {
      String partsTable =
          "Error 13.A1.B2: Paper jam in tray 2. See the spare part list for tray 2 rollers.";

      assertThat(extractor.extract("13.A1.B2", 1, "HP").codes()).isEmpty();
      assertThat(extractor.extract(partsTable, 1, "HP").codes()).isEmpty();
      assertThat(extractor.extract("Chapter 4 describes the fuser assembly.", 1, "HP").codes())
          .isEmpty();
    }

    @Test
    @DisplayName("Should keep each code's own description when the next code has a detail block")
    void shouldNotTakeDescriptionOfFollowingCode() {
      // Given
      String page =
          HP_PAGE
              + "\n\nError 49.38.07\nClassification\nFirmware error in the formatter board\n"
              + "Cause\nThe formatter firmware is corrupted.\n";

      // When
      List<ErrorCode> codes = extractor.extract(page, 1, "HP").codes();

      // Then
      assertThat(codes)
          .filteredOn(code -> code.code().equals("13.A1.B2"))
          .singleElement()
          .satisfies(
              code -> {
                assertThat(code.description()).isEqualTo("Paper jam in tray 2");
                assertThat(code.solution())
                    .isEqualTo("Remove paper from tray 2 and restart printer.");
              });
    }
  }

  @Nested
  @DisplayName("enrichFromDocument")
  class Enrich {

    @Test
    @DisplayName("Should replace a short solution with steps found elsewhere in the document")
    void shouldEnrichFromDetailSection() {
      // Given
      ErrorCode code = extractor.extract(HP_PAGE, 1, "HP").codes().get(0);
      String fullText =
          HP_PAGE
              + "\n\nError code details\n13.A1.B2 Paper jam in tray 2 detected by the sensor.\n"
              + "Recommended action\n"
              + "1. Open tray 2 and remove the jammed paper.\n"
              + "2. Check the pickup roller for wear.\n"
              + "3. Restart the printer.";

      // When
      List<ErrorCode> enriched = extractor.enrichFromDocument(List.of(code), fullText, "HP");

      // Then
      assertThat(enriched).singleElement().satisfies(
          e -> {
            assertThat(e.description()).isEqualTo("Paper jam in tray 2 detected by the sensor");
            assertThat(e.solution())
                .startsWith("1. Open tray 2")
                .contains("2. Check the pickup roller")
                .endsWith("3. Restart the printer.");
            assertThat(e.extractionMethod()).isEqualTo("hp_pattern_enriched");
            assertThat(e.confidence()).isEqualTo(0.9);
          });
    }

    @Test
    @DisplayName("Should leave codes untouched for an unknown manufacturer")
    void shouldNotEnrich_whenManufacturerUnknown() {
      ErrorCode code = extractor.extract(HP_PAGE, 1, "HP").codes().get(0);

      assertThat(extractor.enrichFromDocument(List.of(code), HP_PAGE, "Acme"))
          .containsExactly(code);
    }
  }

  @Nested
  @DisplayName("validate")
  class Validate {

    @Test
    @DisplayName("Should warn about a short description without blocking the code")
    void shouldWarnOnShortDescription() {
      // Given
      ErrorCode code = extractor.extract(HP_PAGE, 1, "HP").codes().get(0);

      // When
      List<ValidationIssue> issues = extractor.requireValid(code, "HP");

      // Then
      assertThat(issues).singleElement().satisfies(
          issue -> {
            assertThat(issue.field()).isEqualTo("error_description");
            assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
          });
    }

    @Test
    @DisplayName("Should reject codes with a bad format or low confidence")
    void shouldRejectInvalidCode() {
      // Given
      ErrorCode code =
          ErrorCode.builder()
              .code("13-A1")
              .description("Paper jam somewhere in the paper path")
              .confidence(0.5)
              .pageNumber(3)
              .extractionMethod("manual")
              .build();

      // When
      List<ValidationIssue> issues = extractor.validate(code, "HP");

      // Then
      assertThat(issues)
          .extracting(ValidationIssue::field, ValidationIssue::severity)
          .containsExactly(
              tuple("error_code", IssueSeverity.ERROR),
              tuple("confidence", IssueSeverity.ERROR));
      assertThatThrownBy(() -> extractor.requireValid(code, "HP"))
          .isInstanceOf(ValidationException.class)
          .satisfies(e -> assertThat(((ValidationException) e).getIssues()).hasSize(2));
    }
  }
}
