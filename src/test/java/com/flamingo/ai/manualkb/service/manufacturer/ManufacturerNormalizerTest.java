package com.flamingo.ai.manualkb.service.manufacturer;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.manualkb.service.rules.ManufacturerCatalog;
import com.flamingo.ai.manualkb.service.rules.RuleSetLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ManufacturerNormalizerTest {

  private static ManufacturerNormalizer normalizer;

  @BeforeAll
  static void loadCatalog() {
    normalizer = new ManufacturerNormalizer(new RuleSetLoader().loadDefaults());
  }

  @Test
  @DisplayName("Should normalize any known spelling to the canonical name")
  void shouldNormalizeAliases() {
    assertThat(normalizer.normalize("hewlett-packard")).contains("HP Inc.");
    assertThat(normalizer.normalize("  HP ")).contains("HP Inc.");
    assertThat(normalizer.normalize("konica_minolta")).contains("Konica Minolta");
    assertThat(normalizer.normalize("bizhub")).contains("Konica Minolta");
    assertThat(normalizer.normalize("OKI")).contains("OKI");
  }

  @Test
  @DisplayName("Should resolve a longer name through word-boundary alias mentions")
  void shouldResolveEmbeddedAlias() {
    assertThat(normalizer.normalize("Canon Europe N.V.")).contains("Canon");
  }

  @Test
  @DisplayName("Should map canonical names to rule keys")
  void shouldReturnRuleKey() {
    assertThat(normalizer.ruleKey("HP")).contains("hp");
    assertThat(normalizer.ruleKey("Konica Minolta")).contains("konica_minolta");
  }

  @Test
  @DisplayName("Should return empty for unknown or blank names")
  void shouldReturnEmpty_whenUnknown() {
    assertThat(normalizer.normalize("Acme")).isEmpty();
    assertThat(normalizer.normalize("")).isEmpty();
    assertThat(normalizer.normalize(null)).isEmpty();
    assertThat(normalizer.ruleKey("Acme")).isEmpty();
  }

  @Test
  @DisplayName("Should count mentions on word boundaries only")
  void shouldCountWordBoundaryMentions() {
    ManufacturerCatalog.Entry hp = normalizer.resolve("HP").orElseThrow();
    ManufacturerCatalog.Entry oki = normalizer.resolve("OKI").orElseThrow();

    assertThat(normalizer.countMentions(hp, "HP LaserJet with an HP tray")).isEqualTo(3);
    assertThat(normalizer.countMentions(hp, "The chpx module")).isZero();
    // short aliases outside the whitelist never match inside words
    assertThat(normalizer.countMentions(oki, "smoking toner, oki tray")).isZero();
    assertThat(normalizer.countMentions(hp, null)).isZero();
  }
}
