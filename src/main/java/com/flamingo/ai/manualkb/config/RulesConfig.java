package com.flamingo.ai.manualkb.config;

import com.flamingo.ai.manualkb.service.rules.ExtractionRules;
import com.flamingo.ai.manualkb.service.rules.RuleSetLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Loads the extraction rule sets once at startup. */
@Configuration
public class RulesConfig {

  @Bean
  public RuleSetLoader ruleSetLoader(ResourceLoader resourceLoader) {
    return new RuleSetLoader(resourceLoader);
  }

  @Bean
  public ExtractionRules extractionRules(RuleSetLoader ruleSetLoader, ManualKbConfig config) {
    return ruleSetLoader.loadAll(config.getRules());
  }
}
