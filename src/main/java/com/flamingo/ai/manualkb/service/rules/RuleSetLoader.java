package com.flamingo.ai.manualkb.service.rules;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads the JSON rule sets into immutable rule objects.
 *
 * <p>Locations without a scheme are resolved on the classpath. A missing or malformed rule set is
 * logged and replaced by an empty one, so the affected extractor finds nothing instead of failing
 * startup.
 */
@Slf4j
public class RuleSetLoader {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
          .build();

  private final ResourceLoader resourceLoader;

  public RuleSetLoader() {
    this(new DefaultResourceLoader());
  }

  public RuleSetLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  /**
   * Loads every rule set named in the configuration.
   *
   * @param rules rule resource locations
   * @return loaded rules; failed sets are empty
   */
  public ExtractionRules loadAll(ManualKbConfig.Rules rules) {
    return new ExtractionRules(
        loadOrEmpty(
            rules.getManufacturers(), ManufacturerCatalog.class, ManufacturerCatalog::empty),
        loadOrEmpty(rules.getErrorCodes(), ErrorCodeRules.class, ErrorCodeRules::empty),
        loadOrEmpty(rules.getParts(), PartsRules.class, PartsRules::empty),
        loadOrEmpty(rules.getProducts(), ProductRules.class, ProductRules::empty),
        loadOrEmpty(rules.getVersions(), VersionRules.class, VersionRules::empty));
  }

  /** Loads the rule sets from their default classpath locations. */
  public ExtractionRules loadDefaults() {
    return loadAll(new ManualKbConfig.Rules());
  }

  /**
   * Loads one rule set, degrading to {@code fallback} on any configuration problem.
   *
   * @param location resource location
   * @param type rule-set type
   * @param fallback supplier of the empty rule set
   * @return loaded or empty rule set
   */
  public <T> T loadOrEmpty(String location, Class<T> type, Supplier<T> fallback) {
    try {
      return load(location, type);
    } catch (ConfigurationException e) {
      log.error(
          "Rule set {} could not be loaded, continuing with an empty {}: {}",
          e.getResource(),
          type.getSimpleName(),
          e.getMessage());
      return fallback.get();
    }
  }

  /**
   * Loads one rule set.
   *
   * @throws ConfigurationException when the resource is missing or malformed
   */
  public <T> T load(String location, Class<T> type) {
    Resource resource = resourceLoader.getResource(qualify(location));
    if (!resource.exists()) {
      throw new ConfigurationException(location, "Rule set not found: " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      T loaded = MAPPER.readValue(in, type);
      if (loaded == null) {
        throw new ConfigurationException(location, "Rule set is empty: " + location);
      }
      log.debug("Loaded rule set {} as {}", location, type.getSimpleName());
      return loaded;
    } catch (IOException e) {
      throw new ConfigurationException(location, "Malformed rule set " + location, e);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(location, "Invalid rule set " + location, e);
    }
  }

  private static String qualify(String location) {
    return location.contains(":") ? location : ResourceLoader.CLASSPATH_URL_PREFIX + location;
  }
}
