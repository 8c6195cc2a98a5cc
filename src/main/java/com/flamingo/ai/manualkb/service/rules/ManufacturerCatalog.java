package com.flamingo.ai.manualkb.service.rules;

import java.util.List;

/**
 * Canonical manufacturers with their rule keys and name aliases.
 *
 * @param shortAliasWhitelist aliases of three characters or fewer that may still be matched
 * @param manufacturers catalog entries
 */
public record ManufacturerCatalog(
    List<String> shortAliasWhitelist, List<ManufacturerCatalog.Entry> manufacturers) {

  public ManufacturerCatalog {
    shortAliasWhitelist =
        shortAliasWhitelist == null ? List.of() : List.copyOf(shortAliasWhitelist);
    manufacturers = manufacturers == null ? List.of() : List.copyOf(manufacturers);
  }

  public static ManufacturerCatalog empty() {
    return new ManufacturerCatalog(List.of(), List.of());
  }

  /**
   * A canonical manufacturer.
   *
   * @param name canonical display name, e.g. {@code HP Inc.}
   * @param key rule-set key, e.g. {@code hp}
   * @param aliases lowercase name variants and strong series names
   */
  public record Entry(String name, String key, List<String> aliases) {

    public Entry {
      aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
  }
}
