package com.flamingo.ai.manualkb.service.rules;

import java.util.List;
import java.util.Locale;

final class RuleLists {

  private RuleLists() {}

  static List<String> lower(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
  }
}
