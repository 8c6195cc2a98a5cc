package com.flamingo.ai.manualkb.service.rules;

/**
 * Rule sets for every extractor, loaded once at startup and passed to extractor constructors.
 *
 * @param catalog manufacturer names, keys and aliases
 * @param errorCodes error-code rules
 * @param parts parts rules
 * @param products product-model rules
 * @param versions version rules
 */
public record ExtractionRules(
    ManufacturerCatalog catalog,
    ErrorCodeRules errorCodes,
    PartsRules parts,
    ProductRules products,
    VersionRules versions) {}
