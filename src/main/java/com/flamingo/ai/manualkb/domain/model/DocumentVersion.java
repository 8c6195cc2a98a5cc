package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.enums.VersionType;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * Edition, date or revision string identifying a document's version.
 *
 * @param version version string as printed
 * @param versionType shape of the string
 * @param confidence score in [0,1]
 * @param pageNumber 1-based page
 * @param context text window around the match
 * @param extractionMethod name of the pattern that matched
 */
@Builder
public record DocumentVersion(
    String version,
    VersionType versionType,
    double confidence,
    int pageNumber,
    String context,
    String extractionMethod)
    implements ExtractedEntity {

  public DocumentVersion {
    Confidence.requireValid(confidence);
  }

  @Override
  public EntityKind kind() {
    return EntityKind.VERSION;
  }

  @Override
  public String naturalKey(UUID documentId, String manufacturer) {
    return documentId + "|" + version;
  }

  @Override
  public PersistedRecord toRecord(UUID documentId, String manufacturer) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("version_string", version);
    attributes.put("version_type", versionType.name().toLowerCase(Locale.ROOT));
    attributes.put("confidence", confidence);
    attributes.put("page_number", pageNumber);
    attributes.put("extraction_method", extractionMethod);
    return new PersistedRecord(
        kind(), naturalKey(documentId, manufacturer), documentId, attributes);
  }
}
