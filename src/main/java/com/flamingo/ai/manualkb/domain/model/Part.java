package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * A spare part or consumable.
 *
 * @param partNumber uppercased part number, at least three characters
 * @param name part name, may be null
 * @param description short description, may be null
 * @param category consumable category (toner, drum, fuser, ...), may be null
 * @param confidence score in [0,1]
 * @param pageNumber 1-based page
 * @param context text window around the match
 * @param extractionMethod name of the pattern that matched
 */
@Builder
public record Part(
    String partNumber,
    String name,
    String description,
    String category,
    double confidence,
    int pageNumber,
    String context,
    String extractionMethod)
    implements ExtractedEntity {

  public Part {
    Confidence.requireValid(confidence);
    if (partNumber == null || partNumber.strip().length() < 3) {
      throw new IllegalArgumentException("Part number must have at least 3 characters");
    }
    partNumber = partNumber.strip().toUpperCase(Locale.ROOT);
  }

  @Override
  public EntityKind kind() {
    return EntityKind.PART;
  }

  @Override
  public String naturalKey(UUID documentId, String manufacturer) {
    return partNumber + "|" + manufacturer;
  }

  @Override
  public PersistedRecord toRecord(UUID documentId, String manufacturer) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("part_number", partNumber);
    attributes.put("manufacturer", manufacturer);
    attributes.put("part_name", name);
    attributes.put("part_description", description);
    attributes.put("part_category", category);
    attributes.put("confidence", confidence);
    attributes.put("page_number", pageNumber);
    attributes.put("extraction_method", extractionMethod);
    return new PersistedRecord(
        kind(), naturalKey(documentId, manufacturer), documentId, attributes);
  }
}
