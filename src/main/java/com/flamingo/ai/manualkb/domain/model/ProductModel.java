package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * A product model named in a document.
 *
 * @param model model number without series prefix where possible, e.g. {@code E475}
 * @param series product series, e.g. {@code LaserJet}, may be null
 * @param productType laser_printer, multifunction, production_printer, ...
 * @param manufacturer canonical manufacturer name
 * @param confidence score in [0,1]
 * @param pageNumber 1-based page or {@link ExtractedEntity#FILENAME_PAGE}
 * @param context text window around the match
 * @param extractionMethod pattern name, {@code filename_parsing} or {@code llm_inference}
 */
@Builder(toBuilder = true)
public record ProductModel(
    String model,
    String series,
    String productType,
    String manufacturer,
    double confidence,
    int pageNumber,
    String context,
    String extractionMethod)
    implements ExtractedEntity {

  public ProductModel {
    Confidence.requireValid(confidence);
  }

  @Override
  public EntityKind kind() {
    return EntityKind.PRODUCT;
  }

  @Override
  public String naturalKey(UUID documentId, String documentManufacturer) {
    String owner = manufacturer != null ? manufacturer : documentManufacturer;
    return model.toUpperCase(Locale.ROOT) + "|" + owner;
  }

  @Override
  public PersistedRecord toRecord(UUID documentId, String documentManufacturer) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("model_number", model);
    attributes.put("series", series);
    attributes.put("product_type", productType);
    attributes.put("manufacturer", manufacturer != null ? manufacturer : documentManufacturer);
    attributes.put("confidence", confidence);
    attributes.put("page_number", pageNumber);
    attributes.put("extraction_method", extractionMethod);
    return new PersistedRecord(
        kind(), naturalKey(documentId, documentManufacturer), documentId, attributes);
  }
}
