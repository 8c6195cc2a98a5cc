package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * An image drawn on a PDF page.
 *
 * @param pageNumber 1-based page
 * @param imageIndex sequential index within the document
 * @param fileHash SHA-256 of the encoded image bytes
 * @param mimeType encoded format
 * @param data encoded image bytes
 * @param width width in pixels
 * @param height height in pixels
 * @param storageUrl object-storage location, null until uploaded
 * @param aiDescription vision-model description, may be null
 */
@Builder(toBuilder = true)
public record PageImage(
    int pageNumber,
    int imageIndex,
    String fileHash,
    String mimeType,
    byte[] data,
    int width,
    int height,
    String storageUrl,
    String aiDescription) {

  public PersistedRecord toRecord(UUID documentId) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("file_hash", fileHash);
    attributes.put("page_number", pageNumber);
    attributes.put("image_index", imageIndex);
    attributes.put("mime_type", mimeType);
    attributes.put("width", width);
    attributes.put("height", height);
    attributes.put("storage_url", storageUrl);
    attributes.put("ai_description", aiDescription);
    return new PersistedRecord(EntityKind.IMAGE, fileHash, documentId, attributes);
  }
}
