package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import com.flamingo.ai.manualkb.domain.enums.LinkType;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * A hyperlink found in a PDF annotation or in page text.
 *
 * @param url link target
 * @param pageNumber 1-based page
 * @param description annotation contents or surrounding text
 * @param linkType purpose of the link
 * @param category platform or portal category
 * @param videoId platform video id for video links, may be null
 * @param confidence 1.0 for annotations, 0.9 for text matches
 * @param source {@code pdf_annotation} or {@code text_extraction}
 */
@Builder(toBuilder = true)
public record ExtractedLink(
    String url,
    int pageNumber,
    String description,
    LinkType linkType,
    String category,
    String videoId,
    double confidence,
    String source) {

  public ExtractedLink {
    Confidence.requireValid(confidence);
  }

  /** Lowercased URL without trailing slash, used for deduplication. */
  public String normalizedUrl() {
    String lower = url.toLowerCase(Locale.ROOT);
    while (lower.endsWith("/")) {
      lower = lower.substring(0, lower.length() - 1);
    }
    return lower;
  }

  public PersistedRecord toRecord(UUID documentId) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("url", url);
    attributes.put("page_number", pageNumber);
    attributes.put("description", description);
    attributes.put("link_type", linkType.name().toLowerCase(Locale.ROOT));
    attributes.put("link_category", category);
    attributes.put("video_id", videoId);
    attributes.put("confidence_score", confidence);
    return new PersistedRecord(
        EntityKind.LINK, normalizedUrl() + "|" + documentId, documentId, attributes);
  }
}
