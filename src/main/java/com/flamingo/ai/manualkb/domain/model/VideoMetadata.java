package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * Video platform metadata for a linked video.
 *
 * @param platform youtube or vimeo
 * @param videoId platform id
 * @param title video title
 * @param channel publishing channel, may be null
 * @param durationSeconds duration, null when unknown
 * @param thumbnailUrl thumbnail location, may be null
 * @param linkUrl URL of the link the video was found through
 */
@Builder
public record VideoMetadata(
    String platform,
    String videoId,
    String title,
    String channel,
    Integer durationSeconds,
    String thumbnailUrl,
    String linkUrl) {

  public PersistedRecord toRecord(UUID documentId) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("platform", platform);
    attributes.put("video_id", videoId);
    attributes.put("title", title);
    attributes.put("channel_title", channel);
    attributes.put("duration", durationSeconds);
    attributes.put("thumbnail_url", thumbnailUrl);
    attributes.put("link_url", linkUrl);
    return new PersistedRecord(
        EntityKind.VIDEO, platform + ":" + videoId, documentId, attributes);
  }
}
