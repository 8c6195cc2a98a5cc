package com.flamingo.ai.manualkb.service.collaborator;

import com.flamingo.ai.manualkb.domain.model.VideoMetadata;
import java.util.Optional;

/** Looks up title, channel and thumbnail of a video on its platform. */
public interface VideoMetadataService {

  /**
   * Looks up a video.
   *
   * @param platform {@code youtube} or {@code vimeo}
   * @param videoId platform id
   * @param linkUrl URL the video was linked through
   * @return metadata, empty when the platform does not know the video
   */
  Optional<VideoMetadata> lookup(String platform, String videoId, String linkUrl);
}
