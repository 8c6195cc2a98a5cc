package com.flamingo.ai.manualkb.service.collaborator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.model.VideoMetadata;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link VideoMetadataService} over the public oEmbed endpoints of YouTube and Vimeo. No API key is
 * needed; YouTube does not report durations.
 */
@Component
@ConditionalOnProperty(name = "manualkb.links.video-metadata-enabled", havingValue = "true")
@Slf4j
public class OEmbedVideoMetadataService implements VideoMetadataService {

  private final WebClient webClient;
  private final ManualKbConfig.Links links;

  public OEmbedVideoMetadataService(ManualKbConfig config) {
    this.links = config.getLinks();
    this.webClient = WebClient.builder().build();
    log.info("oEmbed video metadata lookup enabled");
  }

  @Override
  public Optional<VideoMetadata> lookup(String platform, String videoId, String linkUrl) {
    String endpoint;
    String canonicalUrl;
    if ("youtube".equals(platform)) {
      endpoint = links.getYoutubeOembedUrl();
      canonicalUrl = "https://www.youtube.com/watch?v=" + videoId;
    } else if ("vimeo".equals(platform)) {
      endpoint = links.getVimeoOembedUrl();
      canonicalUrl = "https://vimeo.com/" + videoId;
    } else {
      return Optional.empty();
    }
    String uri =
        UriComponentsBuilder.fromUriString(endpoint)
            .queryParam("url", canonicalUrl)
            .queryParam("format", "json")
            .build()
            .toUriString();
    try {
      OEmbedResponse response =
          webClient
              .get()
              .uri(uri)
              .retrieve()
              .bodyToMono(OEmbedResponse.class)
              .timeout(Duration.ofMillis(links.getVideoLookupTimeoutMs()))
              .block();
      if (response == null || response.title() == null) {
        return Optional.empty();
      }
      return Optional.of(
          VideoMetadata.builder()
              .platform(platform)
              .videoId(videoId)
              .title(response.title())
              .channel(response.authorName())
              .durationSeconds(response.duration())
              .thumbnailUrl(response.thumbnailUrl())
              .linkUrl(linkUrl)
              .build());
    } catch (RuntimeException e) {
      log.warn("Video metadata lookup failed for {}:{}: {}", platform, videoId, e.getMessage());
      return Optional.empty();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record OEmbedResponse(
      String title,
      @JsonProperty("author_name") String authorName,
      @JsonProperty("thumbnail_url") String thumbnailUrl,
      Integer duration) {}
}
