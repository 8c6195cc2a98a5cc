package com.flamingo.ai.manualkb.service.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.LinkType;
import com.flamingo.ai.manualkb.domain.model.ExtractedLink;
import com.flamingo.ai.manualkb.domain.model.VideoMetadata;
import com.flamingo.ai.manualkb.service.collaborator.VideoMetadataService;
import com.flamingo.ai.manualkb.support.TestPdfs;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LinkExtractorTest {

  private static final String YOUTUBE = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
  private static final String DIRECT_VIDEO = "https://media.hp.com/fuser-replacement.mp4";

  @TempDir Path tempDir;

  @Mock private VideoMetadataService videoMetadataService;

  private ManualKbConfig config;
  private LinkExtractor extractor;

  @BeforeEach
  void setUp() {
    config = new ManualKbConfig();
    extractor = new LinkExtractor(config, Optional.of(videoMetadataService));
  }

  @Nested
  @DisplayName("extract")
  class Extract {

    @Test
    @DisplayName("Should prefer annotation links and derive video records")
    void shouldMergeAnnotationAndTextLinks() throws Exception {
      // Given
      String pageText = "Watch " + YOUTUBE + " or download " + DIRECT_VIDEO + " for the steps.";
      Path pdf =
          TestPdfs.builder()
              .page("Fuser replacement videos")
              .link(1, YOUTUBE, "Fuser replacement video")
              .writeTo(tempDir, "links.pdf");

      // When
      LinkExtractor.LinkExtraction result = extractor.extract(pdf, Map.of(1, pageText));

      // Then
      assertThat(result.links()).hasSize(2);
      ExtractedLink youtube = result.links().get(0);
      assertThat(youtube.url()).isEqualTo(YOUTUBE);
      assertThat(youtube.confidence()).isEqualTo(1.0);
      assertThat(youtube.source()).isEqualTo(LinkExtractor.SOURCE_ANNOTATION);
      assertThat(youtube.description()).isEqualTo("Fuser replacement video");
      assertThat(youtube.linkType()).isEqualTo(LinkType.VIDEO);
      assertThat(youtube.category()).isEqualTo("youtube");
      assertThat(youtube.videoId()).isEqualTo("dQw4w9WgXcQ");

      ExtractedLink direct = result.links().get(1);
      assertThat(direct.confidence()).isEqualTo(0.9);
      assertThat(direct.source()).isEqualTo(LinkExtractor.SOURCE_TEXT);
      assertThat(direct.category()).isEqualTo("direct");
      assertThat(direct.videoId()).isEqualTo("fuser-replacement.mp4");

      assertThat(result.videos())
          .extracting(VideoMetadata::platform, VideoMetadata::videoId)
          .containsExactly(
              tuple("youtube", "dQw4w9WgXcQ"),
              tuple("direct", "fuser-replacement.mp4"));
      assertThat(result.videos().get(1).title()).isEqualTo("fuser replacement");
      verify(videoMetadataService, never())
          .lookup(
              ArgumentMatchers.anyString(),
              ArgumentMatchers.anyString(),
              ArgumentMatchers.anyString());
    }

    @Test
    @DisplayName("Should use platform metadata when lookups are enabled")
    void shouldLookUpVideoMetadata() {
      // Given
      config.getLinks().setVideoMetadataEnabled(true);
      VideoMetadata metadata =
          VideoMetadata.builder()
              .platform("youtube")
              .videoId("dQw4w9WgXcQ")
              .title("Replacing the fuser")
              .channel("HP Support")
              .linkUrl(YOUTUBE)
              .build();
      when(videoMetadataService.lookup("youtube", "dQw4w9WgXcQ", YOUTUBE))
          .thenReturn(Optional.of(metadata));

      // When
      LinkExtractor.LinkExtraction result =
          extractor.extract(tempDir.resolve("missing.pdf"), Map.of(2, "Video: " + YOUTUBE));

      // Then
      assertThat(result.links()).singleElement().satisfies(
          link -> {
            assertThat(link.pageNumber()).isEqualTo(2);
            assertThat(link.source()).isEqualTo(LinkExtractor.SOURCE_TEXT);
          });
      assertThat(result.videos()).containsExactly(metadata);
    }

    @Test
    @DisplayName("Should return nothing when link extraction is disabled")
    void shouldReturnEmpty_whenDisabled() {
      config.getLinks().setEnabled(false);

      assertThat(extractor.extract(tempDir.resolve("x.pdf"), Map.of(1, YOUTUBE)))
          .isSameAs(LinkExtractor.LinkExtraction.EMPTY);
    }
  }

  @Nested
  @DisplayName("text links")
  class TextLinks {

    @Test
    @DisplayName("Should strip trailing punctuation and describe the link from its context")
    void shouldFindTextLinks() {
      List<ExtractedLink> links =
          extractor.fromText("For more information: https://support.hp.com/drivers.", 4);

      assertThat(links).singleElement().satisfies(
          link -> {
            assertThat(link.url()).isEqualTo("https://support.hp.com/drivers");
            assertThat(link.pageNumber()).isEqualTo(4);
            assertThat(link.description()).isNotBlank();
          });
    }

    @Test
    @DisplayName("Should skip placeholder addresses")
    void shouldSkipPlaceholders() {
      String text =
          "Open http://x.x.x.x/admin or https://example.com/setup or http://127.0.0.1/config";

      assertThat(extractor.fromText(text, 1)).isEmpty();
      assertThat(LinkExtractor.isPlaceholder("https://www.hp.com")).isFalse();
    }

    @Test
    @DisplayName("Should clean URLs picked up from prose")
    void shouldCleanUrls() {
      assertThat(LinkExtractor.cleanUrl("https://hp.com/page).")).isEqualTo("https://hp.com/page");
      assertThat(LinkExtractor.cleanUrl("https://en.wikipedia.org/wiki/Fuser_(printer)"))
          .isEqualTo("https://en.wikipedia.org/wiki/Fuser_(printer)");
      assertThat(LinkExtractor.cleanUrl("http://intranet")).isEmpty();
      assertThat(LinkExtractor.cleanUrl(null)).isEmpty();
    }
  }

  @Nested
  @DisplayName("classification")
  class Classification {

    @Test
    @DisplayName("Should classify links by scheme and URL keywords")
    void shouldClassifyLinkTypes() {
      assertThat(LinkExtractor.linkType("mailto:service@hp.com")).isEqualTo(LinkType.EMAIL);
      assertThat(LinkExtractor.linkType("tel:+4940123456")).isEqualTo(LinkType.PHONE);
      assertThat(LinkExtractor.linkType("https://support.hp.com")).isEqualTo(LinkType.SUPPORT);
      assertThat(LinkExtractor.linkType("https://hp.com/drivers/m607"))
          .isEqualTo(LinkType.DOWNLOAD);
      assertThat(LinkExtractor.linkType("https://hp.com/docs/manual.pdf"))
          .isEqualTo(LinkType.DOWNLOAD);
      assertThat(LinkExtractor.linkType("https://hp.com/video/intro")).isEqualTo(LinkType.VIDEO);
      assertThat(LinkExtractor.linkType("https://hp.com/how-to/clean"))
          .isEqualTo(LinkType.TUTORIAL);
      assertThat(LinkExtractor.linkType("https://www.hp.com")).isEqualTo(LinkType.EXTERNAL);
    }

    @Test
    @DisplayName("Should categorize links by host")
    void shouldCategorizeByHost() {
      assertThat(LinkExtractor.category("https://youtu.be/dQw4w9WgXcQ")).isEqualTo("youtube");
      assertThat(LinkExtractor.category("https://vimeo.com/123456")).isEqualTo("vimeo");
      assertThat(LinkExtractor.category("https://support.hp.com/x")).isEqualTo("support_portal");
      assertThat(LinkExtractor.category("https://download.hp.com/x"))
          .isEqualTo("download_portal");
      assertThat(LinkExtractor.category("https://www.hp.com")).isEqualTo("external");
    }

    @Test
    @DisplayName("Should recognize video ids and direct video files")
    void shouldRecognizeVideos() {
      assertThat(LinkExtractor.youtubeId("https://youtu.be/dQw4w9WgXcQ")).contains("dQw4w9WgXcQ");
      assertThat(LinkExtractor.youtubeId("https://www.youtube.com/embed/dQw4w9WgXcQ"))
          .contains("dQw4w9WgXcQ");
      assertThat(LinkExtractor.youtubeId("https://www.hp.com")).isEmpty();
      assertThat(LinkExtractor.vimeoId("https://vimeo.com/video/123456")).contains("123456");
      assertThat(LinkExtractor.isDirectVideo("https://cdn.hp.com/clip.MP4?x=1")).isTrue();
      assertThat(LinkExtractor.isDirectVideo("https://cdn.hp.com/clip.html")).isFalse();
    }
  }
}
