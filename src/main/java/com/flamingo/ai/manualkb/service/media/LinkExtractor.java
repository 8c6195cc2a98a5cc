package com.flamingo.ai.manualkb.service.media;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.LinkType;
import com.flamingo.ai.manualkb.domain.model.ExtractedLink;
import com.flamingo.ai.manualkb.domain.model.VideoMetadata;
import com.flamingo.ai.manualkb.service.collaborator.VideoMetadataService;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.action.PDAction;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.springframework.stereotype.Component;

/**
 * Collects hyperlinks from PDF link annotations and from URLs printed in page text, classifies
 * them and derives video records for video links.
 *
 * <p>Annotation links carry confidence 1.0, text matches 0.9. When both sources report the same
 * URL the annotation wins.
 */
@Component
@Slf4j
public class LinkExtractor {

  public static final String SOURCE_ANNOTATION = "pdf_annotation";
  public static final String SOURCE_TEXT = "text_extraction";

  private static final double ANNOTATION_CONFIDENCE = 1.0;
  private static final double TEXT_CONFIDENCE = 0.9;
  private static final int CONTEXT_CHARS = 150;
  private static final int MAX_DESCRIPTION = 300;

  private static final Pattern URL =
      Pattern.compile(
          "https?://(?:www\\.)?[-a-zA-Z0-9@:%._+~#=]{1,256}\\.[a-zA-Z0-9()]{1,6}\\b"
              + "(?:[-a-zA-Z0-9()@:%_+.~#?&/=]*)");

  private static final List<Pattern> YOUTUBE_IDS =
      List.of(
          Pattern.compile(
              "(?:https?://)?(?:www\\.)?youtube\\.com/watch\\?v=([a-zA-Z0-9_-]{11})",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "(?:https?://)?(?:www\\.)?youtu\\.be/([a-zA-Z0-9_-]{11})", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "(?:https?://)?(?:www\\.)?youtube\\.com/embed/([a-zA-Z0-9_-]{11})",
              Pattern.CASE_INSENSITIVE));

  private static final Pattern VIMEO_ID =
      Pattern.compile("vimeo\\.com/(?:video/)?(\\d+)", Pattern.CASE_INSENSITIVE);

  private static final Pattern PLACEHOLDER_IP = Pattern.compile("[xX]\\.[xX]\\.[xX]\\.[xX]");

  private static final List<String> PLACEHOLDERS =
      List.of("0.0.0.0", "127.0.0.1", "example.com", "example.org", "test.com", "localhost");

  private static final List<String> VIDEO_EXTENSIONS =
      List.of(
          ".mp4", ".webm", ".mov", ".avi", ".mkv", ".m4v", ".flv", ".wmv", ".mpeg", ".mpg",
          ".3gp");

  private static final List<String> DESCRIPTION_PREFIXES =
      List.of(
          "for more information:",
          "access the following url:",
          "more info:",
          "click here:",
          "download:",
          "website:",
          "visit:",
          "go to:",
          "link:",
          "url:",
          "see:");

  /** Host fragments of video platforms other than YouTube, mapped to platform names. */
  private static final Map<String, String> VIDEO_PLATFORMS = videoPlatforms();

  private final ManualKbConfig config;
  private final Optional<VideoMetadataService> videoMetadataService;

  public LinkExtractor(
      ManualKbConfig config, Optional<VideoMetadataService> videoMetadataService) {
    this.config = config;
    this.videoMetadataService = videoMetadataService;
  }

  /**
   * Extracts the links of a document.
   *
   * @param pdf PDF file, read for link annotations
   * @param pageTexts page texts keyed by 1-based page number
   * @return unique links and the videos they point to
   */
  public LinkExtraction extract(Path pdf, Map<Integer, String> pageTexts) {
    if (!config.getLinks().isEnabled()) {
      return LinkExtraction.EMPTY;
    }
    List<ExtractedLink> found = new ArrayList<>();
    try {
      found.addAll(fromAnnotations(pdf));
    } catch (IOException e) {
      log.warn("Could not read link annotations of {}: {}", pdf.getFileName(), e.getMessage());
    }
    pageTexts.forEach((page, text) -> found.addAll(fromText(text, page)));

    List<ExtractedLink> links = new ArrayList<>();
    List<VideoMetadata> videos = new ArrayList<>();
    for (ExtractedLink link : deduplicate(found)) {
      ExtractedLink classified = classify(link);
      links.add(classified);
      videoFor(classified).ifPresent(videos::add);
    }
    log.info(
        "Extracted {} unique links ({} videos) from {}",
        links.size(),
        videos.size(),
        pdf.getFileName());
    return new LinkExtraction(List.copyOf(links), List.copyOf(videos));
  }

  /** Reads URI actions of link annotations, page by page. */
  List<ExtractedLink> fromAnnotations(Path pdf) throws IOException {
    List<ExtractedLink> links = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      int pageNumber = 1;
      for (PDPage page : document.getPages()) {
        int current = pageNumber;
        for (PDAnnotation annotation : page.getAnnotations()) {
          if (annotation instanceof PDAnnotationLink link) {
            uriOf(link)
                .map(LinkExtractor::cleanUrl)
                .filter(url -> !url.isEmpty() && !isPlaceholder(url))
                .ifPresent(
                    url ->
                        links.add(
                            ExtractedLink.builder()
                                .url(url)
                                .pageNumber(current)
                                .description(nullToEmpty(link.getContents()).strip())
                                .confidence(ANNOTATION_CONFIDENCE)
                                .source(SOURCE_ANNOTATION)
                                .build()));
          }
        }
        pageNumber++;
      }
    }
    return links;
  }

  /** Finds URLs printed in one page of text. */
  List<ExtractedLink> fromText(String text, int pageNumber) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<ExtractedLink> links = new ArrayList<>();
    Matcher m = URL.matcher(text);
    while (m.find()) {
      String raw = m.group();
      if (isPlaceholder(raw)) {
        log.debug("Skipping placeholder URL {}", raw);
        continue;
      }
      String url = cleanUrl(raw);
      if (url.isEmpty()) {
        continue;
      }
      String context =
          text.substring(
                  Math.max(0, m.start() - CONTEXT_CHARS),
                  Math.min(text.length(), m.end() + CONTEXT_CHARS))
              .strip()
              .replaceAll("\\s+", " ");
      links.add(
          ExtractedLink.builder()
              .url(url)
              .pageNumber(pageNumber)
              .description(description(context, url))
              .confidence(TEXT_CONFIDENCE)
              .source(SOURCE_TEXT)
              .build());
    }
    return links;
  }

  /** YouTube video id of a URL. */
  public static Optional<String> youtubeId(String url) {
    for (Pattern pattern : YOUTUBE_IDS) {
      Matcher m = pattern.matcher(url);
      if (m.find()) {
        return Optional.of(m.group(1));
      }
    }
    return Optional.empty();
  }

  public static Optional<String> vimeoId(String url) {
    Matcher m = VIMEO_ID.matcher(url);
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }

  public static boolean isDirectVideo(String url) {
    String path = pathOf(url).toLowerCase(Locale.ROOT);
    return VIDEO_EXTENSIONS.stream().anyMatch(path::endsWith);
  }

  /** Purpose of a non-video link, judged from the URL alone. */
  public static LinkType linkType(String url) {
    String lower = url.toLowerCase(Locale.ROOT);
    if (lower.startsWith("mailto:")) {
      return LinkType.EMAIL;
    }
    if (lower.startsWith("tel:")) {
      return LinkType.PHONE;
    }
    if (containsAny(lower, "support", "help", "kb")) {
      return LinkType.SUPPORT;
    }
    if (containsAny(lower, "download", "driver", "software")
        || containsAny(lower, ".pdf", ".zip", ".exe", ".dmg", ".pkg")) {
      return LinkType.DOWNLOAD;
    }
    if (containsAny(lower, "video", "youtube", "vimeo")) {
      return LinkType.VIDEO;
    }
    if (containsAny(lower, "tutorial", "how-to", "guide")) {
      return LinkType.TUTORIAL;
    }
    return LinkType.EXTERNAL;
  }

  /** Portal category of a link, judged from its host. */
  public static String category(String url) {
    String host = hostOf(url);
    if (host.contains("youtube.com") || host.contains("youtu.be")) {
      return "youtube";
    }
    if (host.contains("vimeo.com")) {
      return "vimeo";
    }
    if (containsAny(host, "support", "kb")) {
      return "support_portal";
    }
    if (containsAny(host, "download", "driver")) {
      return "download_portal";
    }
    return "external";
  }

  /** Strips trailing punctuation and unbalanced closing parentheses picked up from prose. */
  static String cleanUrl(String url) {
    if (url == null) {
      return "";
    }
    String cleaned = url.strip();
    boolean changed = true;
    while (changed && !cleaned.isEmpty()) {
      changed = false;
      char last = cleaned.charAt(cleaned.length() - 1);
      if (".,;:!?'\"".indexOf(last) >= 0
          || (last == ')' && count(cleaned, '(') < count(cleaned, ')'))) {
        cleaned = cleaned.substring(0, cleaned.length() - 1);
        changed = true;
      }
    }
    int scheme = cleaned.indexOf("://");
    if (scheme >= 0 && cleaned.indexOf('.', scheme) < 0) {
      // host without a dot, typically cut at a line break
      return "";
    }
    return cleaned;
  }

  static boolean isPlaceholder(String url) {
    String lower = url.toLowerCase(Locale.ROOT);
    return PLACEHOLDER_IP.matcher(url).find() || PLACEHOLDERS.stream().anyMatch(lower::contains);
  }

  // ---- private helpers ----

  private ExtractedLink classify(ExtractedLink link) {
    String url = link.url();
    if (isDirectVideo(url)) {
      return link.toBuilder()
          .linkType(LinkType.VIDEO)
          .category("direct")
          .videoId(fileName(url))
          .build();
    }
    Optional<String> youtube = youtubeId(url);
    if (youtube.isPresent()) {
      return link.toBuilder()
          .linkType(LinkType.VIDEO)
          .category("youtube")
          .videoId(youtube.get())
          .build();
    }
    Optional<String> platform = videoPlatform(url);
    if (platform.isPresent()) {
      String id = "vimeo".equals(platform.get()) ? vimeoId(url).orElse(null) : null;
      return link.toBuilder()
          .linkType(LinkType.VIDEO)
          .category(platform.get())
          .videoId(id != null ? id : fileName(url))
          .build();
    }
    return link.toBuilder().linkType(linkType(url)).category(category(url)).build();
  }

  private Optional<VideoMetadata> videoFor(ExtractedLink link) {
    if (link.linkType() != LinkType.VIDEO || link.videoId() == null || link.videoId().isEmpty()) {
      return Optional.empty();
    }
    String platform = link.category();
    boolean lookupSupported = "youtube".equals(platform) || "vimeo".equals(platform);
    if (lookupSupported && config.getLinks().isVideoMetadataEnabled()) {
      Optional<VideoMetadata> looked =
          videoMetadataService.flatMap(
              service -> service.lookup(platform, link.videoId(), link.url()));
      if (looked.isPresent()) {
        return looked;
      }
    }
    return Optional.of(
        VideoMetadata.builder()
            .platform(platform)
            .videoId(link.videoId())
            .title("direct".equals(platform) ? titleFromFileName(link.videoId()) : null)
            .linkUrl(link.url())
            .build());
  }

  private static List<ExtractedLink> deduplicate(List<ExtractedLink> links) {
    Map<String, ExtractedLink> unique = new LinkedHashMap<>();
    for (ExtractedLink link : links) {
      unique.merge(
          link.normalizedUrl(),
          link,
          (existing, candidate) -> {
            if (candidate.confidence() > existing.confidence()) {
              return candidate;
            }
            boolean fillsDescription =
                isBlank(existing.description()) && !isBlank(candidate.description());
            return fillsDescription && candidate.confidence() == existing.confidence()
                ? candidate
                : existing;
          });
    }
    return new ArrayList<>(unique.values());
  }

  private static String description(String context, String url) {
    String description = context.replace(url, "").strip();
    String lower = description.toLowerCase(Locale.ROOT);
    for (String prefix : DESCRIPTION_PREFIXES) {
      if (lower.startsWith(prefix)) {
        description = description.substring(prefix.length()).strip();
        break;
      }
    }
    if (description.length() < 10 || description.chars().noneMatch(Character::isLetterOrDigit)) {
      for (String sentence : context.split("\\.")) {
        if (sentence.contains(url)) {
          description = sentence.replace(url, "").strip();
          break;
        }
      }
    }
    if (description.length() > MAX_DESCRIPTION) {
      description = description.substring(0, MAX_DESCRIPTION - 3) + "...";
    }
    description = description.replaceAll("^[.,;:\\-\\s]+|[.,;:\\-\\s]+$", "");
    return description.isEmpty()
        ? context.substring(0, Math.min(100, context.length()))
        : description;
  }

  private static Optional<String> uriOf(PDAnnotationLink link) {
    try {
      PDAction action = link.getAction();
      if (action instanceof PDActionURI uri && uri.getURI() != null) {
        return Optional.of(uri.getURI());
      }
    } catch (RuntimeException e) {
      log.debug("Skipping unreadable link annotation: {}", e.getMessage());
    }
    return Optional.empty();
  }

  private static Optional<String> videoPlatform(String url) {
    String lower = url.toLowerCase(Locale.ROOT);
    return VIDEO_PLATFORMS.entrySet().stream()
        .filter(e -> lower.contains(e.getKey()))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  private static String hostOf(String url) {
    try {
      String host = new URI(url).getHost();
      return host == null ? "" : host.toLowerCase(Locale.ROOT);
    } catch (URISyntaxException e) {
      log.debug("Unparseable URL {}: {}", url, e.getMessage());
      return "";
    }
  }

  private static String pathOf(String url) {
    int query = indexOfAny(url, '?', '#');
    return query >= 0 ? url.substring(0, query) : url;
  }

  private static String fileName(String url) {
    String path = pathOf(url);
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path.substring(path.lastIndexOf('/') + 1);
  }

  private static String titleFromFileName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return stem.replace('-', ' ').replace('_', ' ');
  }

  private static boolean containsAny(String value, String... needles) {
    for (String needle : needles) {
      if (value.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  private static int count(String value, char c) {
    return (int) value.chars().filter(ch -> ch == c).count();
  }

  private static int indexOfAny(String value, char a, char b) {
    int first = value.indexOf(a);
    int second = value.indexOf(b);
    if (first < 0) {
      return second;
    }
    return second < 0 ? first : Math.min(first, second);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static Map<String, String> videoPlatforms() {
    Map<String, String> platforms = new LinkedHashMap<>();
    platforms.put("vimeo.com", "vimeo");
    platforms.put("brightcove", "brightcove");
    platforms.put("wistia.com", "wistia");
    platforms.put("wistia.net", "wistia");
    platforms.put("vidyard.com", "vidyard");
    platforms.put("jwplayer.com", "jwplayer");
    platforms.put("kaltura.com", "kaltura");
    platforms.put("panopto.com", "panopto");
    platforms.put("loom.com", "loom");
    platforms.put("dailymotion.com", "dailymotion");
    platforms.put("bilibili.com", "bilibili");
    platforms.put("twitch.tv", "twitch");
    return Collections.unmodifiableMap(platforms);
  }

  // ---- inner types ----

  /**
   * Links and videos of one document.
   *
   * @param links unique, classified links
   * @param videos one entry per video link
   */
  public record LinkExtraction(List<ExtractedLink> links, List<VideoMetadata> videos) {

    static final LinkExtraction EMPTY = new LinkExtraction(List.of(), List.of());
  }
}
