package com.flamingo.ai.manualkb.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the manual extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "manualkb")
@Getter
@Setter
public class ManualKbConfig {

  private Extraction extraction = new Extraction();
  private Language language = new Language();
  private Ocr ocr = new Ocr();
  private StructuredScan structuredScan = new StructuredScan();
  private Detection detection = new Detection();
  private Chunking chunking = new Chunking();
  private Pipeline pipeline = new Pipeline();
  private Images images = new Images();
  private Links links = new Links();
  private Inference inference = new Inference();
  private Storage storage = new Storage();
  private Rules rules = new Rules();

  @Getter
  @Setter
  public static class Extraction {
    /** Preferred backend: "pdfbox" (default) or "tika". */
    private String preferredEngine = "pdfbox";

    /** Whether a whole-document failure retries with the alternate backend. */
    private boolean fallbackEnabled = true;
  }

  @Getter
  @Setter
  public static class Language {
    private boolean enabled = true;
    private int samplePages = 5;
    private int sampleChars = 5000;

    /** Detections below this probability are reported as "unknown". */
    private double minProbability = 0.80;
  }

  @Getter
  @Setter
  public static class Ocr {
    /** Per-page OCR fallback with Tesseract. Disabled by default. */
    private boolean enabled = false;

    private float renderDpi = 300f;

    /** Directory holding the Tesseract traineddata files; TESSDATA_PREFIX when empty. */
    private String dataPath = "";

    /** Tesseract language codes, joined with '+'. */
    private String language = "eng";
  }

  @Getter
  @Setter
  public static class StructuredScan {
    private boolean enabled = true;
    private int maxLines = 200;
    private int maxLineLength = 300;
  }

  @Getter
  @Setter
  public static class Detection {
    private double filenameWeight = 10;
    private double authorWeight = 8;
    private double titleWeight = 5;

    /** Each text mention adds this weight until the cap is reached. */
    private double textMentionWeight = 1;

    private double textMentionCap = 3;
    private int textSamplePages = 3;

    private double excellentThreshold = 20;
    private double veryHighThreshold = 15;
    private double highThreshold = 10;
    private double mediumThreshold = 5;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 100;
    private int minChunkSize = 50;

    /** Paragraphs shorter than this are merged into the next one. */
    private int shortParagraphLength = 100;
  }

  @Getter
  @Setter
  public static class Pipeline {
    /** Canonical manufacturer name, or "AUTO" to detect it per document. */
    private String manufacturer = "AUTO";

    private int productPages = 5;
    private int versionPages = 5;

    /** Bounded pool size for per-page entity extraction. */
    private int pageWorkers = 4;

    private boolean enrichErrorCodes = true;
    private boolean embeddingsEnabled = false;
  }

  @Getter
  @Setter
  public static class Images {
    private boolean enabled = true;

    /** Images with fewer pixels than this are skipped (icons, bullets). */
    private int minPixelArea = 10_000;

    private int maxImagesPerDocument = 500;
    private boolean visionEnabled = false;
  }

  @Getter
  @Setter
  public static class Links {
    private boolean enabled = true;
    private boolean videoMetadataEnabled = false;
    private String youtubeOembedUrl = "https://www.youtube.com/oembed";
    private String vimeoOembedUrl = "https://vimeo.com/api/oembed.json";
    private int videoLookupTimeoutMs = 5000;
  }

  @Getter
  @Setter
  public static class Inference {
    /** Enables the local LLM beans and supplemental product extraction. */
    private boolean enabled = false;

    /** OpenAI-compatible endpoint of the local inference server. */
    private String baseUrl = "http://localhost:11434/v1";

    private String apiKey = "local";
    private String chatModel = "llama3.1:8b";
    private String embeddingModel = "nomic-embed-text";
    private String visionModel = "llava:13b";
    private int timeoutSeconds = 60;
    private int maxTextChars = 4000;
  }

  @Getter
  @Setter
  public static class Storage {
    /** Root directory of the filesystem object store. */
    private String basePath = "data/objects";

    private String bucket = "document-images";
  }

  @Getter
  @Setter
  public static class Rules {
    private String manufacturers = "config/manufacturers.json";
    private String errorCodes = "config/error_code_patterns.json";
    private String parts = "config/parts_patterns.json";
    private String products = "config/product_patterns.json";
    private String versions = "config/version_patterns.json";
  }
}
