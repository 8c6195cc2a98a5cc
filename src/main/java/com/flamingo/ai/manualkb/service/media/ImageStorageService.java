package com.flamingo.ai.manualkb.service.media;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;
import com.flamingo.ai.manualkb.domain.model.PageImage;
import com.flamingo.ai.manualkb.domain.model.ValidationIssue;
import com.flamingo.ai.manualkb.exception.LlmServiceException;
import com.flamingo.ai.manualkb.service.collaborator.ObjectStorageClient;
import com.flamingo.ai.manualkb.service.collaborator.VisionAnalysisService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Uploads extracted images to object storage under their content hash and, when enabled, asks the
 * vision collaborator for a description.
 *
 * <p>An image whose hash already exists in the bucket is not uploaded again. Upload or vision
 * failures leave the image without a URL or description and are reported as warnings.
 */
@Service
@Slf4j
public class ImageStorageService {

  static final String STAGE = "image_storage";

  private final ObjectStorageClient storageClient;
  private final Optional<VisionAnalysisService> visionService;
  private final ManualKbConfig config;

  public ImageStorageService(
      ObjectStorageClient storageClient,
      Optional<VisionAnalysisService> visionService,
      ManualKbConfig config) {
    this.storageClient = storageClient;
    this.visionService = visionService;
    this.config = config;
  }

  /**
   * Stores images and returns them with storage URLs and descriptions filled in.
   *
   * @param images images of one document
   * @return stored images in input order plus the problems met on the way
   */
  public StoredImages store(List<PageImage> images) {
    String bucket = config.getStorage().getBucket();
    boolean describe = config.getImages().isVisionEnabled() && visionService.isPresent();
    List<PageImage> stored = new ArrayList<>(images.size());
    List<ValidationIssue> issues = new ArrayList<>();
    int uploaded = 0;
    int reused = 0;

    for (PageImage image : images) {
      PageImage.PageImageBuilder builder = image.toBuilder();
      String key = objectKey(image);
      try {
        if (storageClient.exists(bucket, key)) {
          builder.storageUrl(storageClient.urlFor(bucket, key));
          reused++;
        } else {
          builder.storageUrl(storageClient.upload(bucket, key, image.data(), image.mimeType()));
          uploaded++;
        }
      } catch (IOException e) {
        log.warn("Upload of image {} failed: {}", image.fileHash(), e.getMessage());
        issues.add(issue("storage_url", image, "Upload failed: " + e.getMessage()));
      }
      if (describe) {
        try {
          visionService
              .get()
              .describe(image.data(), image.mimeType())
              .ifPresent(builder::aiDescription);
        } catch (LlmServiceException e) {
          log.warn("Vision analysis of image {} failed: {}", image.fileHash(), e.getMessage());
          issues.add(issue("ai_description", image, "Vision analysis failed: " + e.getMessage()));
        }
      }
      stored.add(builder.build());
    }
    log.info("Stored {} images ({} uploaded, {} already present)", stored.size(), uploaded, reused);
    return new StoredImages(List.copyOf(stored), List.copyOf(issues));
  }

  /** Object key of an image: content hash plus a file extension derived from its MIME type. */
  public static String objectKey(PageImage image) {
    String mime = image.mimeType() == null ? "" : image.mimeType();
    String extension = mime.startsWith("image/") ? mime.substring("image/".length()) : "bin";
    return image.fileHash() + "." + ("jpeg".equals(extension) ? "jpg" : extension);
  }

  // ---- private helpers ----

  private static ValidationIssue issue(String field, PageImage image, String message) {
    return new ValidationIssue(STAGE, field, image.fileHash(), message, IssueSeverity.WARNING);
  }

  // ---- inner types ----

  /**
   * Result of storing a document's images.
   *
   * @param images images with storage URLs and descriptions where available
   * @param issues non-fatal upload and vision problems
   */
  public record StoredImages(List<PageImage> images, List<ValidationIssue> issues) {}
}
