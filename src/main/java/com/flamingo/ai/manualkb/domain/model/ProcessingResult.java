package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.DocumentStatus;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Singular;

/** Everything a pipeline run produced, including the problems it tolerated. */
@Builder(toBuilder = true)
public record ProcessingResult(
    boolean success,
    DocumentStatus status,
    UUID documentId,
    DocumentMetadata metadata,
    ManufacturerDetection manufacturer,
    @Singular List<ProductModel> products,
    @Singular List<Part> parts,
    @Singular List<ErrorCode> errorCodes,
    @Singular List<DocumentVersion> versions,
    @Singular List<TextChunk> chunks,
    @Singular List<PageImage> images,
    @Singular List<ExtractedLink> links,
    @Singular List<VideoMetadata> videos,
    @Singular List<ValidationIssue> validationIssues,
    ProcessingStatistics statistics,
    long processingTimeMillis,
    String errorMessage) {

  public static ProcessingResult failed(
      UUID documentId, String errorMessage, List<ValidationIssue> issues, long elapsedMillis) {
    return ProcessingResult.builder()
        .success(false)
        .status(DocumentStatus.FAILED)
        .documentId(documentId)
        .validationIssues(issues)
        .processingTimeMillis(elapsedMillis)
        .errorMessage(errorMessage)
        .build();
  }

  /** The best (highest) document version, when any was found. */
  public DocumentVersion primaryVersion() {
    return versions.isEmpty() ? null : versions.get(0);
  }
}
