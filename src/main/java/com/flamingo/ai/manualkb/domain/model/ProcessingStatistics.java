package com.flamingo.ai.manualkb.domain.model;

import java.util.Map;
import lombok.Builder;

/** Aggregate counts and averages reported at the end of a pipeline run. */
@Builder
public record ProcessingStatistics(
    int totalPages,
    long totalCharacters,
    long totalWords,
    int totalChunks,
    int totalProducts,
    int totalParts,
    int totalErrorCodes,
    int totalVersions,
    int totalImages,
    int totalLinks,
    int totalVideos,
    int linkedErrorCodes,
    double averageProductConfidence,
    double averageErrorCodeConfidence,
    double averagePartConfidence,
    Map<String, Integer> chunkTypeDistribution,
    double averageChunkSize) {}
