package com.flamingo.ai.manualkb.service.pipeline;

import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.domain.model.ExtractedEntity;
import com.flamingo.ai.manualkb.domain.model.ProcessingResult;
import com.flamingo.ai.manualkb.domain.model.ProcessingStatistics;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/** Computes the aggregate figures reported with a processing result. */
@Component
public class StatisticsCalculator {

  public ProcessingStatistics calculate(ProcessingResult result, Map<Integer, String> pageTexts) {
    long characters = 0;
    long words = 0;
    for (String text : pageTexts.values()) {
      if (text == null || text.isBlank()) {
        continue;
      }
      characters += text.length();
      words += text.strip().split("\\s+").length;
    }

    Map<String, Integer> distribution = new TreeMap<>();
    for (TextChunk chunk : result.chunks()) {
      distribution.merge(chunk.chunkType().getValue(), 1, Integer::sum);
    }

    int pages = result.metadata() != null ? result.metadata().pageCount() : pageTexts.size();
    return ProcessingStatistics.builder()
        .totalPages(pages)
        .totalCharacters(characters)
        .totalWords(words)
        .totalChunks(result.chunks().size())
        .totalProducts(result.products().size())
        .totalParts(result.parts().size())
        .totalErrorCodes(result.errorCodes().size())
        .totalVersions(result.versions().size())
        .totalImages(result.images().size())
        .totalLinks(result.links().size())
        .totalVideos(result.videos().size())
        .linkedErrorCodes((int) result.errorCodes().stream().filter(ErrorCode::isLinked).count())
        .averageProductConfidence(averageConfidence(result.products()))
        .averageErrorCodeConfidence(averageConfidence(result.errorCodes()))
        .averagePartConfidence(averageConfidence(result.parts()))
        .chunkTypeDistribution(distribution)
        .averageChunkSize(
            round(result.chunks().stream().mapToInt(c -> c.text().length()).average().orElse(0)))
        .build();
  }

  private static double averageConfidence(Collection<? extends ExtractedEntity> entities) {
    return round(entities.stream().mapToDouble(ExtractedEntity::confidence).average().orElse(0));
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
