package com.flamingo.ai.manualkb.service.collaborator;

import com.flamingo.ai.manualkb.exception.LlmServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** {@link EmbeddingClient} over a LangChain4j {@link EmbeddingModel}. */
@Service
@ConditionalOnProperty(name = "manualkb.inference.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingClient implements EmbeddingClient {

  private final EmbeddingModel embeddingModel;

  @Override
  public List<float[]> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    try {
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      log.debug("Embedded {} texts", embeddings.size());
      return embeddings.stream().map(Embedding::vector).toList();
    } catch (RuntimeException e) {
      throw new LlmServiceException("embedding", "Embedding batch failed", e);
    }
  }
}
