package com.flamingo.ai.manualkb.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for LangChain4j models served by a local OpenAI-compatible inference server
 * (Ollama, vLLM, LM Studio).
 */
@Configuration
@ConditionalOnProperty(name = "manualkb.inference.enabled", havingValue = "true")
public class LangChain4jConfig {

  @Bean
  @Primary
  public ChatModel chatModel(ManualKbConfig config) {
    ManualKbConfig.Inference inference = config.getInference();
    validateBaseUrl(inference);

    return OpenAiChatModel.builder()
        .baseUrl(inference.getBaseUrl())
        .apiKey(inference.getApiKey())
        .modelName(inference.getChatModel())
        .timeout(Duration.ofSeconds(inference.getTimeoutSeconds()))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Multimodal model for figure descriptions; free-form text output. */
  @Bean
  public ChatModel visionChatModel(ManualKbConfig config) {
    ManualKbConfig.Inference inference = config.getInference();
    validateBaseUrl(inference);

    return OpenAiChatModel.builder()
        .baseUrl(inference.getBaseUrl())
        .apiKey(inference.getApiKey())
        .modelName(inference.getVisionModel())
        .timeout(Duration.ofSeconds(inference.getTimeoutSeconds()))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel(ManualKbConfig config) {
    ManualKbConfig.Inference inference = config.getInference();
    validateBaseUrl(inference);

    return OpenAiEmbeddingModel.builder()
        .baseUrl(inference.getBaseUrl())
        .apiKey(inference.getApiKey())
        .modelName(inference.getEmbeddingModel())
        .timeout(Duration.ofSeconds(inference.getTimeoutSeconds()))
        .build();
  }

  private void validateBaseUrl(ManualKbConfig.Inference inference) {
    if (inference.getBaseUrl() == null || inference.getBaseUrl().isBlank()) {
      throw new IllegalStateException(
          "Inference base URL is required when manualkb.inference.enabled=true.");
    }
  }
}
