package com.flamingo.ai.manualkb.config;

import com.flamingo.ai.manualkb.agent.ProductInferenceAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage; AiServices.builder() provides
 * the implementation.
 */
@Configuration
@ConditionalOnProperty(name = "manualkb.inference.enabled", havingValue = "true")
public class AiAgentConfig {

  /** Product model inference agent. Uses the JSON-mode chat model for structured output. */
  @Bean
  public ProductInferenceAgent productInferenceAgent(ChatModel chatModel) {
    return AiServices.builder(ProductInferenceAgent.class).chatModel(chatModel).build();
  }
}
