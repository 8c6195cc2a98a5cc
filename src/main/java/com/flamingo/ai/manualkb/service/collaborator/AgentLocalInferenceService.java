package com.flamingo.ai.manualkb.service.collaborator;

import com.flamingo.ai.manualkb.agent.ProductInferenceAgent;
import com.flamingo.ai.manualkb.agent.dto.ProductSuggestions;
import com.flamingo.ai.manualkb.exception.LlmServiceException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** {@link LocalInferenceService} backed by the LangChain4j {@link ProductInferenceAgent}. */
@Service
@ConditionalOnProperty(name = "manualkb.inference.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AgentLocalInferenceService implements LocalInferenceService {

  private final ProductInferenceAgent productInferenceAgent;

  @Override
  public List<String> suggestProductModels(String text, String manufacturer) {
    try {
      ProductSuggestions suggestions = productInferenceAgent.suggest(manufacturer, text);
      if (suggestions == null || suggestions.models() == null) {
        return List.of();
      }
      log.debug("Inference suggested {} product models", suggestions.models().size());
      return suggestions.models();
    } catch (RuntimeException e) {
      throw new LlmServiceException("product_inference", "Product inference failed", e);
    }
  }
}
