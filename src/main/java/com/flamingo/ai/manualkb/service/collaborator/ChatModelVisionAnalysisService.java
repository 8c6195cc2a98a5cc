package com.flamingo.ai.manualkb.service.collaborator;

import com.flamingo.ai.manualkb.exception.LlmServiceException;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Base64;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** {@link VisionAnalysisService} that sends the image to a multimodal chat model. */
@Service
@ConditionalOnProperty(
    name = {"manualkb.inference.enabled", "manualkb.images.vision-enabled"},
    havingValue = "true")
@Slf4j
public class ChatModelVisionAnalysisService implements VisionAnalysisService {

  private static final String PROMPT =
      "Describe this figure from a printer service manual in two sentences. Name the assembly or"
          + " component shown and any labels, arrows or callouts that matter for a technician.";

  private final ChatModel visionChatModel;

  public ChatModelVisionAnalysisService(@Qualifier("visionChatModel") ChatModel visionChatModel) {
    this.visionChatModel = visionChatModel;
  }

  @Override
  public Optional<String> describe(byte[] image, String mimeType) {
    UserMessage message =
        UserMessage.from(
            TextContent.from(PROMPT),
            ImageContent.from(Base64.getEncoder().encodeToString(image), mimeType));
    try {
      ChatResponse response = visionChatModel.chat(message);
      String text = response.aiMessage() == null ? null : response.aiMessage().text();
      return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.strip());
    } catch (RuntimeException e) {
      throw new LlmServiceException("vision", "Image description failed", e);
    }
  }
}
