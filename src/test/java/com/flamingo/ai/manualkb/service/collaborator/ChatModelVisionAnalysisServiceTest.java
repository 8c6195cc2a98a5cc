package com.flamingo.ai.manualkb.service.collaborator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.manualkb.exception.LlmServiceException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatModelVisionAnalysisServiceTest {

  private static final byte[] IMAGE = {1, 2, 3};

  @Mock private ChatModel visionChatModel;

  private ChatModelVisionAnalysisService service;

  @BeforeEach
  void setUp() {
    service = new ChatModelVisionAnalysisService(visionChatModel);
  }

  @Test
  @DisplayName("Should send the image with a prompt and return the trimmed description")
  void shouldDescribeImage() {
    // Given
    when(visionChatModel.chat(any(ChatMessage.class)))
        .thenReturn(response("  Exploded view of the fuser assembly.  "));

    // When
    var description = service.describe(IMAGE, "image/png");

    // Then
    assertThat(description).contains("Exploded view of the fuser assembly.");
    ArgumentCaptor<ChatMessage> captor = ArgumentCaptor.forClass(ChatMessage.class);
    verify(visionChatModel).chat(captor.capture());
    UserMessage sent = (UserMessage) captor.getValue();
    assertThat(sent.contents()).hasSize(2);
    ImageContent image = (ImageContent) sent.contents().get(1);
    assertThat(image.image().mimeType()).isEqualTo("image/png");
    assertThat(image.image().base64Data()).isEqualTo("AQID");
  }

  @Test
  @DisplayName("Should return nothing for a blank answer")
  void shouldReturnEmpty_whenBlank() {
    when(visionChatModel.chat(any(ChatMessage.class))).thenReturn(response(" "));

    assertThat(service.describe(IMAGE, "image/png")).isEmpty();
  }

  @Test
  @DisplayName("Should wrap model failures")
  void shouldWrapFailures() {
    when(visionChatModel.chat(any(ChatMessage.class)))
        .thenThrow(new IllegalStateException("model not loaded"));

    assertThatThrownBy(() -> service.describe(IMAGE, "image/png"))
        .isInstanceOf(LlmServiceException.class)
        .hasRootCauseMessage("model not loaded");
  }

  private static ChatResponse response(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }
}
