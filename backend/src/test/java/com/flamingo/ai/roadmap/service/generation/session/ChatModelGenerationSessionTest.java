package com.flamingo.ai.roadmap.service.generation.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import com.flamingo.ai.roadmap.exception.GenerationCancelledException;
import com.flamingo.ai.roadmap.exception.ProviderFailureException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatModelGenerationSessionTest {

  @Mock private ChatModel chatModel;

  @Captor private ArgumentCaptor<List<ChatMessage>> requestCaptor;

  private ChatModelGenerationSession session;

  @BeforeEach
  void setUp() {
    session =
        new ChatModelGenerationSession(
            "test-session", chatModel, new ProviderErrorClassifier(), "You are a mentor", 20);
  }

  @AfterEach
  void clearInterruptFlag() {
    Thread.interrupted();
  }

  private static ChatResponse reply(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Test
  void shouldCarryPreviousTurns_whenSendingNextPrompt() {
    // Given
    when(chatModel.chat(anyList())).thenReturn(reply("first answer"), reply("second answer"));

    // When
    session.send("weeks 1-3");
    String second = session.send("weeks 4-6");

    // Then
    assertThat(second).isEqualTo("second answer");
    verify(chatModel, times(2)).chat(requestCaptor.capture());
    List<ChatMessage> secondRequest = requestCaptor.getAllValues().get(1);
    assertThat(secondRequest).hasSize(4);
    assertThat(secondRequest.get(0)).isInstanceOf(SystemMessage.class);
    assertThat(((UserMessage) secondRequest.get(1)).singleText()).isEqualTo("weeks 1-3");
    assertThat(((AiMessage) secondRequest.get(2)).text()).isEqualTo("first answer");
    assertThat(((UserMessage) secondRequest.get(3)).singleText()).isEqualTo("weeks 4-6");
    assertThat(session.turnCount()).isEqualTo(2);
  }

  @Test
  void shouldNotCommitFailedTurn() {
    // Given
    when(chatModel.chat(anyList()))
        .thenThrow(new InternalServerException("upstream error"))
        .thenReturn(reply("ok"));

    // When
    assertThatThrownBy(() -> session.send("weeks 1-3"))
        .isInstanceOf(ProviderFailureException.class)
        .extracting(e -> ((ProviderFailureException) e).getKind())
        .isEqualTo(ProviderFailureKind.TRANSIENT);
    session.send("weeks 1-3 again");

    // Then
    assertThat(session.history()).hasSize(3);
    assertThat(((UserMessage) session.history().get(1)).singleText())
        .isEqualTo("weeks 1-3 again");
    assertThat(session.turnCount()).isEqualTo(1);
  }

  @Test
  void shouldFailFast_afterNonTransientFailure() {
    // Given
    when(chatModel.chat(anyList())).thenThrow(new AuthenticationException("invalid api key"));
    assertThatThrownBy(() -> session.send("weeks 1-3"))
        .isInstanceOf(ProviderFailureException.class);

    // When / Then
    assertThatThrownBy(() -> session.send("weeks 4-6"))
        .isInstanceOf(ProviderFailureException.class)
        .extracting(e -> ((ProviderFailureException) e).getKind())
        .isEqualTo(ProviderFailureKind.AUTH_FAILURE);
    verify(chatModel, times(1)).chat(anyList());
  }

  @Test
  void shouldKeepSessionUsable_whenRequestIsRejected() {
    // Given
    when(chatModel.chat(anyList()))
        .thenThrow(new HttpException(400, "maximum context length exceeded"))
        .thenReturn(reply("ok"));

    // When
    assertThatThrownBy(() -> session.send("weeks 1-3"))
        .isInstanceOf(ProviderFailureException.class)
        .extracting(e -> ((ProviderFailureException) e).getKind())
        .isEqualTo(ProviderFailureKind.REQUEST_REJECTED);
    String next = session.send("weeks 4-6");

    // Then
    assertThat(next).isEqualTo("ok");
    verify(chatModel, times(2)).chat(anyList());
  }

  @Test
  void shouldReportCancellation_whenHttpClientWrapsInterrupt() {
    // Given
    when(chatModel.chat(anyList()))
        .thenThrow(new RuntimeException(new InterruptedException("sleep interrupted")));

    // When
    assertThatThrownBy(() -> session.send("weeks 1-3"))
        .isInstanceOf(GenerationCancelledException.class)
        .hasCauseInstanceOf(RuntimeException.class);

    // Then
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    assertThat(session.turnCount()).isZero();
    assertThat(session.history()).hasSize(1);
  }

  @Test
  void shouldReturnEmptyText_whenProviderSendsNoResponse() {
    when(chatModel.chat(anyList())).thenReturn(null);

    assertThat(session.send("weeks 1-3")).isEmpty();
    assertThat(session.turnCount()).isZero();
  }

  @Test
  void shouldRejectSend_afterClose() {
    session.close();
    session.close();

    assertThat(session.isOpen()).isFalse();
    assertThatThrownBy(() -> session.send("weeks 1-3")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldEvictOldTurns_whenWindowIsFull() {
    ChatModelGenerationSession small =
        new ChatModelGenerationSession(
            "small", chatModel, new ProviderErrorClassifier(), "system", 3);
    when(chatModel.chat(anyList())).thenReturn(reply("a1"), reply("a2"));

    small.send("q1");
    small.send("q2");

    assertThat(small.history()).hasSize(3);
    assertThat(small.history().get(0)).isInstanceOf(SystemMessage.class);
    assertThat(((AiMessage) small.history().get(2)).text()).isEqualTo("a2");
  }
}
