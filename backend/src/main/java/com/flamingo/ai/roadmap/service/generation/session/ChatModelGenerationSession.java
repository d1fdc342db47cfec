package com.flamingo.ai.roadmap.service.generation.session;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import com.flamingo.ai.roadmap.exception.GenerationCancelledException;
import com.flamingo.ai.roadmap.exception.ProviderFailureException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link GenerationSession} backed by a LangChain4j {@link ChatModel} and a {@link
 * MessageWindowChatMemory} holding the turns of this session only.
 *
 * <p>A turn is committed to memory only after the model answered. After an authentication or quota
 * failure the session refuses further calls with the same failure kind, so later batches fall back
 * without hitting the provider again.
 *
 * <p>The HTTP client reports an interrupted call as a plain {@link RuntimeException} and clears the
 * interrupt flag. Such failures restore the flag and surface as {@link
 * GenerationCancelledException}, never as a retryable provider failure.
 */
@Slf4j
public class ChatModelGenerationSession implements GenerationSession {

  private final String id;
  private final ChatModel chatModel;
  private final ChatMemory memory;
  private final ProviderErrorClassifier errorClassifier;

  private ProviderFailureKind disabledBy;
  private boolean open = true;
  private int turns;

  public ChatModelGenerationSession(
      String id,
      ChatModel chatModel,
      ProviderErrorClassifier errorClassifier,
      String systemPrompt,
      int maxMessages) {
    this.id = id;
    this.chatModel = chatModel;
    this.errorClassifier = errorClassifier;
    this.memory = MessageWindowChatMemory.builder().id(id).maxMessages(maxMessages).build();
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      memory.add(SystemMessage.from(systemPrompt));
    }
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String send(String prompt) {
    if (!open) {
      throw new IllegalStateException("Generation session " + id + " is closed");
    }
    if (disabledBy != null) {
      throw new ProviderFailureException(
          disabledBy, "Session " + id + " disabled after earlier " + disabledBy + " failure");
    }

    UserMessage userMessage = UserMessage.from(prompt);
    List<ChatMessage> request = new ArrayList<>(memory.messages());
    request.add(userMessage);

    ChatResponse response;
    try {
      log.debug("Session {} sending turn {} ({} chars)", id, turns + 1, prompt.length());
      response = chatModel.chat(request);
    } catch (RuntimeException e) {
      if (Thread.interrupted() || causedByInterrupt(e)) {
        Thread.currentThread().interrupt();
        log.debug("Session {} interrupted during turn {}", id, turns + 1);
        throw new GenerationCancelledException("Generation session " + id + " interrupted", e);
      }
      ProviderFailureKind kind = errorClassifier.classify(e);
      if (kind.disablesSession()) {
        disabledBy = kind;
      }
      log.warn("Session {} provider call failed ({}): {}", id, kind, e.getMessage());
      throw new ProviderFailureException(kind, "Provider call failed: " + e.getMessage(), e);
    }

    AiMessage aiMessage = response != null ? response.aiMessage() : null;
    if (aiMessage == null || aiMessage.text() == null) {
      log.warn("Session {} received a response without text", id);
      return "";
    }

    memory.add(userMessage);
    memory.add(aiMessage);
    turns++;
    log.debug("Session {} received {} chars", id, aiMessage.text().length());
    return aiMessage.text();
  }

  private static boolean causedByInterrupt(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
      if (t instanceof InterruptedException) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int turnCount() {
    return turns;
  }

  @Override
  public List<ChatMessage> history() {
    return List.copyOf(memory.messages());
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    if (open) {
      open = false;
      memory.clear();
      log.debug("Session {} closed after {} turn(s)", id, turns);
    }
  }
}
