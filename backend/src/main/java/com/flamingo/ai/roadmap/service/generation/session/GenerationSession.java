package com.flamingo.ai.roadmap.service.generation.session;

import com.flamingo.ai.roadmap.exception.ProviderFailureException;
import dev.langchain4j.data.message.ChatMessage;
import java.util.List;

/**
 * Stateful conversation with the generative provider, owned by exactly one roadmap assembly.
 *
 * <p>Every {@link #send} carries the turns exchanged so far, so prompts only need to describe the
 * next batch. Implementations are not thread-safe; one assembly uses one session from one thread.
 */
public interface GenerationSession extends AutoCloseable {

  /** Identifier used in logs. */
  String id();

  /**
   * Sends the next user turn and returns the provider's text reply.
   *
   * @param prompt instructions for the next batch
   * @return reply text, empty if the provider returned no text
   * @throws ProviderFailureException if the call fails; the failed turn is not kept in history
   * @throws IllegalStateException if the session is closed
   */
  String send(String prompt);

  /** Number of completed turns. */
  int turnCount();

  /** Conversation as currently retained, system message first. */
  List<ChatMessage> history();

  boolean isOpen();

  /** Releases the session. Idempotent. */
  @Override
  void close();
}
