package com.flamingo.ai.roadmap.service.generation.session;

/** Opens provider sessions; one per roadmap assembly. */
public interface GenerationSessionFactory {

  /**
   * Opens a new session primed with a system prompt.
   *
   * @param systemPrompt instructions kept for the whole conversation
   * @return an open session
   */
  GenerationSession open(String systemPrompt);
}
