package com.flamingo.ai.roadmap.service.generation.session;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import dev.langchain4j.model.chat.ChatModel;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Opens {@link ChatModelGenerationSession}s against the configured chat model. */
@Component
@RequiredArgsConstructor
public class ChatModelGenerationSessionFactory implements GenerationSessionFactory {

  private final ChatModel chatModel;
  private final ProviderErrorClassifier errorClassifier;
  private final RoadmapConfig roadmapConfig;

  @Override
  public GenerationSession open(String systemPrompt) {
    return new ChatModelGenerationSession(
        "roadmap-" + UUID.randomUUID(),
        chatModel,
        errorClassifier,
        systemPrompt,
        roadmapConfig.getSession().getMaxMessages());
  }
}
