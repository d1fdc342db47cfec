package com.flamingo.ai.roadmap.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat model used to generate roadmap batches.
 *
 * <p>Any OpenAI-compatible endpoint works (set {@code langchain4j.openai.base-url}). Client-side
 * retries are disabled because {@code ChunkOrchestrator} applies its own retry policy per batch.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:4096}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.temperature:0.7}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.timeout:PT90S}")
  private Duration timeout;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(temperature)
        .timeout(timeout)
        .maxRetries(0)
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
