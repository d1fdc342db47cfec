package com.flamingo.ai.roadmap.config;

import com.flamingo.ai.roadmap.service.generation.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resilience settings for provider calls. */
@Configuration
@Slf4j
public class ResilienceConfig {

  @Bean
  public RetryPolicy providerRetryPolicy(RoadmapConfig roadmapConfig) {
    RetryPolicy policy = RetryPolicy.from(roadmapConfig.getRetry());
    log.info(
        "Provider retry policy: {} attempts, backoff {} x{} up to {}",
        policy.maxAttempts(),
        policy.baseDelay(),
        policy.multiplier(),
        policy.maxDelay());
    return policy;
  }
}
