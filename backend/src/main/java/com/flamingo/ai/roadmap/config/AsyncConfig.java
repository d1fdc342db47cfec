package com.flamingo.ai.roadmap.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background roadmap assemblies. */
@Configuration
public class AsyncConfig {

  /**
   * Each assembly occupies one thread for its whole lifetime, since batches run sequentially and
   * block on the provider.
   */
  @Bean(name = "roadmapGenerationExecutor")
  public ThreadPoolTaskExecutor roadmapGenerationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("roadmap-gen-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
