package com.flamingo.ai.roadmap.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for roadmap generation metrics. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on the assembly entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> roadmapCommonTags() {
    return registry -> registry.config().commonTags("component", "roadmap-engine");
  }
}
