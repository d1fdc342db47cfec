package com.flamingo.ai.roadmap;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.service.generation.RetryPolicy;
import com.flamingo.ai.roadmap.service.generation.session.GenerationSessionFactory;
import com.flamingo.ai.roadmap.service.roadmap.RoadmapGenerationService;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The chat model is mocked so no API key or network
 * access is needed.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Generation beans should be wired from application.yml")
  void generationBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(RoadmapGenerationService.class)).isNotNull();
    assertThat(applicationContext.getBean(GenerationSessionFactory.class)).isNotNull();

    RoadmapConfig config = applicationContext.getBean(RoadmapConfig.class);
    assertThat(config.getBatching().getMaxWeeksPerBatch()).isEqualTo(3);
    assertThat(config.getGeneration().getFirstBatchFailure())
        .isEqualTo(RoadmapConfig.FirstBatchFailurePolicy.ABORT);
    assertThat(applicationContext.getBean(RetryPolicy.class).maxAttempts()).isEqualTo(3);
  }
}
