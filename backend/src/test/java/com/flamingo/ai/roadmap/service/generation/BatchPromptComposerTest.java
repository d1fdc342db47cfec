package com.flamingo.ai.roadmap.service.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import com.flamingo.ai.roadmap.service.generation.context.ContextWindow;
import com.flamingo.ai.roadmap.service.generation.context.ContextWindowExtractor;
import com.flamingo.ai.roadmap.testsupport.RoadmapFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchPromptComposerTest {

  private final RoadmapConfig config = new RoadmapConfig();
  private final BatchPromptComposer composer = new BatchPromptComposer(config);

  @Test
  void shouldDescribeFirstBatch_withTitleRequest() {
    String prompt =
        composer.batchPrompt(
            RoadmapFixtures.backendDeveloper(), new WeekBatch(1, 3), 12, ContextWindow.empty());

    assertThat(prompt)
        .contains("Generate weeks 1 to 3 (3 of 12 weeks)")
        .contains("becoming a Backend Developer")
        .contains("Java, SQL, REST APIs, Docker")
        .contains("Each week has 5 days with 2 to 3 tasks per day")
        .contains("\"roadmap_title\"")
        .contains("first batch")
        .doesNotContain("{{");
  }

  @Test
  void shouldEmbedContextWindow_forContinuationBatch() {
    ContextWindow window =
        new ContextWindowExtractor(config).extract(List.of(RoadmapFixtures.week(3, 5, 2)));

    String prompt =
        composer.batchPrompt(RoadmapFixtures.backendDeveloper(), new WeekBatch(4, 6), 12, window);

    assertThat(prompt)
        .contains("Generate weeks 4 to 6")
        .contains("Week 3 (Focus 3) ended with:")
        .contains("Continue directly from where the previous part ended")
        .doesNotContain("\"roadmap_title\"")
        .doesNotContain("{{");
  }

  @Test
  void shouldUseDefaults_whenProfileHasNoSkills() {
    RoleContext context = RoleContext.builder().targetRole("Data Analyst").build();

    String prompt = composer.batchPrompt(context, new WeekBatch(1, 2), 2, ContextWindow.empty());

    assertThat(prompt).contains("Core skills for Data Analyst").contains("Foundational skills");
  }

  @Test
  void shouldFollowPhaseProgression() {
    assertThat(composer.phaseGuidance(new WeekBatch(1, 3), 12)).startsWith("Start with");
    assertThat(composer.phaseGuidance(new WeekBatch(4, 6), 12)).startsWith("Build core skills");
    assertThat(composer.phaseGuidance(new WeekBatch(7, 9), 12)).startsWith("Intermediate");
    assertThat(composer.phaseGuidance(new WeekBatch(10, 12), 12)).startsWith("Applied");
  }

  @Test
  void shouldTruncateProblem_inRepairPrompt() {
    String prompt = composer.repairPrompt(new WeekBatch(4, 6), "x".repeat(1000));

    assertThat(prompt).contains("weeks 4 to 6").contains("x".repeat(300) + "...");
    assertThat(prompt).doesNotContain("x".repeat(301));
  }

  @Test
  void shouldNameRole_inSystemPrompt() {
    assertThat(composer.systemPrompt(RoadmapFixtures.backendDeveloper()))
        .contains("a Backend Developer")
        .contains("Return ONLY valid JSON");
  }
}
