package com.flamingo.ai.roadmap.service.generation.context;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.testsupport.RoadmapFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextWindowExtractorTest {

  private RoadmapConfig config;
  private ContextWindowExtractor extractor;

  @BeforeEach
  void setUp() {
    config = new RoadmapConfig();
    extractor = new ContextWindowExtractor(config);
  }

  @Test
  void shouldReturnEmptyWindow_whenNoPreviousWeeks() {
    assertThat(extractor.extract(List.of()).isEmpty()).isTrue();
    assertThat(extractor.extract(null)).isEqualTo(ContextWindow.empty());
  }

  @Test
  void shouldKeepLastDaysOfLastWeek() {
    List<RoadmapWeek> previous =
        List.of(RoadmapFixtures.week(4, 5, 2), RoadmapFixtures.week(5, 5, 2));

    ContextWindow window = extractor.extract(previous);

    assertThat(window.sourceBatchEndWeek()).isEqualTo(5);
    assertThat(window.lastFocusArea()).isEqualTo("Focus 5");
    assertThat(window.tailDays()).extracting(RoadmapDay::dayNumber).containsExactly(4, 5);
    assertThat(window.tailDays().get(0).tasks().get(0).title()).isEqualTo("W5D4T1");
  }

  @Test
  void shouldCapTasksPerDayAndStripDetails() {
    config.getContext().setMaxTasksPerDay(2);

    ContextWindow window = extractor.extract(List.of(RoadmapFixtures.week(1, 3, 6)));

    assertThat(window.tailDays()).allSatisfy(day -> assertThat(day.tasks()).hasSize(2));
    assertThat(window.tailDays().get(0).tasks().get(0).description()).isEmpty();
    assertThat(window.tailDays().get(0).tasks().get(0).resources()).isEmpty();
  }

  @Test
  void shouldTruncateLongTitles() {
    config.getContext().setMaxTitleChars(10);

    ContextWindow window = extractor.extract(List.of(RoadmapFixtures.week(12, 2, 1)));

    String title = window.tailDays().get(0).tasks().get(0).title();
    assertThat(title).hasSizeLessThanOrEqualTo(10);
    assertThat(extractor.extract(List.of(RoadmapFixtures.week(123456, 1, 1))).lastFocusArea())
        .isEqualTo("Focus 1...");
  }

  @Test
  void shouldKeepWindowSizeConstant_whenRoadmapGrows() {
    List<RoadmapWeek> shortRoadmap = new ArrayList<>();
    List<RoadmapWeek> longRoadmap = new ArrayList<>();
    for (int w = 1; w <= 3; w++) {
      shortRoadmap.add(RoadmapFixtures.week(w, 5, 3));
    }
    for (int w = 1; w <= 60; w++) {
      longRoadmap.add(RoadmapFixtures.week(w, 5, 3));
    }
    longRoadmap.set(59, RoadmapFixtures.week(3, 5, 3));

    String shortText = extractor.extract(shortRoadmap).render();
    String longText = extractor.extract(longRoadmap).render();

    assertThat(longText).isEqualTo(shortText);
    assertThat(extractor.extract(longRoadmap).taskCount()).isEqualTo(6);
  }

  @Test
  void shouldRenderFirstBatchNotice_whenEmpty() {
    assertThat(ContextWindow.empty().render()).contains("first batch");
  }

  @Test
  void shouldRenderTaskSummaries() {
    String text = extractor.extract(List.of(RoadmapFixtures.week(2, 2, 1))).render();

    assertThat(text)
        .startsWith("Week 2 (Focus 2) ended with:")
        .contains("- Day 1: W2D1T1 [practice, difficulty 2]")
        .contains("- Day 2: W2D2T1");
  }
}
