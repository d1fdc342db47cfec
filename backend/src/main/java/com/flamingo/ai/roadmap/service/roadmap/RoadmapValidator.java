package com.flamingo.ai.roadmap.service.roadmap;

import com.flamingo.ai.roadmap.domain.model.BatchReport;
import com.flamingo.ai.roadmap.domain.model.Roadmap;
import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapTask;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.exception.RoadmapValidationException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Checks the structural invariants of an assembled roadmap. */
@Component
@Slf4j
public class RoadmapValidator {

  private static final double EPSILON = 1e-9;

  /**
   * Validates the roadmap.
   *
   * @throws RoadmapValidationException listing every violation found
   */
  public void validate(Roadmap roadmap) {
    List<String> violations = new ArrayList<>();
    checkWeekNumbering(roadmap, violations);
    checkBatchPartition(roadmap, violations);
    checkCompletionFraction(roadmap, violations);
    checkContent(roadmap, violations);

    if (!violations.isEmpty()) {
      log.error("Roadmap for '{}' failed validation: {}", roadmap.targetRole(), violations);
      throw new RoadmapValidationException(violations);
    }
  }

  private void checkWeekNumbering(Roadmap roadmap, List<String> violations) {
    List<RoadmapWeek> weeks = roadmap.weeks();
    if (weeks.size() != roadmap.totalWeeks()) {
      violations.add("Expected " + roadmap.totalWeeks() + " weeks but found " + weeks.size());
    }
    for (int i = 0; i < weeks.size(); i++) {
      if (weeks.get(i).weekNumber() != i + 1) {
        violations.add("Week at position " + (i + 1) + " is numbered " + weeks.get(i).weekNumber());
      }
    }
  }

  private void checkBatchPartition(Roadmap roadmap, List<String> violations) {
    int expectedStart = 1;
    for (BatchReport report : roadmap.batchReports()) {
      if (report.batch().startWeek() != expectedStart) {
        violations.add("Batch " + report.batch() + " does not start at week " + expectedStart);
      }
      expectedStart = report.batch().endWeek() + 1;
    }
    if (expectedStart != roadmap.totalWeeks() + 1) {
      violations.add(
          "Batches cover weeks 1-" + (expectedStart - 1) + " of " + roadmap.totalWeeks());
    }
  }

  private void checkCompletionFraction(Roadmap roadmap, List<String> violations) {
    long generated = roadmap.weeks().stream().filter(RoadmapWeek::isGenerated).count();
    double expected = roadmap.totalWeeks() == 0 ? 0.0 : (double) generated / roadmap.totalWeeks();
    if (Math.abs(roadmap.completionFraction() - expected) > EPSILON) {
      violations.add(
          "Completion fraction " + roadmap.completionFraction() + " does not match " + expected);
    }
  }

  private void checkContent(Roadmap roadmap, List<String> violations) {
    for (RoadmapWeek week : roadmap.weeks()) {
      if (week.days().isEmpty()) {
        violations.add("Week " + week.weekNumber() + " has no days");
      }
      for (RoadmapDay day : week.days()) {
        for (RoadmapTask task : day.tasks()) {
          if (!task.isValid()) {
            violations.add(
                String.format(
                    "Invalid task '%s' in week %d day %d",
                    task.title(), week.weekNumber(), day.dayNumber()));
          }
        }
      }
    }
  }
}
