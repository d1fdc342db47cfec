package com.flamingo.ai.roadmap.service.generation.parse;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import com.flamingo.ai.roadmap.domain.model.Milestone;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import java.util.List;

/**
 * Tagged result of one generation attempt. Callers branch with {@code instanceof}; every case is an
 * explicit value rather than an exception.
 */
public interface GenerationOutcome {

  /**
   * Provider output parsed into valid weeks.
   *
   * @param weeks validated weeks, ascending, all inside the requested batch
   * @param milestones milestones inside the batch range
   * @param title roadmap title if the model supplied one, else null
   * @param description roadmap description if the model supplied one, else null
   * @param warnings records dropped or adjusted during validation
   */
  record Success(
      List<RoadmapWeek> weeks,
      List<Milestone> milestones,
      String title,
      String description,
      List<String> warnings)
      implements GenerationOutcome {

    public Success {
      weeks = List.copyOf(weeks);
      milestones = milestones == null ? List.of() : List.copyOf(milestones);
      warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
  }

  /** Provider answered, but nothing usable could be extracted. */
  record ParseFailure(String rawText, String detail) implements GenerationOutcome {}

  /** Provider call failed after the retry policy gave up, or failed non-transiently. */
  record ProviderFailure(ProviderFailureKind kind, String detail) implements GenerationOutcome {}
}
