package com.flamingo.ai.roadmap.service.generation;

import com.flamingo.ai.roadmap.domain.enums.BatchState;
import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import com.flamingo.ai.roadmap.domain.model.BatchReport;
import com.flamingo.ai.roadmap.domain.model.Milestone;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import java.util.List;

/**
 * Weeks produced for one batch, one per position of the batch range in ascending order, together
 * with how they were obtained.
 *
 * @param batch week range
 * @param weeks exactly {@code batch.requestedWeekCount()} weeks
 * @param milestones milestones placed inside the range
 * @param finalState RESOLVED when every week came from the provider, DEGRADED otherwise
 * @param failureKind provider failure that forced the fallback, null for parse failures and gaps
 * @param providerAttempts calls sent to the provider, retries and repair prompts included
 * @param warnings parser and orchestration warnings
 * @param title roadmap title supplied by the provider, null if none
 * @param description roadmap description supplied by the provider, null if none
 */
public record BatchResult(
    WeekBatch batch,
    List<RoadmapWeek> weeks,
    List<Milestone> milestones,
    BatchState finalState,
    ProviderFailureKind failureKind,
    int providerAttempts,
    List<String> warnings,
    String title,
    String description) {

  public BatchResult {
    weeks = List.copyOf(weeks);
    milestones = milestones == null ? List.of() : List.copyOf(milestones);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public boolean degraded() {
    return finalState == BatchState.DEGRADED;
  }

  public int generatedWeekCount() {
    return (int) weeks.stream().filter(RoadmapWeek::isGenerated).count();
  }

  /** True when the provider refused the batch with an authentication or quota error. */
  public boolean failedNonTransiently() {
    return failureKind != null && !failureKind.isRetryable();
  }

  public BatchReport toReport() {
    return new BatchReport(batch, finalState, generatedWeekCount(), failureKind, providerAttempts);
  }
}
