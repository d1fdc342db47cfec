package com.flamingo.ai.roadmap.service.roadmap;

import com.flamingo.ai.roadmap.domain.enums.RoadmapStatus;
import com.flamingo.ai.roadmap.domain.model.BatchReport;
import com.flamingo.ai.roadmap.domain.model.Milestone;
import com.flamingo.ai.roadmap.domain.model.Roadmap;
import com.flamingo.ai.roadmap.domain.model.RoadmapMetadata;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.service.generation.BatchResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable roadmap under assembly. Weeks are only ever appended, so the completion fraction never
 * decreases. Confined to the assembling thread.
 */
class RoadmapDraft {

  private final int totalWeeks;
  private final List<RoadmapWeek> weeks = new ArrayList<>();
  private final List<Milestone> milestones = new ArrayList<>();
  private final List<BatchReport> reports = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  private String title;
  private String description;
  private int generatedWeeks;
  private int providerAttempts;

  RoadmapDraft(int totalWeeks) {
    this.totalWeeks = totalWeeks;
  }

  void append(BatchResult result) {
    weeks.addAll(result.weeks());
    milestones.addAll(result.milestones());
    reports.add(result.toReport());
    warnings.addAll(result.warnings());
    generatedWeeks += result.generatedWeekCount();
    providerAttempts += result.providerAttempts();
    if (title == null) {
      title = result.title();
    }
    if (description == null) {
      description = result.description();
    }
  }

  int weekCount() {
    return weeks.size();
  }

  RoadmapStatus status() {
    return RoadmapStatus.ASSEMBLING;
  }

  double completionFraction() {
    return (double) generatedWeeks / totalWeeks;
  }

  int degradedBatchCount() {
    return (int) reports.stream().filter(BatchReport::degraded).count();
  }

  Roadmap finish(String targetRole, String defaultTitle, String defaultDescription) {
    int degradedBatches = degradedBatchCount();
    RoadmapMetadata metadata =
        new RoadmapMetadata(
            reports.size(),
            degradedBatches,
            generatedWeeks,
            weeks.size() - generatedWeeks,
            weeks.stream().mapToInt(RoadmapWeek::taskCount).sum(),
            weeks.stream().mapToInt(RoadmapWeek::totalMinutes).sum(),
            providerAttempts,
            warnings);
    return new Roadmap(
        title != null ? title : defaultTitle,
        description != null ? description : defaultDescription,
        targetRole,
        totalWeeks,
        weeks,
        milestones,
        degradedBatches == 0 ? RoadmapStatus.COMPLETE : RoadmapStatus.PARTIALLY_DEGRADED,
        completionFraction(),
        reports,
        metadata);
  }
}
