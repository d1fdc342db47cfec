package com.flamingo.ai.roadmap.service.generation.batch;

import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import com.flamingo.ai.roadmap.exception.PlanningException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits the requested roadmap length into consecutive week ranges small enough for one provider
 * call each.
 *
 * <p>The returned batches are ascending, non-overlapping and together cover exactly {@code
 * 1..totalWeeks}. Only the last batch may be shorter than {@code maxWeeksPerBatch}.
 */
@Component
@Slf4j
public class BatchPlanner {

  /**
   * Plans the batches for a roadmap.
   *
   * @param totalWeeks requested roadmap length, must be positive
   * @param maxWeeksPerBatch upper bound of weeks per provider call, must be positive
   * @return ordered batches
   * @throws PlanningException if either argument is not positive
   */
  public List<WeekBatch> plan(int totalWeeks, int maxWeeksPerBatch) {
    if (totalWeeks <= 0) {
      throw new PlanningException(
          "totalWeeks must be positive, got " + totalWeeks,
          "Roadmap duration must be at least one week.");
    }
    if (maxWeeksPerBatch <= 0) {
      throw new PlanningException(
          "maxWeeksPerBatch must be positive, got " + maxWeeksPerBatch,
          "Invalid batch size configuration.");
    }

    List<WeekBatch> batches = new ArrayList<>();
    for (long start = 1; start <= totalWeeks; start += maxWeeksPerBatch) {
      long end = Math.min(start + maxWeeksPerBatch - 1, totalWeeks);
      batches.add(new WeekBatch((int) start, (int) end));
    }

    log.debug(
        "Planned {} batches for {} weeks (max {} per batch)",
        batches.size(),
        totalWeeks,
        maxWeeksPerBatch);
    return List.copyOf(batches);
  }
}
