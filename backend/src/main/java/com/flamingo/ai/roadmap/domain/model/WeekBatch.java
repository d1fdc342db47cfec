package com.flamingo.ai.roadmap.domain.model;

/**
 * Contiguous, inclusive range of weeks generated by one provider call.
 *
 * @param startWeek first week of the range, 1-based
 * @param endWeek last week of the range, inclusive
 */
public record WeekBatch(int startWeek, int endWeek) {

  public WeekBatch {
    if (startWeek < 1 || endWeek < startWeek) {
      throw new IllegalArgumentException(
          "Invalid batch range [" + startWeek + ", " + endWeek + "]");
    }
  }

  public int requestedWeekCount() {
    return endWeek - startWeek + 1;
  }

  public boolean contains(int weekNumber) {
    return weekNumber >= startWeek && weekNumber <= endWeek;
  }

  public boolean isFirst() {
    return startWeek == 1;
  }

  @Override
  public String toString() {
    return "weeks " + startWeek + "-" + endWeek;
  }
}
