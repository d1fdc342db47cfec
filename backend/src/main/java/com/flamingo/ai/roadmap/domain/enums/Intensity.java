package com.flamingo.ai.roadmap.domain.enums;

import java.util.Locale;

/** Learning intensity chosen by the user, mapped to a daily time budget. */
public enum Intensity {
  LOW(30),
  MEDIUM(60),
  HIGH(120);

  private final int dailyMinutes;

  Intensity(int dailyMinutes) {
    this.dailyMinutes = dailyMinutes;
  }

  public int dailyMinutes() {
    return dailyMinutes;
  }

  /** Unknown or missing values resolve to {@link #MEDIUM}. */
  public static Intensity fromString(String value) {
    if (value == null) {
      return MEDIUM;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return MEDIUM;
    }
  }
}
