package com.flamingo.ai.roadmap.domain.enums;

/** Where the content of a roadmap week came from. */
public enum WeekOrigin {
  GENERATED,
  FALLBACK
}
