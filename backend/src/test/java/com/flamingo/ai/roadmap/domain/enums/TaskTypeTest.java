package com.flamingo.ai.roadmap.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class TaskTypeTest {

  @ParameterizedTest
  @CsvSource({
    "reading, READING",
    "Video, READING",
    "coding, PRACTICE",
    "exercise, PRACTICE",
    "project, PROJECT",
    "quiz, REVIEW",
    "' review ', REVIEW"
  })
  void shouldResolveLabelsAndAliases(String label, TaskType expected) {
    assertThat(TaskType.fromLabel(label)).contains(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"podcast", "   "})
  void shouldReturnEmpty_whenLabelUnknown(String label) {
    assertThat(TaskType.fromLabel(label)).isEmpty();
  }

  @ParameterizedTest
  @EnumSource(TaskType.class)
  void shouldRoundTripThroughLabel(TaskType type) {
    assertThat(type.label()).isLowerCase();
    assertThat(TaskType.fromLabel(type.label())).contains(type);
  }
}
