package com.flamingo.ai.roadmap.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RoleContextTest {

  @Test
  void shouldApplyDefaults_whenFieldsMissing() {
    RoleContext context = RoleContext.builder().targetRole("Frontend Developer").build();

    assertThat(context.experienceLevel()).isEqualTo("beginner");
    assertThat(context.learningStyle()).isEqualTo("mixed");
    assertThat(context.dailyMinutes()).isEqualTo(RoleContext.DEFAULT_DAILY_MINUTES);
    assertThat(context.missingSkills()).isEmpty();
  }

  @Test
  void shouldClampReadiness() {
    assertThat(RoleContext.builder().readinessPercent(140).build().readinessPercent())
        .isEqualTo(100);
    assertThat(RoleContext.builder().readinessPercent(-5).build().readinessPercent()).isZero();
  }

  @Test
  void shouldTreatBlankOrNoneAsMissingRole() {
    assertThat(RoleContext.builder().build().hasTargetRole()).isFalse();
    assertThat(RoleContext.builder().targetRole("None").build().hasTargetRole()).isFalse();
    assertThat(RoleContext.builder().targetRole("DevOps").build().hasTargetRole()).isTrue();
  }

  @Test
  void shouldDeriveDailyMinutesFromIntensity_whenProfileSetsNone() {
    RoleContext.RoleContextBuilder builder = RoleContext.builder().targetRole("DevOps");

    assertThat(builder.intensity("high").build().dailyMinutes()).isEqualTo(120);
    assertThat(builder.intensity("LOW").build().dailyMinutes()).isEqualTo(30);
    assertThat(builder.intensity("extreme").build().dailyMinutes()).isEqualTo(60);
  }

  @Test
  void shouldKeepProfileDailyMinutes_overIntensity() {
    RoleContext context =
        RoleContext.builder().targetRole("DevOps").dailyMinutes(45).intensity("high").build();

    assertThat(context.dailyMinutes()).isEqualTo(45);
    assertThat(context.toBuilder().dailyMinutes(0).build().dailyMinutes()).isEqualTo(120);
  }
}
