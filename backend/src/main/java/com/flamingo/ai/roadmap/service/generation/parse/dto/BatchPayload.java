package com.flamingo.ai.roadmap.service.generation.parse.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire shape of one batch response. {@code weekly_breakdown} is accepted for responses produced
 * with the single-shot prompt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchPayload(
    @JsonProperty("roadmap_title") String roadmapTitle,
    @JsonProperty("description") String description,
    @JsonProperty("weeks") @JsonAlias("weekly_breakdown") List<WeekPayload> weeks,
    @JsonProperty("milestones") List<MilestonePayload> milestones) {

  public boolean hasWeeks() {
    return weeks != null && !weeks.isEmpty();
  }
}
