package com.flamingo.ai.roadmap.service.generation.parse.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WeekPayload(
    @JsonProperty("week_number") @JsonAlias("week") Integer weekNumber,
    @JsonProperty("focus_area") @JsonAlias({"focus", "topic"}) String focusArea,
    @JsonProperty("learning_objectives") List<String> learningObjectives,
    @JsonProperty("days") List<DayPayload> days) {

  /** A fragment only counts as a week when it carries a number and at least one day. */
  public boolean looksLikeWeek() {
    return weekNumber != null && days != null && !days.isEmpty();
  }
}
