package com.flamingo.ai.roadmap.service.generation.parse.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DayPayload(
    @JsonProperty("day_number") @JsonAlias("day") Integer dayNumber,
    @JsonProperty("tasks") List<TaskPayload> tasks) {}
