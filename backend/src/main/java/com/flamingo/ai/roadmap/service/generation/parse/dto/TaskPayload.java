package com.flamingo.ai.roadmap.service.generation.parse.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Wire shape of one task. Duration and difficulty stay raw JSON so a value such as {@code "45 min"}
 * invalidates only its own task instead of the whole payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskPayload(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("task_type") @JsonAlias({"type", "kind"}) String taskType,
    @JsonProperty("estimated_duration") @JsonAlias("estimated_minutes") JsonNode estimatedDuration,
    @JsonProperty("difficulty") JsonNode difficulty,
    @JsonProperty("learning_objectives") List<String> learningObjectives,
    @JsonProperty("success_criteria") String successCriteria,
    @JsonProperty("prerequisites") List<String> prerequisites,
    @JsonProperty("resources") List<ResourcePayload> resources) {}
