package com.flamingo.ai.roadmap.service.generation.parse.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MilestonePayload(
    @JsonProperty("week_number") Integer weekNumber,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("skills_demonstrated") List<String> skillsDemonstrated,
    @JsonProperty("deliverable") String deliverable) {}
