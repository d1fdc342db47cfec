package com.flamingo.ai.roadmap.service.generation.parse.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourcePayload(
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("type") String type) {}
