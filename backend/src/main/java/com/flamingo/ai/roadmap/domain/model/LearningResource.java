package com.flamingo.ai.roadmap.domain.model;

/** External reference attached to a task (documentation page, tutorial, video). */
public record LearningResource(String title, String url, String type) {}
