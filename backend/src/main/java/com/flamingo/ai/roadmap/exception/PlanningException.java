package com.flamingo.ai.roadmap.exception;

/** Exception thrown when roadmap size parameters or the role context are invalid. */
public class PlanningException extends RuntimeException {

  private final String userMessage;

  public PlanningException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
