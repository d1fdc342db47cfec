package com.flamingo.ai.roadmap.exception;

/** Exception thrown when a running assembly is cancelled by its caller. */
public class GenerationCancelledException extends RuntimeException {

  public GenerationCancelledException(String message) {
    super(message);
  }

  public GenerationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
