package com.flamingo.ai.docingest.exception;

/** Exception thrown when an embedding or vector store call still fails after all retries. */
public class BackendUnavailableException extends RuntimeException {

  private final String operation;
  private final int attempts;
  private final String userMessage;

  public BackendUnavailableException(String operation, int attempts, Throwable cause) {
    super(
        String.format(
            "Backend operation '%s' failed after %d attempt(s): %s",
            operation, attempts, cause == null ? "unknown" : cause.getMessage()),
        cause);
    this.operation = operation;
    this.attempts = attempts;
    this.userMessage = "Embedding or vector store service is unavailable";
  }

  public String getOperation() {
    return operation;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
