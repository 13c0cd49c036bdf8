package com.flamingo.ai.docingest.exception;

import java.nio.file.Path;

/** Exception thrown when queue or checkpoint state cannot be read or written. */
public class StateStoreException extends RuntimeException {

  private final Path file;
  private final String userMessage;

  public StateStoreException(Path file, String message, Throwable cause) {
    super(message, cause);
    this.file = file;
    this.userMessage = "Ingestion state file is unreadable: " + file;
  }

  public Path getFile() {
    return file;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
