package com.flamingo.ai.docingest.cli;

/**
 * Process exit codes. An orchestrator treats {@link #SIZE_EXCEEDED} as the signal to retry the
 * document with {@code --split}.
 */
public enum WorkerExitCode {
  SUCCESS(0),
  FAILURE(1),
  SIZE_EXCEEDED(3),
  USAGE(64);

  private final int code;

  WorkerExitCode(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }
}
