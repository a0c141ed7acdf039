package com.scholary.scribe.stage;

import com.scholary.scribe.job.FailureKind;

/** A stage run failed; the kind decides whether the failure may be retried. */
public class StageException extends RuntimeException {

  private final FailureKind kind;

  public StageException(FailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public StageException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public FailureKind getKind() {
    return kind;
  }
}
