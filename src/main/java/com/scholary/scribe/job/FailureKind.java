package com.scholary.scribe.job;

/**
 * Why a stage run failed.
 *
 * <p>Retryable kinds may be retried by "process" requests up to the per-stage attempt cap; the
 * others need an explicit reprocess.
 */
public enum FailureKind {
  /** Network errors and I/O failures. */
  TRANSIENT_IO(true),
  /** A size or length cap was exceeded. */
  RESOURCE_LIMIT(false),
  /** The structuring service returned text that does not parse into an outline. */
  MALFORMED_OUTLINE(false),
  /** The recording source is unreachable or refused the request. */
  SOURCE_UNAVAILABLE(true),
  /** The structuring service is unreachable, over quota or failing. */
  STRUCTURING_UNAVAILABLE(true),
  /** The stage exceeded its time budget. */
  TIMED_OUT(true),
  /** Anything unexpected. */
  INTERNAL(false);

  private final boolean retryable;

  FailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
