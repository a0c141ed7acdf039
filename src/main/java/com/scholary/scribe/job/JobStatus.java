package com.scholary.scribe.job;

/**
 * Pipeline status of a recording.
 *
 * <p>Statuses ending in -ING mark a stage in flight; the others are rest states. {@link #FAILED}
 * records which stage failed on the job itself (see {@link RecordingJob#getFailedStage()}).
 */
public enum JobStatus {
  NEW,
  DOWNLOADING,
  DOWNLOADED,
  TRANSCRIBING,
  TRANSCRIBED,
  STRUCTURING,
  STRUCTURED,
  PUBLISHING,
  COMPLETED,
  FAILED;

  public boolean isInProgress() {
    return this == DOWNLOADING || this == TRANSCRIBING || this == STRUCTURING || this == PUBLISHING;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
