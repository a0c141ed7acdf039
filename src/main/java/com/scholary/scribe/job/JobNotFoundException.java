package com.scholary.scribe.job;

/** Thrown when an operation names a recording id the store has never seen. */
public class JobNotFoundException extends RuntimeException {

  private final String recordingId;

  public JobNotFoundException(String recordingId) {
    super("Unknown recording: " + recordingId);
    this.recordingId = recordingId;
  }

  public String getRecordingId() {
    return recordingId;
  }
}
