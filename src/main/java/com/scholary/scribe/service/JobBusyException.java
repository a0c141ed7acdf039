package com.scholary.scribe.service;

/** Thrown when another operation on the same recording is already running. */
public class JobBusyException extends RuntimeException {

  private final String recordingId;

  public JobBusyException(String recordingId) {
    super("Recording is busy: " + recordingId);
    this.recordingId = recordingId;
  }

  public JobBusyException(String recordingId, String message) {
    super(message);
    this.recordingId = recordingId;
  }

  public String getRecordingId() {
    return recordingId;
  }
}
