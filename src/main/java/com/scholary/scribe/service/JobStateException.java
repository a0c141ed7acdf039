package com.scholary.scribe.service;

import com.scholary.scribe.job.JobStatus;

/** Thrown when the job's state does not allow the requested operation. */
public class JobStateException extends RuntimeException {

  private final String recordingId;
  private final JobStatus status;

  public JobStateException(String recordingId, JobStatus status, String message) {
    super(message);
    this.recordingId = recordingId;
    this.status = status;
  }

  public String getRecordingId() {
    return recordingId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
