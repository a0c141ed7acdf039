package com.scholary.scribe.job;

/** Thrown when job state or history cannot be read from or written to disk. */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
