package com.scholary.scribe.source;

/** Thrown when the recording source is unreachable, rejects the token or returns an error. */
public class SourceUnavailableException extends RuntimeException {

  public SourceUnavailableException(String message) {
    super(message);
  }

  public SourceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
