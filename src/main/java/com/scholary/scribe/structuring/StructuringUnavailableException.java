package com.scholary.scribe.structuring;

/** Thrown when the structuring service is unreachable, over quota or returns an error. */
public class StructuringUnavailableException extends RuntimeException {

  private final int statusCode;

  public StructuringUnavailableException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public StructuringUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status returned by the service, or -1 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
