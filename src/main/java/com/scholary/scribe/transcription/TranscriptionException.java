package com.scholary.scribe.transcription;

/**
 * Exception thrown when transcription fails.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
