package com.scholary.scribe.storage;

/**
 * Exception thrown when remote storage operations fail.
 *
 * <p>Unchecked: the pipeline records the failure on the job and a later attempt may succeed.
 */
public class RemoteStorageException extends RuntimeException {

  public RemoteStorageException(String message) {
    super(message);
  }

  public RemoteStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
