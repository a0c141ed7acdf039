package com.scholary.scribe.stage;

import com.scholary.scribe.document.MalformedOutlineException;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.source.SourceUnavailableException;
import com.scholary.scribe.storage.RemoteStorageException;
import com.scholary.scribe.structuring.StructuringUnavailableException;
import com.scholary.scribe.transcription.TranscriptionException;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Maps exceptions escaping a stage run onto the failure taxonomy. */
public final class StageFailures {

  private StageFailures() {}

  public static FailureKind classify(Throwable error) {
    if (error instanceof StageException stageException) {
      return stageException.getKind();
    } else if (error instanceof SourceUnavailableException) {
      return FailureKind.SOURCE_UNAVAILABLE;
    } else if (error instanceof StructuringUnavailableException) {
      return FailureKind.STRUCTURING_UNAVAILABLE;
    } else if (error instanceof MalformedOutlineException) {
      return FailureKind.MALFORMED_OUTLINE;
    } else if (error instanceof TranscriptionException
        || error instanceof RemoteStorageException
        || error instanceof UncheckedIOException
        || error instanceof IOException) {
      return FailureKind.TRANSIENT_IO;
    }
    return FailureKind.INTERNAL;
  }

  /** A one-line description suitable for {@code lastError}. */
  public static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
