package com.scholary.scribe.stage;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.scribe.document.MalformedOutlineException;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.source.SourceUnavailableException;
import com.scholary.scribe.storage.RemoteStorageException;
import com.scholary.scribe.structuring.StructuringUnavailableException;
import com.scholary.scribe.transcription.TranscriptionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class StageFailuresTest {

  @Test
  void classify_shouldMapKnownExceptions() {
    assertThat(StageFailures.classify(new StageException(FailureKind.TIMED_OUT, "slow")))
        .isEqualTo(FailureKind.TIMED_OUT);
    assertThat(StageFailures.classify(new SourceUnavailableException("down")))
        .isEqualTo(FailureKind.SOURCE_UNAVAILABLE);
    assertThat(StageFailures.classify(new StructuringUnavailableException("busy", 529)))
        .isEqualTo(FailureKind.STRUCTURING_UNAVAILABLE);
    assertThat(StageFailures.classify(new MalformedOutlineException("ragged", 3)))
        .isEqualTo(FailureKind.MALFORMED_OUTLINE);
    assertThat(StageFailures.classify(new TranscriptionException("reset")))
        .isEqualTo(FailureKind.TRANSIENT_IO);
    assertThat(StageFailures.classify(new RemoteStorageException("denied")))
        .isEqualTo(FailureKind.TRANSIENT_IO);
    assertThat(StageFailures.classify(new UncheckedIOException(new IOException("disk"))))
        .isEqualTo(FailureKind.TRANSIENT_IO);
  }

  @Test
  void classify_shouldTreatUnknownErrorsAsInternal() {
    assertThat(StageFailures.classify(new IllegalStateException("bug")))
        .isEqualTo(FailureKind.INTERNAL);
  }

  @Test
  void describe_shouldFallBackToExceptionName() {
    assertThat(StageFailures.describe(new NullPointerException())).isEqualTo("NullPointerException");
    assertThat(StageFailures.describe(new IllegalStateException("bug"))).isEqualTo("bug");
  }
}
