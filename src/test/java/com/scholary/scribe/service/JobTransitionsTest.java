package com.scholary.scribe.service;

import static com.scholary.scribe.job.ArtifactKind.AUDIO;
import static com.scholary.scribe.job.ArtifactKind.DOCUMENT;
import static com.scholary.scribe.job.ArtifactKind.SUMMARY;
import static com.scholary.scribe.job.ArtifactKind.TRANSCRIPT;
import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.job.Stage;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JobTransitionsTest {

  @Test
  void supportedBy_shouldFollowArtifactChain() {
    assertThat(JobTransitions.supportedBy(Set.of())).isEqualTo(JobStatus.NEW);
    assertThat(JobTransitions.supportedBy(Set.of(AUDIO))).isEqualTo(JobStatus.DOWNLOADED);
    assertThat(JobTransitions.supportedBy(Set.of(TRANSCRIPT))).isEqualTo(JobStatus.TRANSCRIBED);
    assertThat(JobTransitions.supportedBy(Set.of(AUDIO, TRANSCRIPT, SUMMARY)))
        .isEqualTo(JobStatus.STRUCTURED);
    assertThat(JobTransitions.supportedBy(Set.of(TRANSCRIPT, SUMMARY, DOCUMENT)))
        .isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void reentryPoint_shouldPreferTranscriptOverAudio() {
    assertThat(JobTransitions.reentryPoint(Set.of(AUDIO, TRANSCRIPT, SUMMARY, DOCUMENT)))
        .isEqualTo(JobStatus.TRANSCRIBED);
    assertThat(JobTransitions.reentryPoint(Set.of(AUDIO))).isEqualTo(JobStatus.DOWNLOADED);
    assertThat(JobTransitions.reentryPoint(Set.of())).isEqualTo(JobStatus.NEW);
  }

  @Test
  void lastCompleted_shouldRollBackInProgressStatuses() {
    assertThat(JobTransitions.lastCompleted(JobStatus.DOWNLOADING)).isEqualTo(JobStatus.NEW);
    assertThat(JobTransitions.lastCompleted(JobStatus.TRANSCRIBING))
        .isEqualTo(JobStatus.DOWNLOADED);
    assertThat(JobTransitions.lastCompleted(JobStatus.PUBLISHING)).isEqualTo(JobStatus.STRUCTURED);
    assertThat(JobTransitions.lastCompleted(JobStatus.TRANSCRIBED))
        .isEqualTo(JobStatus.TRANSCRIBED);
  }

  @Test
  void effectiveStatus_shouldResumeFailedJobAtFailedStage() {
    assertThat(
            JobTransitions.effectiveStatus(
                JobStatus.FAILED, Stage.STRUCTURE, Set.of(AUDIO, TRANSCRIPT)))
        .isEqualTo(JobStatus.TRANSCRIBED);
    assertThat(JobTransitions.effectiveStatus(JobStatus.FAILED, null, Set.of(AUDIO)))
        .isEqualTo(JobStatus.NEW);
  }

  @Test
  void effectiveStatus_shouldNeverClaimMoreThanArtifactsSupport() {
    assertThat(JobTransitions.effectiveStatus(JobStatus.STRUCTURED, null, Set.of(AUDIO)))
        .isEqualTo(JobStatus.DOWNLOADED);
    assertThat(JobTransitions.effectiveStatus(JobStatus.DOWNLOADED, null, Set.of(AUDIO, TRANSCRIPT)))
        .isEqualTo(JobStatus.DOWNLOADED);
  }
}
