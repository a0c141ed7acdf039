package com.scholary.scribe.service;

import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.job.Stage;
import java.util.Set;

/**
 * Pure state-machine rules: which status a set of valid artifacts supports and where a job
 * resumes after a crash, a reprocess request or an artifact deletion.
 */
final class JobTransitions {

  private JobTransitions() {}

  /** The furthest rest status the valid artifacts can back up. */
  static JobStatus supportedBy(Set<ArtifactKind> valid) {
    if (valid.contains(ArtifactKind.TRANSCRIPT)) {
      if (valid.contains(ArtifactKind.SUMMARY)) {
        return valid.contains(ArtifactKind.DOCUMENT) ? JobStatus.COMPLETED : JobStatus.STRUCTURED;
      }
      return JobStatus.TRANSCRIBED;
    }
    return valid.contains(ArtifactKind.AUDIO) ? JobStatus.DOWNLOADED : JobStatus.NEW;
  }

  /** Where a reprocess starts: after the transcript if it is usable, else after the audio. */
  static JobStatus reentryPoint(Set<ArtifactKind> valid) {
    if (valid.contains(ArtifactKind.TRANSCRIPT)) {
      return JobStatus.TRANSCRIBED;
    }
    return valid.contains(ArtifactKind.AUDIO) ? JobStatus.DOWNLOADED : JobStatus.NEW;
  }

  /** Last completed status for an in-progress one; rest statuses map to themselves. */
  static JobStatus lastCompleted(JobStatus status) {
    return Stage.runningAt(status).map(Stage::entryStatus).orElse(status);
  }

  /**
   * The rest status a job effectively sits in: its recorded status, or its failed stage's entry
   * status, pulled back to what the artifacts support.
   */
  static JobStatus effectiveStatus(JobStatus recorded, Stage failedStage, Set<ArtifactKind> valid) {
    JobStatus base =
        recorded == JobStatus.FAILED
            ? (failedStage == null ? JobStatus.NEW : failedStage.entryStatus())
            : lastCompleted(recorded);
    return weaker(base, supportedBy(valid));
  }

  static JobStatus weaker(JobStatus a, JobStatus b) {
    return a.ordinal() <= b.ordinal() ? a : b;
  }
}
