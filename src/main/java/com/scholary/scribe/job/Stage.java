package com.scholary.scribe.job;

import java.util.Optional;

/**
 * The four pipeline stages, each tied to the status it starts from, the status shown while it
 * runs, the status it produces and the artifact it leaves behind.
 */
public enum Stage {
  DOWNLOAD(JobStatus.NEW, JobStatus.DOWNLOADING, JobStatus.DOWNLOADED, ArtifactKind.AUDIO),
  TRANSCRIBE(
      JobStatus.DOWNLOADED, JobStatus.TRANSCRIBING, JobStatus.TRANSCRIBED, ArtifactKind.TRANSCRIPT),
  STRUCTURE(
      JobStatus.TRANSCRIBED, JobStatus.STRUCTURING, JobStatus.STRUCTURED, ArtifactKind.SUMMARY),
  PUBLISH(JobStatus.STRUCTURED, JobStatus.PUBLISHING, JobStatus.COMPLETED, ArtifactKind.DOCUMENT);

  private final JobStatus entryStatus;
  private final JobStatus runningStatus;
  private final JobStatus completedStatus;
  private final ArtifactKind output;

  Stage(
      JobStatus entryStatus,
      JobStatus runningStatus,
      JobStatus completedStatus,
      ArtifactKind output) {
    this.entryStatus = entryStatus;
    this.runningStatus = runningStatus;
    this.completedStatus = completedStatus;
    this.output = output;
  }

  public JobStatus entryStatus() {
    return entryStatus;
  }

  public JobStatus runningStatus() {
    return runningStatus;
  }

  public JobStatus completedStatus() {
    return completedStatus;
  }

  /** The artifact a successful run of this stage must produce. */
  public ArtifactKind output() {
    return output;
  }

  /** The stage that runs next from a rest status, if any. */
  public static Optional<Stage> startingFrom(JobStatus status) {
    for (Stage stage : values()) {
      if (stage.entryStatus == status) {
        return Optional.of(stage);
      }
    }
    return Optional.empty();
  }

  /** The stage whose in-flight status this is, if any. */
  public static Optional<Stage> runningAt(JobStatus status) {
    for (Stage stage : values()) {
      if (stage.runningStatus == status) {
        return Optional.of(stage);
      }
    }
    return Optional.empty();
  }
}
