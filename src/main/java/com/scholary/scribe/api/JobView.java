package com.scholary.scribe.api;

import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Dashboard view of a recording job.
 *
 * <p>Local file paths are not exposed; artifacts are reported by size and fingerprint.
 */
public record JobView(
    String id,
    String filename,
    JobStatus status,
    boolean busy,
    Stage failedStage,
    FailureKind failureKind,
    String lastError,
    Map<Stage, Integer> attempts,
    Map<ArtifactKind, ArtifactView> artifacts,
    Map<ArtifactKind, String> remoteObjects,
    Instant createdAt,
    Instant updatedAt) {

  public record ArtifactView(String name, long sizeBytes, String fingerprint, Instant createdAt) {}

  static JobView of(RecordingJob job, boolean busy) {
    Map<ArtifactKind, ArtifactView> artifacts = new EnumMap<>(ArtifactKind.class);
    for (Map.Entry<ArtifactKind, Artifact> entry : job.getArtifacts().asMap().entrySet()) {
      Artifact artifact = entry.getValue();
      String path = artifact.path();
      String name = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
      artifacts.put(
          entry.getKey(),
          new ArtifactView(name, artifact.sizeBytes(), artifact.fingerprint(), artifact.createdAt()));
    }
    return new JobView(
        job.getId(),
        job.getFilename(),
        job.getStatus(),
        busy,
        job.getFailedStage(),
        job.getFailureKind(),
        job.getLastError(),
        job.getAttempts(),
        artifacts,
        job.getRemoteObjects(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
