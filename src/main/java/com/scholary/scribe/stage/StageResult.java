package com.scholary.scribe.stage;

import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import java.util.Map;

/**
 * What a successful stage run adds to a job.
 *
 * @param artifacts local artifacts written by the stage
 * @param remoteObjects ids of objects published to remote storage, keyed by the artifact they hold
 */
public record StageResult(
    Map<ArtifactKind, Artifact> artifacts, Map<ArtifactKind, String> remoteObjects) {

  public StageResult {
    artifacts = Map.copyOf(artifacts);
    remoteObjects = Map.copyOf(remoteObjects);
  }

  public static StageResult produced(ArtifactKind kind, Artifact artifact) {
    return new StageResult(Map.of(kind, artifact), Map.of());
  }
}
