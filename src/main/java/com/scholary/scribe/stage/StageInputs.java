package com.scholary.scribe.stage;

import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.RecordingJob;

final class StageInputs {

  private StageInputs() {}

  static Artifact require(RecordingJob job, ArtifactKind kind) {
    return job.getArtifacts()
        .get(kind)
        .orElseThrow(
            () ->
                new StageException(
                    FailureKind.INTERNAL, "No " + kind + " artifact for " + job.getId()));
  }
}
