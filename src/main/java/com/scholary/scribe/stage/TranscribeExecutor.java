package com.scholary.scribe.stage;

import com.scholary.scribe.config.PipelineProperties;
import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import com.scholary.scribe.transcription.TranscriptionEngine;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the AUDIO artifact into a TRANSCRIPT artifact.
 *
 * <p>Transcripts longer than the configured limit fail the stage; they are never truncated.
 */
public class TranscribeExecutor implements StageExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscribeExecutor.class);

  private final TranscriptionEngine engine;
  private final LocalArtifactStore artifacts;
  private final PipelineProperties properties;

  public TranscribeExecutor(
      TranscriptionEngine engine, LocalArtifactStore artifacts, PipelineProperties properties) {
    this.engine = engine;
    this.artifacts = artifacts;
    this.properties = properties;
  }

  @Override
  public Stage stage() {
    return Stage.TRANSCRIBE;
  }

  @Override
  public StageResult run(RecordingJob job) {
    Artifact audio = StageInputs.require(job, ArtifactKind.AUDIO);
    Path audioFile = Path.of(audio.path());

    String transcript = engine.transcribe(audioFile, properties.language());
    int limit = properties.limits().maxTranscriptChars();
    if (transcript.length() > limit) {
      throw new StageException(
          FailureKind.RESOURCE_LIMIT,
          String.format("Transcript has %d characters, limit is %d", transcript.length(), limit));
    }
    if (transcript.isBlank()) {
      LOGGER.warn("Empty transcript for {}", job.getId());
    }

    String filename = Filenames.baseName(audioFile.getFileName().toString()) + ".txt";
    Artifact artifact =
        artifacts.writeText(
            job.getId(), ArtifactKind.TRANSCRIPT, filename, transcript, audio.fingerprint());

    LOGGER.info("Transcribed {}: {} characters", job.getId(), transcript.length());
    return StageResult.produced(ArtifactKind.TRANSCRIPT, artifact);
  }
}
