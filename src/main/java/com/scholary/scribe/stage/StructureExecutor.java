package com.scholary.scribe.stage;

import com.scholary.scribe.config.PipelineProperties;
import com.scholary.scribe.document.MalformedOutlineException;
import com.scholary.scribe.document.Outline;
import com.scholary.scribe.document.OutlineParser;
import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import com.scholary.scribe.structuring.StructuringService;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the transcript to the structuring service and keeps the reply as the SUMMARY artifact.
 *
 * <p>The reply is parsed before it is stored. Text that does not parse, or parses to nothing,
 * fails the stage with {@link FailureKind#MALFORMED_OUTLINE}.
 */
public class StructureExecutor implements StageExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(StructureExecutor.class);

  private final StructuringService structuringService;
  private final OutlineParser parser;
  private final LocalArtifactStore artifacts;
  private final PipelineProperties properties;

  public StructureExecutor(
      StructuringService structuringService,
      OutlineParser parser,
      LocalArtifactStore artifacts,
      PipelineProperties properties) {
    this.structuringService = structuringService;
    this.parser = parser;
    this.artifacts = artifacts;
    this.properties = properties;
  }

  @Override
  public Stage stage() {
    return Stage.STRUCTURE;
  }

  @Override
  public StageResult run(RecordingJob job) {
    Artifact transcript = StageInputs.require(job, ArtifactKind.TRANSCRIPT);
    String baseName = Filenames.baseName(Path.of(transcript.path()).getFileName().toString());

    String instructions = properties.promptTemplate() + "\n\nAudio file: " + baseName;
    String structured = structuringService.structure(artifacts.readText(transcript), instructions);

    Outline outline;
    try {
      outline = parser.parse(structured);
    } catch (MalformedOutlineException e) {
      throw new StageException(FailureKind.MALFORMED_OUTLINE, e.getMessage(), e);
    }
    if (outline.isEmpty()) {
      throw new StageException(FailureKind.MALFORMED_OUTLINE, "Structured text is empty");
    }

    Artifact summary =
        artifacts.writeText(
            job.getId(), ArtifactKind.SUMMARY, baseName + ".md", structured, transcript.fingerprint());

    LOGGER.info("Structured {}: {} blocks", job.getId(), outline.blocks().size());
    return StageResult.produced(ArtifactKind.SUMMARY, summary);
  }
}
