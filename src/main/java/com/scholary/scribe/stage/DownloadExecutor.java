package com.scholary.scribe.stage;

import com.scholary.scribe.config.PipelineProperties;
import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import com.scholary.scribe.source.RecordingSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fetches the recording's audio from the source into the AUDIO artifact. */
public class DownloadExecutor implements StageExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadExecutor.class);

  private final RecordingSource source;
  private final LocalArtifactStore artifacts;
  private final PipelineProperties properties;

  public DownloadExecutor(
      RecordingSource source, LocalArtifactStore artifacts, PipelineProperties properties) {
    this.source = source;
    this.artifacts = artifacts;
    this.properties = properties;
  }

  @Override
  public Stage stage() {
    return Stage.DOWNLOAD;
  }

  @Override
  public StageResult run(RecordingJob job) {
    String filename = Filenames.audioFileName(job.getFilename());
    long maxBytes = properties.limits().maxAudioBytes();

    Artifact audio;
    try (InputStream content = source.openDownload(job.getId())) {
      audio = artifacts.write(job.getId(), ArtifactKind.AUDIO, filename, content, maxBytes, null);
    } catch (IOException e) {
      throw new UncheckedIOException("Download of " + job.getId() + " failed", e);
    }

    LOGGER.info(
        "Downloaded {}: file={}, size={} bytes", job.getId(), filename, audio.sizeBytes());
    return StageResult.produced(ArtifactKind.AUDIO, audio);
  }
}
