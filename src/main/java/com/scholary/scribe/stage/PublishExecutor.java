package com.scholary.scribe.stage;

import com.scholary.scribe.config.PipelineProperties;
import com.scholary.scribe.document.DocumentRenderer;
import com.scholary.scribe.document.MalformedOutlineException;
import com.scholary.scribe.document.Outline;
import com.scholary.scribe.document.OutlineParser;
import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import com.scholary.scribe.storage.RemoteStorage;
import com.scholary.scribe.storage.UploadResult;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the SUMMARY into a .docx DOCUMENT artifact and publishes the results.
 *
 * <p>The document and the transcript go to the documents folder, the audio (when still present) to
 * the recordings folder. Uploads are de-duplicated by the storage, so re-running this stage never
 * creates duplicate remote objects. A previously rendered document that still matches the summary
 * is published as is.
 */
public class PublishExecutor implements StageExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PublishExecutor.class);

  private final OutlineParser parser;
  private final DocumentRenderer renderer;
  private final RemoteStorage storage;
  private final LocalArtifactStore artifacts;
  private final PipelineProperties properties;
  private final Clock clock;

  public PublishExecutor(
      OutlineParser parser,
      DocumentRenderer renderer,
      RemoteStorage storage,
      LocalArtifactStore artifacts,
      PipelineProperties properties,
      Clock clock) {
    this.parser = parser;
    this.renderer = renderer;
    this.storage = storage;
    this.artifacts = artifacts;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public Stage stage() {
    return Stage.PUBLISH;
  }

  @Override
  public StageResult run(RecordingJob job) {
    Artifact summary = StageInputs.require(job, ArtifactKind.SUMMARY);
    Artifact transcript = StageInputs.require(job, ArtifactKind.TRANSCRIPT);
    Artifact document = reusableDocument(job, summary).orElseGet(() -> render(job, summary));

    String documentsFolder = storage.ensureFolder(properties.publish().documentsFolder());
    String recordingsFolder = storage.ensureFolder(properties.publish().recordingsFolder());

    Map<ArtifactKind, String> remoteObjects = new EnumMap<>(ArtifactKind.class);
    remoteObjects.put(ArtifactKind.DOCUMENT, upload(documentsFolder, document));
    remoteObjects.put(ArtifactKind.TRANSCRIPT, upload(documentsFolder, transcript));
    Optional<Artifact> audio = job.getArtifacts().get(ArtifactKind.AUDIO);
    if (audio.isPresent() && artifacts.isIntact(audio.get())) {
      remoteObjects.put(ArtifactKind.AUDIO, upload(recordingsFolder, audio.get()));
    } else {
      LOGGER.info("No local audio for {}, skipping recording upload", job.getId());
    }

    return new StageResult(Map.of(ArtifactKind.DOCUMENT, document), remoteObjects);
  }

  private Optional<Artifact> reusableDocument(RecordingJob job, Artifact summary) {
    return job.getArtifacts()
        .get(ArtifactKind.DOCUMENT)
        .filter(document -> summary.fingerprint().equals(document.sourceFingerprint()))
        .filter(artifacts::isIntact);
  }

  private Artifact render(RecordingJob job, Artifact summary) {
    Outline outline;
    try {
      outline = parser.parse(artifacts.readText(summary));
    } catch (MalformedOutlineException e) {
      throw new StageException(FailureKind.MALFORMED_OUTLINE, e.getMessage(), e);
    }

    String title =
        outline
            .firstHeadingText()
            .orElseGet(() -> Filenames.baseName(Path.of(summary.path()).getFileName().toString()));
    String filename =
        Filenames.documentFileName(
            title, LocalDateTime.now(clock), properties.limits().maxTitleLength());

    byte[] bytes = renderer.render(outline);
    Artifact document =
        artifacts.write(job.getId(), ArtifactKind.DOCUMENT, filename, bytes, summary.fingerprint());
    LOGGER.info("Rendered {}: file={}, size={} bytes", job.getId(), filename, bytes.length);
    return document;
  }

  private String upload(String folderId, Artifact artifact) {
    Path file = Path.of(artifact.path());
    UploadResult result =
        storage.upload(folderId, file.getFileName().toString(), file, artifact.fingerprint());
    return result.objectId();
  }
}
