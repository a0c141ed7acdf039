package com.scholary.scribe.stage;

import com.scholary.scribe.config.PipelineProperties;
import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.ArtifactSet;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.FileJobStore;
import com.scholary.scribe.job.Fingerprints;
import com.scholary.scribe.job.RecordingJob;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Local artifact files, laid out as {@code <work-dir>/recordings/<encoded-id>/<kind>/<file>}.
 *
 * <p>Each kind directory holds at most one file. Files are written to a temp name and moved into
 * place, so a crash never leaves a half-written artifact under its final name.
 */
@Component
public class LocalArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);
  private static final int BUFFER_SIZE = 64 * 1024;
  private static final String TEMP_PREFIX = ".incoming-";

  private final Path recordingsDir;
  private final Clock clock;

  @Autowired
  public LocalArtifactStore(PipelineProperties properties, Clock clock) {
    this(properties.workPath().resolve("recordings"), clock);
  }

  LocalArtifactStore(Path recordingsDir, Clock clock) {
    this.recordingsDir = recordingsDir;
    this.clock = clock;
  }

  public Path directoryFor(String recordingId, ArtifactKind kind) {
    return recordingsDir.resolve(FileJobStore.encode(recordingId)).resolve(kind.directoryName());
  }

  /** Write an in-memory artifact. */
  public Artifact write(
      String recordingId,
      ArtifactKind kind,
      String filename,
      byte[] content,
      String sourceFingerprint) {
    Path dir = directoryFor(recordingId, kind);
    try {
      Files.createDirectories(dir);
      Path temp = dir.resolve(TEMP_PREFIX + filename);
      Files.write(temp, content);
      return install(temp, dir.resolve(filename), sourceFingerprint);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write " + kind + " artifact for " + recordingId, e);
    }
  }

  /** Write a UTF-8 text artifact. */
  public Artifact writeText(
      String recordingId,
      ArtifactKind kind,
      String filename,
      String content,
      String sourceFingerprint) {
    return write(
        recordingId, kind, filename, content.getBytes(StandardCharsets.UTF_8), sourceFingerprint);
  }

  /**
   * Stream an artifact to disk, refusing content larger than {@code maxBytes}.
   *
   * @throws StageException with {@link FailureKind#RESOURCE_LIMIT} if the content is too large
   */
  public Artifact write(
      String recordingId,
      ArtifactKind kind,
      String filename,
      InputStream content,
      long maxBytes,
      String sourceFingerprint) {
    Path dir = directoryFor(recordingId, kind);
    Path temp = dir.resolve(TEMP_PREFIX + filename);
    try {
      Files.createDirectories(dir);
      long total = 0;
      try (OutputStream out = Files.newOutputStream(temp)) {
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = content.read(buffer)) != -1) {
          total += read;
          if (total > maxBytes) {
            break;
          }
          out.write(buffer, 0, read);
        }
      }
      if (total > maxBytes) {
        Files.deleteIfExists(temp);
        throw new StageException(
            FailureKind.RESOURCE_LIMIT,
            String.format("%s exceeds the %d byte limit", kind, maxBytes));
      }
      return install(temp, dir.resolve(filename), sourceFingerprint);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write " + kind + " artifact for " + recordingId, e);
    }
  }

  public String readText(Artifact artifact) {
    try {
      return Files.readString(Path.of(artifact.path()), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read artifact " + artifact.path(), e);
    }
  }

  /** Remove the files of one artifact kind. Missing files are not an error. */
  public void delete(String recordingId, ArtifactKind kind) {
    Path dir = directoryFor(recordingId, kind);
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      List<Path> ordered = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
      for (Path path : ordered) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot delete " + kind + " artifacts of " + recordingId, e);
    }
    LOGGER.info("Deleted {} artifacts of {}", kind, recordingId);
  }

  public boolean isIntact(Artifact artifact) {
    return artifact != null && Fingerprints.matches(Path.of(artifact.path()), artifact.fingerprint());
  }

  /**
   * Kinds whose artifacts can be used as they are.
   *
   * <p>An artifact is valid when its file still hashes to the recorded fingerprint and it was
   * derived from the artifact currently recorded before it: a transcript must match the audio it
   * claims to come from (when audio is recorded at all), a summary the transcript, a document the
   * summary.
   */
  public Set<ArtifactKind> validKinds(RecordingJob job) {
    ArtifactSet artifacts = job.getArtifacts();
    Set<ArtifactKind> valid = EnumSet.noneOf(ArtifactKind.class);

    Optional<Artifact> audio = artifacts.get(ArtifactKind.AUDIO);
    if (audio.isPresent() && isIntact(audio.get())) {
      valid.add(ArtifactKind.AUDIO);
    }

    Optional<Artifact> transcript = artifacts.get(ArtifactKind.TRANSCRIPT);
    if (transcript.isPresent()
        && isIntact(transcript.get())
        && (audio.isEmpty()
            || audio.get().fingerprint().equals(transcript.get().sourceFingerprint()))) {
      valid.add(ArtifactKind.TRANSCRIPT);
    } else {
      return valid;
    }

    Optional<Artifact> summary = artifacts.get(ArtifactKind.SUMMARY);
    if (summary.isPresent()
        && isIntact(summary.get())
        && transcript.get().fingerprint().equals(summary.get().sourceFingerprint())) {
      valid.add(ArtifactKind.SUMMARY);
    } else {
      return valid;
    }

    Optional<Artifact> document = artifacts.get(ArtifactKind.DOCUMENT);
    if (document.isPresent()
        && isIntact(document.get())
        && summary.get().fingerprint().equals(document.get().sourceFingerprint())) {
      valid.add(ArtifactKind.DOCUMENT);
    }
    return valid;
  }

  private Artifact install(Path temp, Path target, String sourceFingerprint) throws IOException {
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    removeSiblings(target);
    return new Artifact(
        target.toAbsolutePath().toString(),
        Files.size(target),
        Fingerprints.of(target),
        sourceFingerprint,
        clock.instant());
  }

  private void removeSiblings(Path target) throws IOException {
    try (Stream<Path> files = Files.list(target.getParent())) {
      for (Path file : files.filter(f -> !f.equals(target)).collect(Collectors.toList())) {
        if (!file.getFileName().toString().startsWith(TEMP_PREFIX)) {
          Files.deleteIfExists(file);
        }
      }
    }
  }
}
