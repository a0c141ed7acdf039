package com.scholary.scribe.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.scribe.PipelineFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileJobStoreTest {

  private static final Instant T0 = Instant.parse("2025-01-10T09:00:00Z");

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = PipelineFixtures.objectMapper();
  private FileJobStore store;

  @BeforeEach
  void setUp() {
    store = new FileJobStore(objectMapper, tempDir.resolve("jobs"), 10);
  }

  @Test
  void save_shouldSurviveRestart() {
    RecordingJob job = new RecordingJob("rec-1", "Standup.mp3", T0);
    job.recordAttempt(Stage.DOWNLOAD);
    job.setStatus(JobStatus.DOWNLOADED);
    job.setArtifacts(
        ArtifactSet.empty()
            .with(ArtifactKind.AUDIO, new Artifact("/tmp/a.mp3", 3, "abc", null, T0)));
    job.getRemoteObjects().put(ArtifactKind.AUDIO, "recordings/a.mp3");
    store.save(job);

    FileJobStore reopened = new FileJobStore(objectMapper, tempDir.resolve("jobs"), 10);
    RecordingJob loaded = reopened.findById("rec-1").orElseThrow();

    assertThat(loaded.getStatus()).isEqualTo(JobStatus.DOWNLOADED);
    assertThat(loaded.attemptsFor(Stage.DOWNLOAD)).isEqualTo(1);
    assertThat(loaded.getArtifacts()).isEqualTo(job.getArtifacts());
    assertThat(loaded.getRemoteObjects()).containsEntry(ArtifactKind.AUDIO, "recordings/a.mp3");
    assertThat(loaded.getCreatedAt()).isEqualTo(T0);
  }

  @Test
  void findById_shouldReturnIndependentSnapshots() {
    store.save(new RecordingJob("rec-1", "a.mp3", T0));

    RecordingJob first = store.findById("rec-1").orElseThrow();
    first.setStatus(JobStatus.FAILED);

    assertThat(store.findById("rec-1").orElseThrow().getStatus()).isEqualTo(JobStatus.NEW);
  }

  @Test
  void findById_shouldReturnEmptyForUnknownId() {
    assertThat(store.findById("missing")).isEmpty();
  }

  @Test
  void saveIfAbsent_shouldKeepExistingRecord() {
    RecordingJob original = new RecordingJob("rec-1", "first.mp3", T0);
    original.setStatus(JobStatus.TRANSCRIBED);
    store.save(original);

    RecordingJob result = store.saveIfAbsent(new RecordingJob("rec-1", "second.mp3", T0));

    assertThat(result.getFilename()).isEqualTo("first.mp3");
    assertThat(result.getStatus()).isEqualTo(JobStatus.TRANSCRIBED);
  }

  @Test
  void findAll_shouldOrderByCreationTime() {
    store.save(new RecordingJob("late", "b.mp3", T0.plusSeconds(60)));
    store.save(new RecordingJob("early", "a.mp3", T0));

    assertThat(store.findAll()).extracting(RecordingJob::getId).containsExactly("early", "late");
  }

  @Test
  void save_shouldEncodeIdsIntoSafeFileNames() throws Exception {
    store.save(new RecordingJob("../../etc/passwd", "x.mp3", T0));

    try (var files = Files.list(tempDir.resolve("jobs"))) {
      assertThat(files.map(f -> f.getFileName().toString()))
          .singleElement()
          .satisfies(name -> assertThat(name).doesNotContain("/").endsWith(".json"));
    }
    assertThat(store.findById("../../etc/passwd")).isPresent();
    assertThat(store.fileFor("../../etc/passwd").getParent()).isEqualTo(tempDir.resolve("jobs"));
  }

  @Test
  void save_shouldLeaveNoTempFiles() throws Exception {
    RecordingJob job = new RecordingJob("rec-1", "a.mp3", T0);
    store.save(job);
    job.setStatus(JobStatus.DOWNLOADING);
    store.save(job);

    try (var files = Files.list(tempDir.resolve("jobs"))) {
      assertThat(files).allMatch(f -> f.toString().endsWith(".json"));
    }
  }
}
