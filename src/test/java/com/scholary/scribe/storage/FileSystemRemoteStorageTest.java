package com.scholary.scribe.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.scribe.job.Fingerprints;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemRemoteStorageTest {

  @TempDir Path tempDir;

  private FileSystemRemoteStorage storage;

  @BeforeEach
  void setUp() {
    storage = new FileSystemRemoteStorage(tempDir.resolve("remote"));
  }

  @Test
  void upload_shouldSkipContentAlreadyInFolder() throws Exception {
    String folder = storage.ensureFolder("documents");
    Path file = write("notes.txt", "same content");
    Path copy = write("copy.txt", "same content");

    UploadResult first = storage.upload(folder, "notes.txt", file, Fingerprints.of(file));
    UploadResult second = storage.upload(folder, "copy.txt", copy, Fingerprints.of(copy));

    assertThat(first.skipped()).isFalse();
    assertThat(second.skipped()).isTrue();
    assertThat(second.objectId()).isEqualTo(first.objectId()).isEqualTo("documents/notes.txt");
    try (var files = Files.list(tempDir.resolve("remote/documents"))) {
      assertThat(files).hasSize(1);
    }
  }

  @Test
  void upload_shouldSuffixNameWhenDifferentContentExists() throws Exception {
    String folder = storage.ensureFolder("documents");
    Path original = write("a.txt", "first");
    Path changed = write("b.txt", "second");
    storage.upload(folder, "notes.txt", original, Fingerprints.of(original));

    String fingerprint = Fingerprints.of(changed);
    UploadResult result = storage.upload(folder, "notes.txt", changed, fingerprint);

    assertThat(result.objectId())
        .isEqualTo("documents/notes-" + fingerprint.substring(0, 8) + ".txt");
    assertThat(storage.listExisting(folder))
        .containsExactlyInAnyOrder(Fingerprints.of(original), fingerprint);
  }

  @Test
  void ensureFolder_shouldCreateNestedFoldersIdempotently() {
    assertThat(storage.ensureFolder("a/b")).isEqualTo("a/b");
    assertThat(storage.ensureFolder("a/b")).isEqualTo("a/b");
    assertThat(tempDir.resolve("remote/a/b")).isDirectory();
  }

  @Test
  void ensureFolder_shouldRejectPathsOutsideRoot() {
    assertThatThrownBy(() -> storage.ensureFolder("../escape"))
        .isInstanceOf(RemoteStorageException.class);
  }

  @Test
  void listExisting_shouldFailForMissingFolder() {
    assertThatThrownBy(() -> storage.listExisting("nowhere"))
        .isInstanceOf(RemoteStorageException.class);
  }

  private Path write(String name, String content) throws Exception {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content);
    return file;
  }
}
