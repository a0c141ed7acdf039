package com.scholary.scribe.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WatchFolderRecordingSourceTest {

  @TempDir Path tempDir;

  @Test
  void listRecordings_shouldListFileOnceItsSizeSettles() throws Exception {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);
    write("Standup.mp3", "audio");

    assertThat(source.listRecordings(0).items()).isEmpty();
    RecordingPage page = source.listRecordings(0);

    assertThat(page.items())
        .singleElement()
        .satisfies(
            summary -> {
              assertThat(summary.id()).isEqualTo("local:Standup.mp3");
              assertThat(summary.filename()).isEqualTo("Standup.mp3");
              assertThat(summary.startTime()).isNotNull();
            });
    assertThat(page.hasNext()).isFalse();
  }

  @Test
  void listRecordings_shouldWaitWhileFileIsStillGrowing() throws Exception {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);
    write("Standup.mp3", "aud");
    source.listRecordings(0);
    Files.writeString(tempDir.resolve("Standup.mp3"), "io", StandardOpenOption.APPEND);

    assertThat(source.listRecordings(0).items()).isEmpty();
    assertThat(source.listRecordings(0).items()).hasSize(1);
  }

  @Test
  void listRecordings_shouldIgnoreEmptyAndNonAudioFiles() throws Exception {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);
    write("notes.txt", "text");
    write("empty.wav", "");
    Files.createDirectory(tempDir.resolve("folder.mp3"));

    source.listRecordings(0);

    assertThat(source.listRecordings(0).items()).isEmpty();
  }

  @Test
  void listRecordings_shouldSkipFilesOverSizeLimit() throws Exception {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 4);
    write("long.flac", "too long");
    write("SHORT.OGG", "ok");

    source.listRecordings(0);

    assertThat(source.listRecordings(0).items())
        .extracting(RecordingSummary::id)
        .containsExactly("local:SHORT.OGG");
  }

  @Test
  void listRecordings_shouldReturnOnlyOnePage() throws Exception {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);
    write("Standup.mp3", "audio");
    source.listRecordings(0);

    assertThat(source.listRecordings(1).items()).isEmpty();
  }

  @Test
  void constructor_shouldCreateMissingFolder() {
    Path folder = tempDir.resolve("watch").resolve("input");

    new WatchFolderRecordingSource(folder, 1_000);

    assertThat(folder).isDirectory();
  }

  @Test
  void openDownload_shouldStreamFileContent() throws Exception {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);
    write("Standup.mp3", "audio");

    try (InputStream content = source.openDownload("local:Standup.mp3")) {
      assertThat(new String(content.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("audio");
    }
  }

  @Test
  void openDownload_shouldRejectMissingForeignAndEscapingIds() {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);

    assertThatThrownBy(() -> source.openDownload("local:gone.mp3"))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("gone");
    assertThatThrownBy(() -> source.openDownload("abc123"))
        .isInstanceOf(SourceUnavailableException.class);
    assertThatThrownBy(() -> source.openDownload("local:../outside.mp3"))
        .isInstanceOf(SourceUnavailableException.class)
        .hasMessageContaining("outside the watch folder");
  }

  @Test
  void owns_shouldMatchLocalPrefixOnly() {
    WatchFolderRecordingSource source = new WatchFolderRecordingSource(tempDir, 1_000);

    assertThat(source.owns("local:a.mp3")).isTrue();
    assertThat(source.owns("a.mp3")).isFalse();
  }

  private void write(String name, String content) throws Exception {
    Files.writeString(tempDir.resolve(name), content);
  }
}
