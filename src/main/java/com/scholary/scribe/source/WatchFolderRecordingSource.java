package com.scholary.scribe.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audio files dropped into a local folder, for example by a sync client.
 *
 * <p>A file is listed once it is complete: non-empty, with the same size as on the previous
 * listing. Files over the audio size limit are never listed. Ids are the file name prefixed with
 * {@value #ID_PREFIX}, so they cannot collide with device ids. The whole folder is one page.
 */
public class WatchFolderRecordingSource implements RecordingSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(WatchFolderRecordingSource.class);

  public static final String ID_PREFIX = "local:";
  static final List<String> SUPPORTED_EXTENSIONS =
      List.of(".mp3", ".m4a", ".wav", ".ogg", ".flac");

  private final Path directory;
  private final long maxAudioBytes;
  private final Map<String, Long> lastSeenSizes = new ConcurrentHashMap<>();
  private final Set<String> rejected = ConcurrentHashMap.newKeySet();

  public WatchFolderRecordingSource(Path directory, long maxAudioBytes) {
    this.directory = directory.toAbsolutePath().normalize();
    this.maxAudioBytes = maxAudioBytes;
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create watch folder " + this.directory, e);
    }
    LOGGER.info("Watching {} for audio files", this.directory);
  }

  @Override
  public RecordingPage listRecordings(int page) {
    if (page > 0) {
      return new RecordingPage(List.of(), null);
    }

    List<Path> files;
    try (Stream<Path> entries = Files.list(directory)) {
      files =
          entries
              .filter(Files::isRegularFile)
              .filter(WatchFolderRecordingSource::isAudio)
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new SourceUnavailableException("Cannot list watch folder " + directory, e);
    }

    List<RecordingSummary> ready = new ArrayList<>();
    Set<String> present = new HashSet<>();
    for (Path file : files) {
      String name = file.getFileName().toString();
      present.add(name);
      try {
        long size = Files.size(file);
        Long previous = lastSeenSizes.put(name, size);
        if (size == 0 || previous == null || previous != size) {
          LOGGER.debug("Still being written: {} ({} bytes)", name, size);
          continue;
        }
        if (size > maxAudioBytes) {
          if (rejected.add(name + "@" + size)) {
            LOGGER.error(
                "Ignoring {}: {} bytes exceeds the {} byte limit", name, size, maxAudioBytes);
          }
          continue;
        }
        ready.add(
            new RecordingSummary(
                ID_PREFIX + name, name, Files.getLastModifiedTime(file).toInstant(), 0));
      } catch (NoSuchFileException e) {
        LOGGER.debug("File disappeared while listing: {}", name);
        present.remove(name);
      } catch (IOException e) {
        throw new SourceUnavailableException("Cannot read " + file, e);
      }
    }

    lastSeenSizes.keySet().retainAll(present);
    return new RecordingPage(ready, null);
  }

  @Override
  public InputStream openDownload(String recordingId) {
    Path file = resolve(recordingId);
    try {
      return Files.newInputStream(file);
    } catch (NoSuchFileException e) {
      throw new SourceUnavailableException("Recording file is gone: " + file, e);
    } catch (IOException e) {
      throw new SourceUnavailableException("Cannot open " + file, e);
    }
  }

  @Override
  public boolean owns(String recordingId) {
    return recordingId != null && recordingId.startsWith(ID_PREFIX);
  }

  private Path resolve(String recordingId) {
    if (!owns(recordingId)) {
      throw new SourceUnavailableException("Not a watch folder recording: " + recordingId);
    }
    Path file = directory.resolve(recordingId.substring(ID_PREFIX.length())).normalize();
    if (!directory.equals(file.getParent())) {
      throw new SourceUnavailableException("Recording outside the watch folder: " + recordingId);
    }
    return file;
  }

  private static boolean isAudio(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
  }
}
