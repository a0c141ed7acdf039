package com.scholary.scribe.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.scribe.config.PipelineProperties;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/** History log stored as JSON lines in {@code <work-dir>/state/history.jsonl}. */
@Repository
public class FileHistoryLog implements HistoryLog {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileHistoryLog.class);

  private final ObjectMapper objectMapper;
  private final Path file;

  @Autowired
  public FileHistoryLog(ObjectMapper objectMapper, PipelineProperties properties) {
    this(objectMapper, properties.workPath().resolve("state").resolve("history.jsonl"));
  }

  FileHistoryLog(ObjectMapper objectMapper, Path file) {
    this.objectMapper = objectMapper;
    this.file = file;
    try {
      Files.createDirectories(file.getParent());
    } catch (IOException e) {
      throw new JobStoreException("Cannot create history directory " + file.getParent(), e);
    }
  }

  @Override
  public synchronized void append(HistoryEntry entry) {
    try (BufferedWriter writer =
        Files.newBufferedWriter(
            file,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND)) {
      writer.write(objectMapper.writeValueAsString(entry));
      writer.newLine();
    } catch (IOException e) {
      throw new JobStoreException("Cannot append to history " + file, e);
    }
  }

  @Override
  public synchronized List<HistoryEntry> recent(int limit) {
    List<HistoryEntry> entries = readAll();
    Collections.reverse(entries);
    return entries.size() > limit ? new ArrayList<>(entries.subList(0, limit)) : entries;
  }

  @Override
  public synchronized int purge(Instant cutoff) {
    List<HistoryEntry> entries = readAll();
    List<HistoryEntry> kept = new ArrayList<>();
    if (cutoff != null) {
      for (HistoryEntry entry : entries) {
        if (!entry.timestamp().isBefore(cutoff)) {
          kept.add(entry);
        }
      }
    }

    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      List<String> lines = new ArrayList<>(kept.size());
      for (HistoryEntry entry : kept) {
        lines.add(objectMapper.writeValueAsString(entry));
      }
      Files.write(temp, lines, StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new JobStoreException("Cannot purge history " + file, e);
    }

    int removed = entries.size() - kept.size();
    LOGGER.info("Purged {} history entries (cutoff: {})", removed, cutoff);
    return removed;
  }

  private List<HistoryEntry> readAll() {
    List<HistoryEntry> entries = new ArrayList<>();
    if (!Files.exists(file)) {
      return entries;
    }
    try {
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        if (!line.isBlank()) {
          entries.add(objectMapper.readValue(line, HistoryEntry.class));
        }
      }
    } catch (IOException e) {
      throw new JobStoreException("Cannot read history " + file, e);
    }
    return entries;
  }
}
