package com.scholary.scribe.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.scribe.config.PipelineProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Job store backed by one JSON file per recording under {@code <work-dir>/state/jobs}.
 *
 * <p>Reads go through a bounded Caffeine cache; the files are the source of truth and the cache is
 * rebuilt lazily after a restart. Each save writes a temp file and moves it over the old record.
 */
@Repository
public class FileJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileJobStore.class);
  private static final String SUFFIX = ".json";

  private final ObjectMapper objectMapper;
  private final Path jobsDir;
  private final Cache<String, RecordingJob> cache;

  @Autowired
  public FileJobStore(ObjectMapper objectMapper, PipelineProperties properties) {
    this(objectMapper, properties.workPath().resolve("state").resolve("jobs"),
        properties.jobCacheSize());
  }

  FileJobStore(ObjectMapper objectMapper, Path jobsDir, int cacheSize) {
    this.objectMapper = objectMapper;
    this.jobsDir = jobsDir;
    this.cache = Caffeine.newBuilder().maximumSize(cacheSize).build();
    try {
      Files.createDirectories(jobsDir);
    } catch (IOException e) {
      throw new JobStoreException("Cannot create job state directory " + jobsDir, e);
    }
  }

  @Override
  public Optional<RecordingJob> findById(String id) {
    RecordingJob job = cache.get(id, key -> read(fileFor(key)).orElse(null));
    return Optional.ofNullable(job).map(RecordingJob::copy);
  }

  @Override
  public List<RecordingJob> findAll() {
    List<RecordingJob> jobs = new ArrayList<>();
    try (Stream<Path> files = Files.list(jobsDir)) {
      for (Path file : (Iterable<Path>) files.filter(f -> f.toString().endsWith(SUFFIX))::iterator) {
        read(file).ifPresent(job -> jobs.add(job.copy()));
      }
    } catch (IOException e) {
      throw new JobStoreException("Cannot list job state directory " + jobsDir, e);
    }
    jobs.sort(Comparator.comparing(RecordingJob::getCreatedAt).thenComparing(RecordingJob::getId));
    return jobs;
  }

  @Override
  public void save(RecordingJob job) {
    RecordingJob snapshot = job.copy();
    write(snapshot);
    cache.put(snapshot.getId(), snapshot);
  }

  @Override
  public synchronized RecordingJob saveIfAbsent(RecordingJob job) {
    Optional<RecordingJob> existing = findById(job.getId());
    if (existing.isPresent()) {
      return existing.get();
    }
    save(job);
    LOGGER.info("Registered recording {} ({})", job.getId(), job.getFilename());
    return job.copy();
  }

  private Optional<RecordingJob> read(Path file) {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), RecordingJob.class));
    } catch (IOException e) {
      throw new JobStoreException("Cannot read job record " + file, e);
    }
  }

  private synchronized void write(RecordingJob job) {
    Path target = fileFor(job.getId());
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.write(temp, objectMapper.writeValueAsBytes(job));
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.warn("Atomic move not supported in {}, falling back to replace", jobsDir);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new JobStoreException("Cannot write job record " + target, e);
    }
  }

  Path fileFor(String id) {
    return jobsDir.resolve(encode(id) + SUFFIX);
  }

  /** File-system safe, collision-free encoding of a recording id. */
  public static String encode(String id) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(id.getBytes(StandardCharsets.UTF_8));
  }
}
