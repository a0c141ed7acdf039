package com.scholary.scribe.service;

import com.scholary.scribe.config.PipelineProperties;
import com.scholary.scribe.job.Artifact;
import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.ArtifactSet;
import com.scholary.scribe.job.FailureKind;
import com.scholary.scribe.job.HistoryEntry;
import com.scholary.scribe.job.HistoryLog;
import com.scholary.scribe.job.JobNotFoundException;
import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.job.JobStore;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import com.scholary.scribe.logging.StructuredLogger;
import com.scholary.scribe.stage.LocalArtifactStore;
import com.scholary.scribe.stage.StageException;
import com.scholary.scribe.stage.StageExecutor;
import com.scholary.scribe.stage.StageFailures;
import com.scholary.scribe.stage.StageResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Drives recordings through download, transcribe, structure and publish.
 *
 * <p>Every operation that changes a job first takes that job's token. Tokens are exclusive and
 * never waited for: a second request for a busy recording fails at once with {@link
 * JobBusyException}. For asynchronous requests the token is taken on the caller's thread and
 * released by the worker that runs the task.
 *
 * <p>One advance runs at most one stage. The stage itself runs on the stage pool so the worker can
 * give up after {@code pipeline.stage-timeout}, counted from the moment the stage starts. A stage
 * that is given up on keeps the token until its thread actually returns: the job is already FAILED
 * with TIMED_OUT, but the recording stays busy. Success, including the new artifacts, is persisted
 * in a single write; a crash before that write leaves the job in its in-progress status, which
 * {@link #recoverOrphanedJobs()} rolls back to the last completed status on the next start.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final HistoryLog historyLog;
  private final Map<Stage, StageExecutor> executors;
  private final LocalArtifactStore artifacts;
  private final PipelineProperties properties;
  private final Executor workerPool;
  private final ExecutorService stagePool;
  private final Clock clock;

  /** Holders per busy recording id: the worker, plus a stage thread that outlived its timeout. */
  private final ConcurrentHashMap<String, Integer> tokens = new ConcurrentHashMap<>();

  public PipelineOrchestrator(
      JobStore jobStore,
      HistoryLog historyLog,
      List<StageExecutor> stageExecutors,
      LocalArtifactStore artifacts,
      PipelineProperties properties,
      @Qualifier("pipelineWorkerPool") Executor workerPool,
      @Qualifier("pipelineStagePool") ExecutorService stagePool,
      Clock clock) {
    this.jobStore = jobStore;
    this.historyLog = historyLog;
    this.artifacts = artifacts;
    this.properties = properties;
    this.workerPool = workerPool;
    this.stagePool = stagePool;
    this.clock = clock;

    this.executors = new EnumMap<>(Stage.class);
    for (StageExecutor executor : stageExecutors) {
      executors.put(executor.stage(), executor);
    }
    for (Stage stage : Stage.values()) {
      if (!executors.containsKey(stage)) {
        throw new IllegalStateException("No executor registered for stage " + stage);
      }
    }
  }

  public Optional<RecordingJob> find(String id) {
    return jobStore.findById(id);
  }

  public List<RecordingJob> list() {
    return jobStore.findAll();
  }

  public List<HistoryEntry> history(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return historyLog.recent(limit);
  }

  /** Remove history entries older than the cutoff, or all of them when it is null. */
  public int purgeHistory(Instant cutoff) {
    return historyLog.purge(cutoff);
  }

  public boolean isBusy(String id) {
    return tokens.containsKey(id);
  }

  /** Whether a failed job may be retried by a plain advance. */
  public boolean isRetryEligible(RecordingJob job) {
    return job.getStatus() == JobStatus.FAILED
        && job.getFailedStage() != null
        && job.getFailureKind() != null
        && job.getFailureKind().isRetryable()
        && job.attemptsFor(job.getFailedStage()) < properties.maxAttemptsPerStage();
  }

  /** Create the job in NEW unless it is already known. */
  public RecordingJob register(String id, String filename) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Recording id must not be blank");
    }
    return jobStore.saveIfAbsent(new RecordingJob(id, filename, clock.instant()));
  }

  /**
   * Run the next stage on the calling thread.
   *
   * @return the job after the stage; unchanged if it was already COMPLETED
   * @throws JobBusyException if another operation holds the recording
   * @throws JobStateException if the job failed in a way that needs a reprocess
   */
  public RecordingJob advance(String id) {
    load(id);
    acquire(id, "advance");
    try {
      return advanceHeld(id);
    } finally {
      release(id);
    }
  }

  /** Run the next stage on the worker pool. Busy and state refusals are reported immediately. */
  public CompletableFuture<RecordingJob> submitAdvance(String id) {
    RecordingJob job = load(id);
    acquire(id, "advance");
    try {
      checkAdvanceAllowed(job);
    } catch (RuntimeException e) {
      release(id);
      throw e;
    }
    return submitHeld(id, () -> advanceHeld(id));
  }

  /**
   * Advance stage after stage on the worker pool until the job is COMPLETED or FAILED. Each stage
   * is its own worker task and takes the token again, so other requests can get in between; if one
   * does, processing stops there.
   */
  public CompletableFuture<RecordingJob> process(String id) {
    RecordingJob job = load(id);
    acquire(id, "process");
    try {
      checkAdvanceAllowed(job);
    } catch (RuntimeException e) {
      release(id);
      throw e;
    }
    if (job.getStatus() == JobStatus.COMPLETED) {
      release(id);
      return CompletableFuture.completedFuture(job);
    }
    return submitHeld(id, () -> advanceHeld(id)).thenCompose(this::continueProcessing);
  }

  /**
   * Reset the job to the point its valid artifacts allow and run one stage on the calling thread.
   * Attempt counters and failure details are cleared.
   */
  public RecordingJob reprocess(String id) {
    load(id);
    acquire(id, "reprocess");
    try {
      resetForReprocess(id);
      return advanceHeld(id);
    } finally {
      release(id);
    }
  }

  /** Reset as {@link #reprocess(String)} does, then process to the end on the worker pool. */
  public CompletableFuture<RecordingJob> submitReprocess(String id) {
    load(id);
    acquire(id, "reprocess");
    try {
      resetForReprocess(id);
    } catch (RuntimeException e) {
      release(id);
      throw e;
    }
    return submitHeld(id, () -> advanceHeld(id)).thenCompose(this::continueProcessing);
  }

  /**
   * Delete local artifacts and move the job back to the strongest status the remaining artifacts
   * support. A FAILED job loses its failure details. History is not touched.
   */
  public RecordingJob deleteArtifacts(String id, Collection<ArtifactKind> kinds) {
    if (kinds == null || kinds.isEmpty()) {
      throw new IllegalArgumentException("At least one artifact kind is required");
    }
    load(id);
    acquire(id, "delete-artifacts");
    try {
      RecordingJob job = load(id);
      JobStatus from = job.getStatus();
      for (ArtifactKind kind : kinds) {
        artifacts.delete(id, kind);
      }
      job.setArtifacts(job.getArtifacts().without(kinds));

      Set<ArtifactKind> valid = artifacts.validKinds(job);
      JobStatus supported = JobTransitions.supportedBy(valid);
      JobStatus to =
          from == JobStatus.FAILED
              ? supported
              : JobTransitions.weaker(JobTransitions.lastCompleted(from), supported);

      job.setStatus(to);
      job.clearFailure();
      job.setAttempts(Map.of());
      job.setUpdatedAt(clock.instant());
      jobStore.save(job);

      STRUCTURED_LOGGER.logJobReset(id, "delete-artifacts " + kinds, from.name(), to.name());
      return job;
    } finally {
      release(id);
    }
  }

  /**
   * Roll back jobs left in an in-progress status by a crash to their last completed status. Jobs
   * held by a live token are left alone.
   *
   * @return the recovered jobs
   */
  @EventListener(ApplicationReadyEvent.class)
  public List<RecordingJob> recoverOrphanedJobs() {
    List<RecordingJob> recovered = new ArrayList<>();
    for (RecordingJob job : jobStore.findAll()) {
      if (job.getStatus().isInProgress() && tryAcquire(job.getId())) {
        recovered.add(recoverHeld(job));
      }
    }
    if (!recovered.isEmpty()) {
      LOGGER.warn("Recovered {} interrupted job(s)", recovered.size());
    }
    return recovered;
  }

  private RecordingJob recoverHeld(RecordingJob job) {
    try {
      JobStatus from = job.getStatus();
      JobStatus to = JobTransitions.lastCompleted(from);
      job.setStatus(to);
      job.setUpdatedAt(clock.instant());
      jobStore.save(job);
      STRUCTURED_LOGGER.logJobRecovered(job.getId(), from.name(), to.name());
      return job;
    } finally {
      release(job.getId());
    }
  }

  private RecordingJob advanceHeld(String id) {
    RecordingJob job = load(id);
    if (job.getStatus() == JobStatus.COMPLETED) {
      LOGGER.debug("Job {} already completed, nothing to do", id);
      return job;
    }
    return runStage(job, nextStage(job));
  }

  private void checkAdvanceAllowed(RecordingJob job) {
    if (job.getStatus() != JobStatus.COMPLETED) {
      nextStage(job);
    }
  }

  private Stage nextStage(RecordingJob job) {
    if (job.getStatus() == JobStatus.FAILED && !isRetryEligible(job)) {
      throw new JobStateException(
          job.getId(),
          job.getStatus(),
          String.format(
              "Job %s failed in %s (%s) after %d attempt(s); reprocess it to continue",
              job.getId(),
              job.getFailedStage(),
              job.getFailureKind(),
              job.getFailedStage() == null ? 0 : job.attemptsFor(job.getFailedStage())));
    }

    JobStatus effective =
        JobTransitions.effectiveStatus(
            job.getStatus(), job.getFailedStage(), artifacts.validKinds(job));
    Stage stage =
        Stage.startingFrom(effective)
            .orElseThrow(
                () ->
                    new JobStateException(
                        job.getId(), job.getStatus(), "No stage runs from " + effective));

    if (job.attemptsFor(stage) >= properties.maxAttemptsPerStage()) {
      throw new JobStateException(
          job.getId(),
          job.getStatus(),
          String.format(
              "Stage %s of %s reached the limit of %d attempts; reprocess it to continue",
              stage, job.getId(), properties.maxAttemptsPerStage()));
    }
    return stage;
  }

  private void resetForReprocess(String id) {
    RecordingJob job = load(id);
    JobStatus from = job.getStatus();
    JobStatus to = JobTransitions.reentryPoint(artifacts.validKinds(job));

    job.setStatus(to);
    job.clearFailure();
    job.setAttempts(Map.of());
    job.setUpdatedAt(clock.instant());
    jobStore.save(job);

    STRUCTURED_LOGGER.logJobReset(id, "reprocess", from.name(), to.name());
  }

  private RecordingJob runStage(RecordingJob job, Stage stage) {
    job.recordAttempt(stage);
    job.setStatus(stage.runningStatus());
    job.clearFailure();
    job.setUpdatedAt(clock.instant());
    jobStore.save(job);

    int attempt = job.attemptsFor(stage);
    StructuredLogger.setJobContext(job.getId(), job.getFilename());
    try {
      STRUCTURED_LOGGER.logStageStarted(job.getId(), stage.name(), attempt);
      long startNanos = System.nanoTime();

      StageResult result;
      try {
        result = runWithTimeout(executors.get(stage), job.copy());
        if (!result.artifacts().containsKey(stage.output())) {
          throw new StageException(
              FailureKind.INTERNAL, "Stage " + stage + " produced no " + stage.output());
        }
      } catch (RuntimeException e) {
        return fail(job, stage, attempt, e);
      }

      ArtifactSet produced = job.getArtifacts();
      for (Map.Entry<ArtifactKind, Artifact> entry : result.artifacts().entrySet()) {
        produced = produced.with(entry.getKey(), entry.getValue());
      }
      job.setArtifacts(produced);
      job.getRemoteObjects().putAll(result.remoteObjects());
      job.setStatus(stage.completedStatus());
      job.setUpdatedAt(clock.instant());
      jobStore.save(job);

      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      STRUCTURED_LOGGER.logStageFinished(
          job.getId(), stage.name(), job.getStatus().name(), durationMs);
      if (job.getStatus() == JobStatus.COMPLETED) {
        historyLog.append(
            new HistoryEntry(
                job.getId(),
                job.getFilename(),
                JobStatus.COMPLETED,
                null,
                null,
                clock.instant(),
                "Published " + job.getRemoteObjects().size() + " object(s)"));
      }
      return job;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private RecordingJob fail(RecordingJob job, Stage stage, int attempt, RuntimeException error) {
    FailureKind kind = StageFailures.classify(error);
    String message = StageFailures.describe(error);
    job.markFailed(stage, kind, message);
    job.setUpdatedAt(clock.instant());
    jobStore.save(job);

    STRUCTURED_LOGGER.logStageFailed(job.getId(), stage.name(), kind.name(), attempt, message);
    if (kind == FailureKind.INTERNAL) {
      LOGGER.error("Unexpected failure in {} for {}", stage, job.getId(), error);
    }
    historyLog.append(
        new HistoryEntry(
            job.getId(),
            job.getFilename(),
            JobStatus.FAILED,
            stage,
            kind,
            clock.instant(),
            stage + " failed (" + kind + "): " + message));
    return job;
  }

  private StageResult runWithTimeout(StageExecutor executor, RecordingJob snapshot) {
    StageRun run = new StageRun(executor, snapshot);
    Future<StageResult> future = stagePool.submit(run);
    long timeoutMs = properties.stageTimeout().toMillis();
    try {
      run.started.await();
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      run.abandon(future);
      throw new StageException(
          FailureKind.TIMED_OUT,
          String.format("%s did not finish within %d ms", executor.stage(), timeoutMs),
          e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new StageException(StageFailures.classify(cause), StageFailures.describe(cause), cause);
    } catch (CancellationException e) {
      throw new StageException(FailureKind.INTERNAL, executor.stage() + " was cancelled", e);
    } catch (InterruptedException e) {
      run.abandon(future);
      Thread.currentThread().interrupt();
      throw new StageException(FailureKind.INTERNAL, executor.stage() + " was interrupted", e);
    }
  }

  private CompletableFuture<RecordingJob> continueProcessing(RecordingJob job) {
    if (job.getStatus().isTerminal()) {
      return CompletableFuture.completedFuture(job);
    }
    if (!tryAcquire(job.getId())) {
      LOGGER.info("Stopping processing of {}: another operation took over", job.getId());
      return CompletableFuture.completedFuture(job);
    }
    try {
      return submitHeld(job.getId(), () -> advanceHeld(job.getId()))
          .thenCompose(this::continueProcessing);
    } catch (JobBusyException e) {
      LOGGER.warn("Stopping processing of {}: worker pool is full", job.getId());
      return CompletableFuture.completedFuture(job);
    }
  }

  /** Submit work for a job whose token the caller already holds; the task releases it. */
  private CompletableFuture<RecordingJob> submitHeld(String id, Supplier<RecordingJob> work) {
    try {
      return CompletableFuture.supplyAsync(
          () -> {
            try {
              return work.get();
            } finally {
              release(id);
            }
          },
          workerPool);
    } catch (RejectedExecutionException e) {
      release(id);
      STRUCTURED_LOGGER.logJobBusy(id, "worker-pool-full");
      throw new JobBusyException(id, "Worker pool is full, try again later: " + id);
    }
  }

  private RecordingJob load(String id) {
    return jobStore.findById(id).orElseThrow(() -> new JobNotFoundException(id));
  }

  private void acquire(String id, String operation) {
    if (!tryAcquire(id)) {
      STRUCTURED_LOGGER.logJobBusy(id, operation);
      throw new JobBusyException(id);
    }
  }

  private boolean tryAcquire(String id) {
    return tokens.putIfAbsent(id, 1) == null;
  }

  /** Add a holder to a token the caller already holds. */
  private void share(String id) {
    tokens.merge(id, 1, Integer::sum);
  }

  private void release(String id) {
    tokens.computeIfPresent(id, (key, holders) -> holders > 1 ? holders - 1 : null);
  }

  /**
   * One stage execution on the stage pool. If the worker stops waiting for it, the token is shared
   * with the stage thread, and whichever of the two finishes last releases that share.
   */
  private final class StageRun implements Callable<StageResult> {

    private final StageExecutor executor;
    private final RecordingJob snapshot;
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile boolean abandoned;

    StageRun(StageExecutor executor, RecordingJob snapshot) {
      this.executor = executor;
      this.snapshot = snapshot;
    }

    @Override
    public StageResult call() {
      started.countDown();
      try {
        if (abandoned) {
          return null;
        }
        return executor.run(snapshot);
      } finally {
        if (!settled.compareAndSet(false, true)) {
          release(snapshot.getId());
          LOGGER.info(
              "Abandoned {} stage of {} has exited, releasing the recording",
              executor.stage(),
              snapshot.getId());
        }
      }
    }

    /** Called by the worker when it stops waiting; the caller still holds the token. */
    void abandon(Future<StageResult> future) {
      abandoned = true;
      share(snapshot.getId());
      if (!settled.compareAndSet(false, true)) {
        release(snapshot.getId());
      }
      if (started.getCount() == 0) {
        future.cancel(true);
      }
    }
  }
}
