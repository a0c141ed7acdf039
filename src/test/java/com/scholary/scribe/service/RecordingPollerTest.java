package com.scholary.scribe.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.scribe.config.PollerProperties;
import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.source.RecordingPage;
import com.scholary.scribe.source.RecordingSource;
import com.scholary.scribe.source.RecordingSummary;
import com.scholary.scribe.source.SourceUnavailableException;
import com.scholary.scribe.source.WatchFolderRecordingSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordingPollerTest {

  private static final Instant T0 = Instant.parse("2025-01-10T09:00:00Z");

  @TempDir Path tempDir;

  private RecordingSource source;
  private PipelineOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    source = mock(RecordingSource.class);
    orchestrator = mock(PipelineOrchestrator.class);
  }

  @Test
  void poll_shouldRegisterUnseenRecordingsAcrossPages() {
    when(source.listRecordings(0)).thenReturn(new RecordingPage(List.of(summary("a")), 1));
    when(source.listRecordings(1)).thenReturn(new RecordingPage(List.of(summary("b")), null));
    when(orchestrator.find("a")).thenReturn(Optional.of(new RecordingJob("a", "a.mp3", T0)));
    when(orchestrator.find("b")).thenReturn(Optional.empty());

    RecordingPoller.PollResult result = poller(false, 5).poll();

    assertThat(result.registered()).isEqualTo(1);
    verify(orchestrator).register("b", "b.mp3");
    verify(orchestrator, never()).register("a", "a.mp3");
  }

  @Test
  void poll_shouldStopAtPageLimit() {
    when(source.listRecordings(0)).thenReturn(new RecordingPage(List.of(), 1));

    poller(false, 1).poll();

    verify(source, never()).listRecordings(1);
  }

  @Test
  void poll_shouldSurviveUnavailableSource() {
    when(source.listRecordings(0)).thenThrow(new SourceUnavailableException("HTTP 401"));

    RecordingPoller.PollResult result = poller(false, 5).poll();

    assertThat(result.registered()).isZero();
    verify(orchestrator, never()).register(anyString(), anyString());
  }

  @Test
  void poll_shouldProcessNewAndRetryEligibleJobs() {
    when(source.listRecordings(0)).thenReturn(new RecordingPage(List.of(), null));
    RecordingJob fresh = new RecordingJob("new", "new.mp3", T0);
    RecordingJob retry = new RecordingJob("retry", "retry.mp3", T0);
    RecordingJob busy = new RecordingJob("busy", "busy.mp3", T0);
    RecordingJob done = new RecordingJob("done", "done.mp3", T0);
    when(orchestrator.list()).thenReturn(List.of(fresh, retry, busy, done));
    when(orchestrator.isRetryEligible(retry)).thenReturn(true);
    when(orchestrator.isBusy("busy")).thenReturn(true);
    done.setStatus(JobStatus.COMPLETED);
    retry.setStatus(JobStatus.FAILED);
    when(orchestrator.process(anyString()))
        .thenReturn(CompletableFuture.completedFuture(fresh));

    RecordingPoller.PollResult result = poller(true, 5).poll();

    assertThat(result.submitted()).isEqualTo(2);
    verify(orchestrator).process("new");
    verify(orchestrator).process("retry");
    verify(orchestrator, never()).process("busy");
    verify(orchestrator, never()).process("done");
  }

  @Test
  void poll_shouldResumeJobsRestingBetweenStages() {
    when(source.listRecordings(0)).thenReturn(new RecordingPage(List.of(), null));
    RecordingJob recovered = job("recovered", JobStatus.DOWNLOADED);
    RecordingJob interrupted = job("interrupted", JobStatus.STRUCTURED);
    RecordingJob running = job("running", JobStatus.TRANSCRIBING);
    RecordingJob exhausted = job("exhausted", JobStatus.FAILED);
    when(orchestrator.list()).thenReturn(List.of(recovered, interrupted, running, exhausted));
    when(orchestrator.process(anyString()))
        .thenReturn(CompletableFuture.completedFuture(recovered));

    RecordingPoller.PollResult result = poller(true, 5).poll();

    assertThat(result.submitted()).isEqualTo(2);
    verify(orchestrator).process("recovered");
    verify(orchestrator).process("interrupted");
    verify(orchestrator, never()).process("running");
    verify(orchestrator, never()).process("exhausted");
  }

  @Test
  void poll_shouldKeepRegistrationsMadeBeforeSourceFailed() {
    when(source.listRecordings(0)).thenReturn(new RecordingPage(List.of(summary("a")), 1));
    when(source.listRecordings(1)).thenThrow(new SourceUnavailableException("HTTP 503"));
    when(orchestrator.find("a")).thenReturn(Optional.empty());

    assertThat(poller(false, 5).poll().registered()).isEqualTo(1);
    verify(orchestrator).register("a", "a.mp3");
  }

  @Test
  void poll_shouldRegisterFilesDroppedIntoWatchFolder() throws Exception {
    source = new WatchFolderRecordingSource(tempDir, 1_000);
    Files.write(tempDir.resolve("memo.m4a"), new byte[] {1, 2, 3});

    assertThat(poller(false, 5).poll().registered()).isZero();
    assertThat(poller(false, 5).poll().registered()).isEqualTo(1);

    verify(orchestrator, times(1)).register("local:memo.m4a", "memo.m4a");
  }

  @Test
  void poll_shouldSkipJobsThatTurnBusy() {
    when(source.listRecordings(0)).thenReturn(new RecordingPage(List.of(), null));
    when(orchestrator.list()).thenReturn(List.of(new RecordingJob("new", "new.mp3", T0)));
    when(orchestrator.process("new")).thenThrow(new JobBusyException("new"));

    assertThat(poller(true, 5).poll().submitted()).isZero();
  }

  private RecordingPoller poller(boolean autoProcess, int maxPages) {
    return new RecordingPoller(
        source,
        orchestrator,
        new PollerProperties(true, Duration.ofSeconds(60), autoProcess, maxPages));
  }

  private static RecordingJob job(String id, JobStatus status) {
    RecordingJob job = new RecordingJob(id, id + ".mp3", T0);
    job.setStatus(status);
    return job;
  }

  private static RecordingSummary summary(String id) {
    return new RecordingSummary(id, id + ".mp3", T0, 60_000);
  }
}
