package com.scholary.scribe.service;

import com.scholary.scribe.config.PollerProperties;
import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.source.RecordingPage;
import com.scholary.scribe.source.RecordingSource;
import com.scholary.scribe.source.RecordingSummary;
import com.scholary.scribe.source.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically lists the recording source and registers recordings it has not seen.
 *
 * <p>With {@code poller.auto-process} set it also processes every job resting between stages:
 * NEW jobs, jobs rolled back by crash recovery, jobs whose processing was cut short by another
 * operation, and failed jobs that are still eligible for a retry. Jobs that are busy are skipped
 * until the next poll.
 */
@Component
@ConditionalOnProperty(prefix = "poller", name = "enabled", havingValue = "true")
public class RecordingPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingPoller.class);

  private final RecordingSource source;
  private final PipelineOrchestrator orchestrator;
  private final PollerProperties properties;

  public RecordingPoller(
      RecordingSource source, PipelineOrchestrator orchestrator, PollerProperties properties) {
    this.source = source;
    this.orchestrator = orchestrator;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${poller.interval}", initialDelayString = "${poller.interval}")
  public void scheduledPoll() {
    poll();
  }

  /**
   * Run one poll.
   *
   * @return outcome counters
   */
  public PollResult poll() {
    int registered = registerNewRecordings();
    int submitted = properties.autoProcess() ? submitPending() : 0;
    if (registered > 0 || submitted > 0) {
      LOGGER.info("Poll complete: registered={}, submitted={}", registered, submitted);
    }
    return new PollResult(registered, submitted);
  }

  private int registerNewRecordings() {
    int registered = 0;
    Integer page = 0;
    int pagesRead = 0;
    while (page != null && pagesRead < properties.maxPages()) {
      RecordingPage listing;
      try {
        listing = source.listRecordings(page);
      } catch (SourceUnavailableException e) {
        LOGGER.warn("Recording source unavailable, will retry next poll: {}", e.getMessage());
        break;
      }
      for (RecordingSummary summary : listing.items()) {
        if (orchestrator.find(summary.id()).isEmpty()) {
          orchestrator.register(summary.id(), summary.filename());
          registered++;
        }
      }
      page = listing.nextPage();
      pagesRead++;
    }
    return registered;
  }

  private int submitPending() {
    int submitted = 0;
    for (RecordingJob job : orchestrator.list()) {
      if (!isPending(job) || orchestrator.isBusy(job.getId())) {
        continue;
      }
      try {
        orchestrator.process(job.getId());
        submitted++;
      } catch (JobBusyException | JobStateException e) {
        LOGGER.debug("Skipping {}: {}", job.getId(), e.getMessage());
      }
    }
    return submitted;
  }

  private boolean isPending(RecordingJob job) {
    JobStatus status = job.getStatus();
    if (status == JobStatus.FAILED) {
      return orchestrator.isRetryEligible(job);
    }
    return !status.isTerminal() && !status.isInProgress();
  }

  /** Counters for one poll. */
  public record PollResult(int registered, int submitted) {}
}
