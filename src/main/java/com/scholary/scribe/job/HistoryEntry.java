package com.scholary.scribe.job;

import java.time.Instant;

/**
 * Immutable record of a terminal transition, shown on the dashboard's history view.
 *
 * @param recordingId the recording
 * @param filename display name of the recording
 * @param terminalStatus COMPLETED or FAILED
 * @param failedStage the failing stage, null when completed
 * @param failureKind the failure kind, null when completed
 * @param timestamp when the transition happened
 * @param summary short human-readable outcome
 */
public record HistoryEntry(
    String recordingId,
    String filename,
    JobStatus terminalStatus,
    Stage failedStage,
    FailureKind failureKind,
    Instant timestamp,
    String summary) {}
