package com.scholary.scribe.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried by a log
 * aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String recordingId, String stage, int attempt) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);
      MDC.put("attempt", String.valueOf(attempt));

      logger.info("Stage started: recording={}, stage={}, attempt={}", recordingId, stage, attempt);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String recordingId, String stage, String status, long durationMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("status", status);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Stage finished: recording={}, stage={}, status={}, duration={}ms",
          recordingId,
          stage,
          status,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(
      String recordingId, String stage, String failureKind, int attempt, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("failureKind", failureKind);
      MDC.put("attempt", String.valueOf(attempt));

      logger.error(
          "Stage failed: recording={}, stage={}, kind={}, attempt={}, message={}",
          recordingId,
          stage,
          failureKind,
          attempt,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retry of an outbound call made by a collaborator client. */
  public void logCallRetry(
      String target, int attempt, int maxRetries, long backoffMs, String errorType, String message) {
    try {
      MDC.put("event_type", "call_retry");
      MDC.put("target", target);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Call retry: target={}, attempt={}/{}, backoff={}ms, error={}, message={}",
          target,
          attempt,
          maxRetries,
          backoffMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a request refused because another operation holds the recording. */
  public void logJobBusy(String recordingId, String operation) {
    try {
      MDC.put("event_type", "job_busy");
      MDC.put("operation", operation);

      logger.info("Job busy: recording={}, operation={}", recordingId, operation);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job reset after it was found in an in-progress state at startup. */
  public void logJobRecovered(String recordingId, String fromStatus, String toStatus) {
    try {
      MDC.put("event_type", "job_recovered");
      MDC.put("fromStatus", fromStatus);
      MDC.put("status", toStatus);

      logger.warn(
          "Job recovered: recording={}, from={}, to={}", recordingId, fromStatus, toStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Log a status change requested by an operator (reprocess, artifact deletion). */
  public void logJobReset(String recordingId, String reason, String fromStatus, String toStatus) {
    try {
      MDC.put("event_type", "job_reset");
      MDC.put("reason", reason);
      MDC.put("fromStatus", fromStatus);
      MDC.put("status", toStatus);

      logger.info(
          "Job reset: recording={}, reason={}, from={}, to={}",
          recordingId,
          reason,
          fromStatus,
          toStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Set recording context in MDC. */
  public static void setJobContext(String recordingId, String filename) {
    MDC.put("recordingId", recordingId);
    if (filename != null) {
      MDC.put("filename", filename);
    }
  }

  /** Clear recording context from MDC. */
  public static void clearJobContext() {
    MDC.remove("recordingId");
    MDC.remove("filename");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("status");
    MDC.remove("attempt");
    MDC.remove("durationMs");
    MDC.remove("failureKind");
    MDC.remove("target");
    MDC.remove("maxRetries");
    MDC.remove("errorType");
    MDC.remove("operation");
    MDC.remove("fromStatus");
    MDC.remove("reason");
  }
}
