package com.scholary.scribe.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Durable state of one recording's trip through the pipeline.
 *
 * <p>Instances handed out by the {@link JobStore} are snapshots; mutate a copy and save it back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordingJob {

  private String id;
  private String filename;
  private JobStatus status;
  private Stage failedStage;
  private FailureKind failureKind;
  private String lastError;
  private Map<Stage, Integer> attempts = new EnumMap<>(Stage.class);
  private ArtifactSet artifacts = ArtifactSet.empty();
  private Map<ArtifactKind, String> remoteObjects = new EnumMap<>(ArtifactKind.class);
  private Instant createdAt;
  private Instant updatedAt;

  RecordingJob() {}

  public RecordingJob(String id, String filename, Instant createdAt) {
    this.id = id;
    this.filename = filename;
    this.status = JobStatus.NEW;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public RecordingJob copy() {
    RecordingJob copy = new RecordingJob();
    copy.id = id;
    copy.filename = filename;
    copy.status = status;
    copy.failedStage = failedStage;
    copy.failureKind = failureKind;
    copy.lastError = lastError;
    copy.setAttempts(attempts);
    copy.artifacts = artifacts;
    copy.setRemoteObjects(remoteObjects);
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    return copy;
  }

  public int attemptsFor(Stage stage) {
    return attempts.getOrDefault(stage, 0);
  }

  public void recordAttempt(Stage stage) {
    attempts.merge(stage, 1, Integer::sum);
  }

  public void markFailed(Stage stage, FailureKind kind, String message) {
    this.status = JobStatus.FAILED;
    this.failedStage = stage;
    this.failureKind = kind;
    this.lastError = message;
  }

  public void clearFailure() {
    this.failedStage = null;
    this.failureKind = null;
    this.lastError = null;
  }

  public String getId() {
    return id;
  }

  public String getFilename() {
    return filename;
  }

  public void setFilename(String filename) {
    this.filename = filename;
  }

  public JobStatus getStatus() {
    return status;
  }

  public void setStatus(JobStatus status) {
    this.status = status;
  }

  public Stage getFailedStage() {
    return failedStage;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  public String getLastError() {
    return lastError;
  }

  public Map<Stage, Integer> getAttempts() {
    return attempts;
  }

  public void setAttempts(Map<Stage, Integer> attempts) {
    this.attempts = new EnumMap<>(Stage.class);
    if (attempts != null) {
      this.attempts.putAll(attempts);
    }
  }

  public ArtifactSet getArtifacts() {
    return artifacts;
  }

  public void setArtifacts(ArtifactSet artifacts) {
    this.artifacts = artifacts == null ? ArtifactSet.empty() : artifacts;
  }

  public Map<ArtifactKind, String> getRemoteObjects() {
    return remoteObjects;
  }

  public void setRemoteObjects(Map<ArtifactKind, String> remoteObjects) {
    this.remoteObjects = new EnumMap<>(ArtifactKind.class);
    if (remoteObjects != null) {
      this.remoteObjects.putAll(remoteObjects);
    }
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  @Override
  public String toString() {
    return "RecordingJob{id='" + id + "', status=" + status + ", failedStage=" + failedStage + "}";
  }
}
