package com.scholary.scribe.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the recording pipeline.
 *
 * <p>Controls where state and artifacts live, the per-stage limits and the worker pool size.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String workDir,
    @Valid @NotNull Limits limits,
    @Valid @NotNull Workers workers,
    @Valid @NotNull Publish publish,
    @NotBlank String promptTemplate,
    String language,
    @Positive int maxAttemptsPerStage,
    @NotNull Duration stageTimeout,
    @Positive int jobCacheSize) {

  public Path workPath() {
    return Path.of(workDir);
  }

  public record Limits(
      @Positive long maxAudioBytes, @Positive int maxTranscriptChars, @Positive int maxTitleLength) {}

  public record Workers(@Positive int threads, @Positive int queueCapacity) {}

  public record Publish(@NotBlank String documentsFolder, @NotBlank String recordingsFolder) {}
}
