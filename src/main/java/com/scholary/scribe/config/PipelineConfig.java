package com.scholary.scribe.config;

import com.scholary.scribe.document.DocumentRenderer;
import com.scholary.scribe.document.OutlineParser;
import com.scholary.scribe.source.RecordingSource;
import com.scholary.scribe.stage.DownloadExecutor;
import com.scholary.scribe.stage.LocalArtifactStore;
import com.scholary.scribe.stage.PublishExecutor;
import com.scholary.scribe.stage.StageExecutor;
import com.scholary.scribe.stage.StructureExecutor;
import com.scholary.scribe.stage.TranscribeExecutor;
import com.scholary.scribe.storage.RemoteStorage;
import com.scholary.scribe.structuring.StructuringService;
import com.scholary.scribe.transcription.TranscriptionEngine;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stage executors and the document components.
 *
 * <p>Enables the PipelineProperties and PollerProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, PollerProperties.class})
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public OutlineParser outlineParser() {
    return new OutlineParser();
  }

  @Bean
  public DocumentRenderer documentRenderer() {
    return new DocumentRenderer();
  }

  @Bean
  public StageExecutor downloadExecutor(
      RecordingSource source, LocalArtifactStore artifacts, PipelineProperties properties) {
    return new DownloadExecutor(source, artifacts, properties);
  }

  @Bean
  public StageExecutor transcribeExecutor(
      TranscriptionEngine engine, LocalArtifactStore artifacts, PipelineProperties properties) {
    return new TranscribeExecutor(engine, artifacts, properties);
  }

  @Bean
  public StageExecutor structureExecutor(
      StructuringService structuringService,
      OutlineParser parser,
      LocalArtifactStore artifacts,
      PipelineProperties properties) {
    return new StructureExecutor(structuringService, parser, artifacts, properties);
  }

  @Bean
  public StageExecutor publishExecutor(
      OutlineParser parser,
      DocumentRenderer renderer,
      RemoteStorage storage,
      LocalArtifactStore artifacts,
      PipelineProperties properties,
      Clock clock) {
    return new PublishExecutor(parser, renderer, storage, artifacts, properties, clock);
  }
}
