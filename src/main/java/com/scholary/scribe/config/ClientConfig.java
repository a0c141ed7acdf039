package com.scholary.scribe.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.scribe.source.CompositeRecordingSource;
import com.scholary.scribe.source.PlaudRecordingSource;
import com.scholary.scribe.source.RecordingSource;
import com.scholary.scribe.source.SourceProperties;
import com.scholary.scribe.source.WatchFolderProperties;
import com.scholary.scribe.source.WatchFolderRecordingSource;
import com.scholary.scribe.structuring.AnthropicStructuringService;
import com.scholary.scribe.structuring.StructuringProperties;
import com.scholary.scribe.structuring.StructuringService;
import com.scholary.scribe.transcription.TranscriptionEngine;
import com.scholary.scribe.transcription.WhisperProperties;
import com.scholary.scribe.transcription.WhisperTranscriptionEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the clients of the external services.
 *
 * <p>When the drop folder is enabled it is listed ahead of the device API, so local files are
 * picked up even while the API is unreachable.
 */
@Configuration
@EnableConfigurationProperties({
  SourceProperties.class,
  WatchFolderProperties.class,
  WhisperProperties.class,
  StructuringProperties.class
})
public class ClientConfig {

  @Bean
  public RecordingSource recordingSource(
      SourceProperties properties,
      WatchFolderProperties watchFolder,
      PipelineProperties pipelineProperties,
      ObjectMapper objectMapper) {
    List<RecordingSource> sources = new ArrayList<>();
    if (watchFolder.enabled()) {
      if (watchFolder.dir() == null || watchFolder.dir().isBlank()) {
        throw new IllegalStateException("watch.dir is required when watch.enabled is true");
      }
      sources.add(
          new WatchFolderRecordingSource(
              Path.of(watchFolder.dir()), pipelineProperties.limits().maxAudioBytes()));
    }
    sources.add(new PlaudRecordingSource(properties, objectMapper));
    return sources.size() == 1 ? sources.get(0) : new CompositeRecordingSource(sources);
  }

  @Bean
  public TranscriptionEngine transcriptionEngine(
      WhisperProperties properties, ObjectMapper objectMapper) {
    return new WhisperTranscriptionEngine(properties, objectMapper);
  }

  @Bean
  public StructuringService structuringService(
      StructuringProperties properties, ObjectMapper objectMapper) {
    return new AnthropicStructuringService(properties, objectMapper);
  }
}
