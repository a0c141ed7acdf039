package com.scholary.scribe.config;

import com.scholary.scribe.storage.FileSystemRemoteStorage;
import com.scholary.scribe.storage.ObjectStoreProperties;
import com.scholary.scribe.storage.RemoteStorage;
import com.scholary.scribe.storage.S3RemoteStorage;
import com.scholary.scribe.storage.StorageProperties;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for remote storage.
 *
 * <p>Picks the backend from {@code storage.type}. The S3 client is only built, and the
 * {@code objectstore.*} keys only bound, when S3 is selected.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

  @Configuration
  @ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "s3")
  @EnableConfigurationProperties(ObjectStoreProperties.class)
  static class S3StorageConfig {

    @Bean(destroyMethod = "close")
    public RemoteStorage remoteStorage(ObjectStoreProperties properties) {
      return new S3RemoteStorage(properties);
    }
  }

  @Configuration
  @ConditionalOnProperty(
      prefix = "storage",
      name = "type",
      havingValue = "filesystem",
      matchIfMissing = true)
  static class FileSystemStorageConfig {

    @Bean
    public RemoteStorage remoteStorage(
        StorageProperties storageProperties, PipelineProperties pipelineProperties) {
      Path root =
          storageProperties.root() == null || storageProperties.root().isBlank()
              ? pipelineProperties.workPath().resolve("remote")
              : Path.of(storageProperties.root());
      return new FileSystemRemoteStorage(root);
    }
  }
}
