package com.scholary.scribe.storage;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Selects the remote storage backend.
 *
 * <p>{@code filesystem} keeps "remote" folders under {@code root}; {@code s3} uses the
 * {@code objectstore.*} settings.
 */
@ConfigurationProperties(prefix = "storage")
@Validated
public record StorageProperties(@NotNull Type type, String root) {

  public enum Type {
    S3,
    FILESYSTEM
  }
}
