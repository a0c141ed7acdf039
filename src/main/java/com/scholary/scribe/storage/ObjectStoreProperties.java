package com.scholary.scribe.storage;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bucket the publish stage uploads documents, transcripts and audio to when {@code storage.type}
 * is {@code s3}.
 *
 * <p>Remote folders are key prefixes inside {@link #bucket()}. MinIO and other S3-compatible
 * servers need {@code path-style-access}.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {}
