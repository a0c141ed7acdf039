package com.scholary.scribe.job;

import java.time.Instant;

/**
 * A locally stored artifact.
 *
 * @param path absolute path of the file
 * @param sizeBytes exact size in bytes
 * @param fingerprint SHA-256 of the content, lowercase hex
 * @param sourceFingerprint fingerprint of the artifact this one was derived from, or null for audio
 * @param createdAt when the artifact was written
 */
public record Artifact(
    String path, long sizeBytes, String fingerprint, String sourceFingerprint, Instant createdAt) {}
