package com.scholary.scribe.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the local Whisper server used by the transcribe stage.
 *
 * @param baseUrl root URL of the server; the engine posts to {@code /api/v1/transcribe}
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout seconds to wait for a whole recording to be transcribed
 * @param maxRetries attempts per transcription call before the stage fails with TRANSIENT_IO
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
