package com.scholary.scribe.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the recording source API.
 *
 * <p>The token may be given with or without its {@code bearer} prefix.
 */
@ConfigurationProperties(prefix = "source")
@Validated
public record SourceProperties(
    @NotBlank String baseUrl,
    String token,
    @Positive int pageSize,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
