package com.scholary.scribe.structuring;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the structuring (LLM messages) API. */
@ConfigurationProperties(prefix = "structuring")
@Validated
public record StructuringProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int maxTokens,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
