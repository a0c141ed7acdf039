package com.scholary.scribe.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the background recording poller.
 *
 * @param enabled whether the poller runs at all
 * @param interval delay between the end of one poll and the start of the next
 * @param autoProcess whether newly seen and retry-eligible recordings are processed automatically
 * @param maxPages upper bound on listing pages read per poll
 */
@ConfigurationProperties(prefix = "poller")
@Validated
public record PollerProperties(
    boolean enabled, @NotNull Duration interval, boolean autoProcess, @Positive int maxPages) {}
