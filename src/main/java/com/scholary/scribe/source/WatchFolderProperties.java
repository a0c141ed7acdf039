package com.scholary.scribe.source;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the local drop folder.
 *
 * @param enabled whether audio files dropped into the folder are picked up
 * @param dir the folder; created on startup when missing
 */
@ConfigurationProperties(prefix = "watch")
@Validated
public record WatchFolderProperties(boolean enabled, String dir) {}
