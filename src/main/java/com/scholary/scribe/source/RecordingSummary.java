package com.scholary.scribe.source;

import java.time.Instant;

/**
 * A recording as listed by the source, before anything is downloaded.
 *
 * @param id the source's stable recording id
 * @param filename display name given on the device
 * @param startTime when the recording started, if the source reports it
 * @param durationMs recording length in milliseconds, 0 if unknown
 */
public record RecordingSummary(String id, String filename, Instant startTime, long durationMs) {}
