package com.scholary.scribe.transcription;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single segment of transcribed audio, as returned by the Whisper server.
 *
 * @param start segment start in seconds
 * @param end segment end in seconds
 * @param text the spoken text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
