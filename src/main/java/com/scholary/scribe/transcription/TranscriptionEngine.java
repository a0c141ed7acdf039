package com.scholary.scribe.transcription;

import java.nio.file.Path;

/**
 * Speech-to-text engine.
 *
 * <p>This abstraction lets us swap the local Whisper server for another engine, or a mock in tests.
 */
public interface TranscriptionEngine {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the audio file to transcribe
   * @param language language hint (ISO 639-1), or null to auto-detect
   * @return the transcript text
   * @throws TranscriptionException if transcription fails
   */
  String transcribe(Path audioFile, String language);
}
