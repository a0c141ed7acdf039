package com.scholary.scribe.structuring;

/** Turns a raw transcript into markdown-like structured text. */
public interface StructuringService {

  /**
   * Structure a transcript.
   *
   * @param text the transcript text
   * @param template what to produce; sent ahead of the transcript
   * @return structured text, unvalidated
   * @throws StructuringUnavailableException if the service cannot be reached or keeps failing
   */
  String structure(String text, String template);
}
