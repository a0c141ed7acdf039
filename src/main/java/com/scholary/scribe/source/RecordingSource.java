package com.scholary.scribe.source;

import java.io.InputStream;

/**
 * Place the recordings come from: the device API or a local drop folder.
 *
 * <p>Implementations throw {@link SourceUnavailableException} when the source cannot be reached or
 * refuses the request.
 */
public interface RecordingSource {

  /**
   * List one page of recordings.
   *
   * @param page zero-based page index
   * @return the page
   */
  RecordingPage listRecordings(int page);

  /**
   * Open the audio content of a recording. The caller closes the stream.
   *
   * @param recordingId the recording id
   * @return stream of the audio bytes
   */
  InputStream openDownload(String recordingId);

  /** Whether ids of this form come from this source. */
  default boolean owns(String recordingId) {
    return true;
  }
}
