package com.scholary.scribe.source;

import java.util.List;

/**
 * One page of a recording listing.
 *
 * @param items recordings on this page
 * @param nextPage index of the following page, or null on the last page
 */
public record RecordingPage(List<RecordingSummary> items, Integer nextPage) {

  public boolean hasNext() {
    return nextPage != null;
  }
}
