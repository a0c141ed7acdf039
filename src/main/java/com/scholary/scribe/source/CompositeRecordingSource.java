package com.scholary.scribe.source;

import java.io.InputStream;
import java.util.List;

/**
 * Several sources behind one listing.
 *
 * <p>Sources are listed one after another. A page number carries the source's position: page
 * {@code i * PAGES_PER_SOURCE + p} is page {@code p} of source {@code i}. Downloads go to the first
 * source that owns the id.
 */
public class CompositeRecordingSource implements RecordingSource {

  static final int PAGES_PER_SOURCE = 1_000_000;

  private final List<RecordingSource> sources;

  public CompositeRecordingSource(List<RecordingSource> sources) {
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one recording source is required");
    }
    this.sources = List.copyOf(sources);
  }

  @Override
  public RecordingPage listRecordings(int page) {
    int index = page / PAGES_PER_SOURCE;
    if (index >= sources.size()) {
      return new RecordingPage(List.of(), null);
    }

    RecordingPage listing = sources.get(index).listRecordings(page % PAGES_PER_SOURCE);
    Integer next;
    if (listing.hasNext()) {
      next = index * PAGES_PER_SOURCE + listing.nextPage();
    } else if (index + 1 < sources.size()) {
      next = (index + 1) * PAGES_PER_SOURCE;
    } else {
      next = null;
    }
    return new RecordingPage(listing.items(), next);
  }

  @Override
  public InputStream openDownload(String recordingId) {
    for (RecordingSource source : sources) {
      if (source.owns(recordingId)) {
        return source.openDownload(recordingId);
      }
    }
    throw new SourceUnavailableException("No source owns recording " + recordingId);
  }

  @Override
  public boolean owns(String recordingId) {
    return sources.stream().anyMatch(source -> source.owns(recordingId));
  }
}
