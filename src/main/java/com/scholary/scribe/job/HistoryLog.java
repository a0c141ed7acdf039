package com.scholary.scribe.job;

import java.time.Instant;
import java.util.List;

/** Append-only log of terminal transitions. Entries are never edited, only purged. */
public interface HistoryLog {

  void append(HistoryEntry entry);

  /** The most recent entries, newest first. */
  List<HistoryEntry> recent(int limit);

  /**
   * Remove every entry older than the cutoff, or every entry when the cutoff is null.
   *
   * @return number of entries removed
   */
  int purge(Instant cutoff);
}
