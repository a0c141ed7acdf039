package com.scholary.scribe.job;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of one {@link RecordingJob} per recording id.
 *
 * <p>Writes are atomic: after a crash a reader sees either the previous or the new record, never a
 * partial one. Returned jobs are copies, so callers may mutate them freely.
 */
public interface JobStore {

  Optional<RecordingJob> findById(String id);

  /** All known jobs, oldest first. */
  List<RecordingJob> findAll();

  void save(RecordingJob job);

  /**
   * Save the job unless one with the same id exists.
   *
   * @return the stored job, either the existing one or the one just saved
   */
  RecordingJob saveIfAbsent(RecordingJob job);
}
