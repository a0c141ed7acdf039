package com.scholary.scribe.stage;

import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;

/**
 * Runs one pipeline stage for one recording.
 *
 * <p>Executors never touch the job store: they read the job snapshot they are given, write their
 * artifact files and report what they produced. Failures are thrown as {@link StageException};
 * anything else thrown is classified by {@link StageFailures}.
 */
public interface StageExecutor {

  Stage stage();

  StageResult run(RecordingJob job);
}
