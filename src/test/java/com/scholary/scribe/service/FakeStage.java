package com.scholary.scribe.service;

import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.job.Stage;
import com.scholary.scribe.stage.StageExecutor;
import com.scholary.scribe.stage.StageResult;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Stage executor with swappable behaviour that counts its runs. */
final class FakeStage implements StageExecutor {

  private final Stage stage;
  private final AtomicInteger runs = new AtomicInteger();
  private volatile Function<RecordingJob, StageResult> behavior;

  FakeStage(Stage stage, Function<RecordingJob, StageResult> behavior) {
    this.stage = stage;
    this.behavior = behavior;
  }

  void behave(Function<RecordingJob, StageResult> behavior) {
    this.behavior = behavior;
  }

  int runs() {
    return runs.get();
  }

  @Override
  public Stage stage() {
    return stage;
  }

  @Override
  public StageResult run(RecordingJob job) {
    runs.incrementAndGet();
    return behavior.apply(job);
  }
}
