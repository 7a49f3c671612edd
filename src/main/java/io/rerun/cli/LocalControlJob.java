package io.rerun.cli;

import io.rerun.backfill.ControlJob;
import java.util.concurrent.atomic.AtomicBoolean;

/** Control job for a command-line run: running until {@link #cancel()} is called. */
final class LocalControlJob implements ControlJob {
  static final String CANCELLED = "DONE";

  private final String id;
  private final AtomicBoolean running = new AtomicBoolean(true);

  LocalControlJob(String id) {
    this.id = id;
  }

  void cancel() {
    running.set(false);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public void refresh() {}

  @Override
  public String dispatchState() {
    return running.get() ? RUNNING : CANCELLED;
  }
}
