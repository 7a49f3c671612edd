package io.rerun.backfill;

import io.rerun.RerunException;
import java.util.Objects;

/** Tells the backfill run whether it may continue. */
@FunctionalInterface
public interface ControlSignal {
  /**
   * Returns true while the run should keep going.
   *
   * @return whether the run is still wanted
   * @throws RerunException if the signal's source cannot be read
   */
  boolean isActive() throws RerunException;

  /**
   * Returns a signal that refreshes {@code job} and is active while its state is {@link
   * ControlJob#RUNNING}.
   *
   * @param job the control job
   * @return the signal
   */
  static ControlSignal of(ControlJob job) {
    Objects.requireNonNull(job, "job");
    return () -> {
      job.refresh();
      return ControlJob.RUNNING.equals(job.dispatchState());
    };
  }
}
