package io.rerun.backfill;

import io.rerun.RerunException;

/** The job that initiated the backfill run; the run lives only as long as it does. */
public interface ControlJob {
  /** State reported while the control job is alive. */
  String RUNNING = "RUNNING";

  /**
   * Returns the control job's run identifier.
   *
   * @return the run id
   */
  String id();

  /**
   * Reloads the job's state from the backend.
   *
   * @throws RerunException if the backend cannot be reached
   */
  void refresh() throws RerunException;

  /**
   * Returns the dispatch state as of the last refresh, e.g. "RUNNING", "FINALIZING", "DONE".
   *
   * @return the dispatch state
   */
  String dispatchState();
}
