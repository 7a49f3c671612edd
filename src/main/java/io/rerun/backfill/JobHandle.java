package io.rerun.backfill;

import io.rerun.RerunException;

/** A replay submitted to the execution backend. Values are as of the last {@link #refresh()}. */
public interface JobHandle {
  /**
   * Returns the backend's identifier for the replay.
   *
   * @return the job id
   */
  String id();

  /**
   * Reloads the job's status from the backend.
   *
   * @throws RerunException if the backend cannot be reached
   */
  void refresh() throws RerunException;

  /**
   * Returns true once the replay has finished.
   *
   * @return whether the replay is done
   */
  boolean isDone();

  /**
   * Returns completion as a fraction.
   *
   * @return progress between 0 and 1
   */
  double doneProgress();

  /**
   * Returns the number of items scanned.
   *
   * @return the scan count
   */
  long scanCount();

  /**
   * Returns the number of events matched.
   *
   * @return the event count
   */
  long eventCount();

  /**
   * Returns the number of results produced.
   *
   * @return the result count
   */
  long resultCount();
}
