package io.rerun.backfill;

import io.rerun.RerunException;

/** Submits replays to the system that executes jobs. */
public interface DispatchBackend {
  /**
   * Starts a replay of {@code job} with the given time range.
   *
   * @param job the job to replay
   * @param request the replay parameters
   * @return a handle for polling the replay
   * @throws RerunException if the backend refuses or cannot be reached
   */
  JobHandle submit(JobDefinition job, DispatchRequest request) throws RerunException;
}
