package io.rerun.backfill;

import io.rerun.RerunException;
import java.util.List;
import java.util.Optional;

/** Source of job definitions and of the control job for a run. */
public interface JobRegistry {
  /**
   * Returns every job definition, in the order the backfill should visit them.
   *
   * @return the job definitions
   * @throws RerunException if the registry cannot be read
   */
  List<JobDefinition> jobs() throws RerunException;

  /**
   * Looks up the control job by its run identifier.
   *
   * @param runId the run identifier
   * @return the control job, or empty if no job has that id
   * @throws RerunException if the registry cannot be read
   */
  Optional<ControlJob> findControlJob(String runId) throws RerunException;
}
