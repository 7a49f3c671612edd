package io.rerun.backfill;

import java.util.Objects;

/**
 * A scheduled job as stored in the job registry.
 *
 * @param name the job name, matched against the backfill name filter
 * @param cronSchedule the 5-field cron schedule
 * @param earliestPattern the relative-time expression for the start of the job's time range
 * @param latestPattern the relative-time expression for the end of the job's time range
 * @param scheduled whether the job is scheduled
 * @param disabled whether the job is disabled
 */
public record JobDefinition(
    String name,
    String cronSchedule,
    String earliestPattern,
    String latestPattern,
    boolean scheduled,
    boolean disabled) {
  /** Validates required fields. */
  public JobDefinition {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Creates a definition from registry fields, where flags are encoded as "1" and "0".
   *
   * <p>A job counts as scheduled only when its flag is exactly "1", and as enabled only when its
   * disabled flag is exactly "0". Any other value, including null, excludes the job from replay.
   *
   * @param name the job name
   * @param cronSchedule the cron schedule
   * @param earliestPattern the earliest-time expression
   * @param latestPattern the latest-time expression
   * @param isScheduled the scheduled flag
   * @param disabled the disabled flag
   * @return the definition
   */
  public static JobDefinition fromRegistry(
      String name,
      String cronSchedule,
      String earliestPattern,
      String latestPattern,
      String isScheduled,
      String disabled) {
    return new JobDefinition(
        name,
        cronSchedule,
        earliestPattern,
        latestPattern,
        "1".equals(isScheduled),
        !"0".equals(disabled));
  }

  /**
   * Returns true if the job would run on its own schedule.
   *
   * @return scheduled and not disabled
   */
  public boolean isActive() {
    return scheduled && !disabled;
  }
}
