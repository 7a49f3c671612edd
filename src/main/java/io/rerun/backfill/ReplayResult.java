package io.rerun.backfill;

import java.time.Instant;

/**
 * The outcome of one completed replay.
 *
 * @param emittedAt when the result was produced
 * @param message human-readable summary
 * @param jobName the replayed job
 * @param missedRunTime the scheduled time that was missed
 * @param missedEarliest the computed start of the time range
 * @param missedLatest the computed end of the time range
 * @param triggerActions whether the replay fired the job's actions
 * @param finished whether the backend reported the replay done
 * @param completionPercentage completion, 0 to 100
 * @param scanCount items scanned by the replay
 * @param eventCount events matched by the replay
 * @param resultCount results produced by the replay
 */
public record ReplayResult(
    Instant emittedAt,
    String message,
    String jobName,
    Instant missedRunTime,
    Instant missedEarliest,
    Instant missedLatest,
    boolean triggerActions,
    boolean finished,
    double completionPercentage,
    long scanCount,
    long eventCount,
    long resultCount) {}
