package io.rerun.backfill;

import java.time.Instant;

/**
 * Parameters of a replay submitted to the execution backend.
 *
 * @param runTime the missed scheduled time being replayed
 * @param earliest the start of the replay's time range
 * @param latest the end of the replay's time range
 * @param triggerActions whether the replay should fire the job's actions
 */
public record DispatchRequest(
    Instant runTime, Instant earliest, Instant latest, boolean triggerActions) {}
