package io.rerun.backfill;

import java.time.Instant;
import java.util.Objects;

/**
 * The period during which scheduled runs were missed.
 *
 * <p>Occurrences are searched strictly after {@code start} and accepted up to and including
 * {@code end}.
 *
 * @param start the start of the outage
 * @param end the end of the outage
 */
public record OutageWindow(Instant start, Instant end) {
  /** Validates the window bounds. */
  public OutageWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("outage end " + end + " is before start " + start);
    }
  }

  /**
   * Returns true if an occurrence at {@code runTime} falls within the window's upper bound.
   *
   * @param runTime the scheduled run time
   * @return whether runTime is not after the end
   */
  public boolean accepts(Instant runTime) {
    return !runTime.isAfter(end);
  }
}
