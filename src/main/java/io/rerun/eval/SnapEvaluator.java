package io.rerun.eval;

import io.rerun.RerunException;
import io.rerun.Span;
import io.rerun.ast.RelativeUnit;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Truncates an instant down to the start of a unit, in wall-clock terms of a time zone.
 *
 * <p>Day and larger boundaries are local midnight, resolved with {@link
 * LocalDate#atStartOfDay(ZoneId)} so that a midnight inside a DST gap moves to the first valid
 * instant of the day. Weeks start on Monday.
 */
public final class SnapEvaluator {
  private SnapEvaluator() {}

  /**
   * Snaps an instant to the start of the named unit.
   *
   * @param unit the snap unit letters, or null for no snap
   * @param instant the instant to snap
   * @param zone the zone whose wall clock defines the boundaries
   * @return the snapped instant, or {@code instant} when {@code unit} is null
   * @throws RerunException if the unit is not a snap unit
   */
  public static Instant applySnap(String unit, Instant instant, ZoneId zone)
      throws RerunException {
    return applySnap(unit, null, null, instant, zone);
  }

  static Instant applySnap(String unit, Span span, String input, Instant instant, ZoneId zone)
      throws RerunException {
    if (unit == null) {
      return instant;
    }
    RelativeUnit resolved =
        RelativeUnit.forSnap(unit)
            .orElseThrow(
                () -> RerunException.unit("no snap unit matches '" + unit + "'", span, input));
    try {
      return snap(resolved, instant.atZone(zone)).toInstant();
    } catch (DateTimeException e) {
      throw RerunException.calendar("cannot snap " + instant + " to " + unit, e);
    }
  }

  private static ZonedDateTime snap(RelativeUnit unit, ZonedDateTime t) {
    ZoneId zone = t.getZone();
    LocalDate date = t.toLocalDate();
    return switch (unit) {
      case MINUTE -> t.truncatedTo(ChronoUnit.MINUTES);
      case HOUR -> t.truncatedTo(ChronoUnit.HOURS);
      case DAY -> date.atStartOfDay(zone);
      // weekday index: Monday = 0
      case WEEK -> date.minusDays(date.getDayOfWeek().getValue() - 1L).atStartOfDay(zone);
      case MONTH -> date.withDayOfMonth(1).atStartOfDay(zone);
      case YEAR -> date.withDayOfYear(1).atStartOfDay(zone);
      case SECOND -> throw new IllegalArgumentException("not a snap unit: " + unit);
    };
  }
}
