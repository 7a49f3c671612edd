package io.rerun.eval;

import io.rerun.RerunException;
import io.rerun.Span;
import io.rerun.ast.RelativeUnit;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Applies signed offsets to instants.
 *
 * <p>Fixed-length units (seconds through weeks, and the 365-day year) add seconds directly and
 * never consult the time zone. Months are calendar months: the instant is viewed in the zone,
 * moved by whole months with end-of-month clipping (Jan 31 + 1 month = Feb 28 or 29), and
 * converted back.
 */
public final class OffsetEvaluator {
  private OffsetEvaluator() {}

  /**
   * Moves an instant by {@code amount} units.
   *
   * @param amount the signed amount, or null for no offset
   * @param unit the unit letters, or null for no offset
   * @param instant the instant to move
   * @param zone the zone used for calendar-month arithmetic
   * @return the moved instant, or {@code instant} if amount or unit is null
   * @throws RerunException if the unit is unknown or the result is out of range
   */
  public static Instant applyOffset(Long amount, String unit, Instant instant, ZoneId zone)
      throws RerunException {
    if (amount == null || unit == null) {
      return instant;
    }
    return applyOffset(amount, unit, null, null, instant, zone);
  }

  static Instant applyOffset(
      long amount, String unit, Span span, String input, Instant instant, ZoneId zone)
      throws RerunException {
    RelativeUnit resolved =
        RelativeUnit.forOffset(unit)
            .orElseThrow(
                () -> RerunException.unit("no offset unit matches '" + unit + "'", span, input));
    try {
      if (resolved.isFixed()) {
        return instant.plusSeconds(Math.multiplyExact(amount, resolved.seconds()));
      }
      return instant.atZone(zone).plusMonths(amount).toInstant();
    } catch (ArithmeticException | DateTimeException e) {
      throw RerunException.calendar(
          "cannot move " + instant + " by " + amount + " " + unit, e);
    }
  }
}
