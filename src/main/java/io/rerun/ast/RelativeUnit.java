package io.rerun.ast;

import java.util.Optional;

/**
 * Time units understood by snaps and offsets.
 *
 * <p>Unit letters are resolved by containment rather than equality, so "hours", "hr" and "xhrx"
 * all name {@link #HOUR}. A token containing "w" anywhere names {@link #WEEK} unless an earlier
 * rule claims it first ("weekday" contains "day"). Offsets and snaps test the rules in different
 * orders; both orders are part of the accepted syntax and must not be reordered.
 */
public enum RelativeUnit {
  SECOND(1L),
  MINUTE(60L),
  HOUR(3_600L),
  DAY(86_400L),
  WEEK(604_800L),
  /** Calendar month. Has no fixed length. */
  MONTH(0L),
  /** A fixed 365-day year, not a calendar year. */
  YEAR(365L * 86_400L);

  private final long seconds;

  RelativeUnit(long seconds) {
    this.seconds = seconds;
  }

  /**
   * Returns the fixed length of this unit in seconds.
   *
   * @return the length in seconds
   * @throws UnsupportedOperationException for {@link #MONTH}
   */
  public long seconds() {
    if (this == MONTH) {
      throw new UnsupportedOperationException("month has no fixed length");
    }
    return seconds;
  }

  /**
   * Returns true if this unit has a fixed length in seconds.
   *
   * @return false only for {@link #MONTH}
   */
  public boolean isFixed() {
    return this != MONTH;
  }

  /**
   * Resolves unit letters used in an offset.
   *
   * @param letters the unit letters
   * @return the unit, or empty if none matches
   */
  public static Optional<RelativeUnit> forOffset(String letters) {
    if (letters == null) {
      return Optional.empty();
    }
    if (letters.equals("s") || letters.contains("sec")) {
      return Optional.of(SECOND);
    }
    if (letters.equals("m") || letters.contains("min")) {
      return Optional.of(MINUTE);
    }
    if (isHour(letters)) {
      return Optional.of(HOUR);
    }
    if (isDay(letters)) {
      return Optional.of(DAY);
    }
    if (letters.contains("w")) {
      return Optional.of(WEEK);
    }
    if (isYear(letters)) {
      return Optional.of(YEAR);
    }
    if (letters.contains("mon")) {
      return Optional.of(MONTH);
    }
    return Optional.empty();
  }

  /**
   * Resolves unit letters used in a snap. Seconds cannot be snapped to.
   *
   * @param letters the unit letters
   * @return the unit, or empty if none matches
   */
  public static Optional<RelativeUnit> forSnap(String letters) {
    if (letters == null) {
      return Optional.empty();
    }
    if (letters.equals("m") || letters.contains("min")) {
      return Optional.of(MINUTE);
    }
    if (isHour(letters)) {
      return Optional.of(HOUR);
    }
    if (isDay(letters)) {
      return Optional.of(DAY);
    }
    if (letters.contains("mon")) {
      return Optional.of(MONTH);
    }
    if (isYear(letters)) {
      return Optional.of(YEAR);
    }
    if (letters.contains("w")) {
      return Optional.of(WEEK);
    }
    return Optional.empty();
  }

  private static boolean isHour(String letters) {
    return letters.equals("h") || letters.contains("hr") || letters.contains("hour");
  }

  private static boolean isDay(String letters) {
    return letters.equals("d") || letters.contains("day");
  }

  private static boolean isYear(String letters) {
    return letters.equals("y") || letters.contains("yr") || letters.contains("year");
  }
}
