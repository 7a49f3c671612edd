package io.rerun.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.rerun.ErrorKind;
import io.rerun.RerunException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

public class OffsetEvaluatorTest {
  private static final ZoneId UTC = ZoneId.of("UTC");
  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  @Test
  void testFixedUnitsRoundTrip() throws RerunException {
    List<String> units = List.of("s", "m", "h", "d", "w", "y", "secs", "hours", "weeks", "yrs");
    List<Long> amounts = List.of(0L, 1L, -1L, 7L, -365L, 1000L);
    Instant t = Instant.parse("2019-03-10T06:59:59Z");
    for (String unit : units) {
      for (long n : amounts) {
        Instant there = OffsetEvaluator.applyOffset(n, unit, t, NEW_YORK);
        Instant back = OffsetEvaluator.applyOffset(-n, unit, there, NEW_YORK);
        assertEquals(t, back, n + unit);
      }
    }
  }

  @Test
  void testFixedUnitsIgnoreDst() throws RerunException {
    // 2019-03-10 is 23 hours long in New York, but a day offset is always 86400 seconds
    Instant t = Instant.parse("2019-03-10T04:00:00Z");
    assertEquals(
        t.plus(Duration.ofDays(1)), OffsetEvaluator.applyOffset(1L, "d", t, NEW_YORK));
  }

  @Test
  void testYearIsFixed365Days() throws RerunException {
    Instant t = Instant.parse("2020-01-01T00:00:00Z");
    // 2020 is a leap year, so 365 days lands on Dec 31
    assertEquals(
        Instant.parse("2020-12-31T00:00:00Z"), OffsetEvaluator.applyOffset(1L, "y", t, UTC));
  }

  @Test
  void testMonthClipsToEndOfMonth() throws RerunException {
    assertEquals(
        Instant.parse("2019-02-28T12:00:00Z"),
        OffsetEvaluator.applyOffset(1L, "mon", Instant.parse("2019-01-31T12:00:00Z"), UTC));
    assertEquals(
        Instant.parse("2019-04-30T12:00:00Z"),
        OffsetEvaluator.applyOffset(1L, "month", Instant.parse("2019-03-31T12:00:00Z"), UTC));
    assertEquals(
        Instant.parse("2018-11-30T12:00:00Z"),
        OffsetEvaluator.applyOffset(-1L, "months", Instant.parse("2018-12-31T12:00:00Z"), UTC));
  }

  @Test
  void testMonthKeepsLocalTimeAcrossDst() throws RerunException {
    // 07:00 EST -> 07:00 EDT
    assertEquals(
        Instant.parse("2019-03-10T11:00:00Z"),
        OffsetEvaluator.applyOffset(1L, "mon", Instant.parse("2019-02-10T12:00:00Z"), NEW_YORK));
  }

  @Test
  void testMissingAmountOrUnitIsNoOp() throws RerunException {
    Instant t = Instant.parse("2019-01-15T13:45:30Z");
    assertSame(t, OffsetEvaluator.applyOffset(null, "d", t, UTC));
    assertSame(t, OffsetEvaluator.applyOffset(5L, null, t, UTC));
  }

  @Test
  void testUnknownUnit() {
    RerunException e =
        assertThrows(
            RerunException.class, () -> OffsetEvaluator.applyOffset(1L, "q", Instant.EPOCH, UTC));
    assertEquals(ErrorKind.UNIT, e.kind());
  }

  @Test
  void testOverflowIsCalendarError() {
    RerunException e =
        assertThrows(
            RerunException.class,
            () -> OffsetEvaluator.applyOffset(Long.MAX_VALUE, "w", Instant.EPOCH, UTC));
    assertEquals(ErrorKind.CALENDAR, e.kind());
    assertInstanceOf(ArithmeticException.class, e.getCause());
  }
}
