package io.rerun.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.rerun.ErrorKind;
import io.rerun.RerunException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SnapEvaluatorTest {
  private static final List<String> UNITS = List.of("m", "h", "d", "w", "mon", "y");
  private static final List<ZoneId> ZONES =
      List.of(ZoneId.of("UTC"), ZoneId.of("America/New_York"), ZoneId.of("Asia/Kolkata"));
  private static final List<Instant> INSTANTS =
      List.of(
          Instant.parse("2019-01-15T13:45:30Z"),
          Instant.parse("2019-03-10T07:30:00Z"),
          Instant.parse("2019-11-03T05:59:59Z"),
          Instant.parse("2020-02-29T23:59:59.999Z"),
          Instant.parse("1970-01-01T00:00:00Z"));

  @Test
  void testSnapIsIdempotent() throws RerunException {
    for (ZoneId zone : ZONES) {
      for (String unit : UNITS) {
        for (Instant t : INSTANTS) {
          Instant once = SnapEvaluator.applySnap(unit, t, zone);
          Instant twice = SnapEvaluator.applySnap(unit, once, zone);
          assertEquals(once, twice, unit + " " + t + " " + zone);
          assertFalse(once.isAfter(t), "snap moved forward: " + unit + " " + t + " " + zone);
        }
      }
    }
  }

  @Test
  void testNullUnitIsNoOp() throws RerunException {
    Instant t = Instant.parse("2019-01-15T13:45:30.5Z");
    assertSame(t, SnapEvaluator.applySnap(null, t, ZoneId.of("UTC")));
  }

  @Test
  void testMinuteDropsFractions() throws RerunException {
    Instant t = Instant.parse("2019-01-15T13:45:30.5Z");
    assertEquals(
        Instant.parse("2019-01-15T13:45:00Z"), SnapEvaluator.applySnap("m", t, ZoneId.of("UTC")));
  }

  @Test
  void testHourInHalfHourZone() throws RerunException {
    // 13:45Z is 19:15 in Kolkata (+05:30); the local hour starts at 19:00 = 13:30Z
    Instant t = Instant.parse("2019-01-15T13:45:00Z");
    assertEquals(
        Instant.parse("2019-01-15T13:30:00Z"),
        SnapEvaluator.applySnap("h", t, ZoneId.of("Asia/Kolkata")));
  }

  @Test
  void testWeekFromSundayGoesBackSixDays() throws RerunException {
    Instant sunday = Instant.parse("2019-01-20T23:00:00Z");
    assertEquals(
        Instant.parse("2019-01-14T00:00:00Z"),
        SnapEvaluator.applySnap("w", sunday, ZoneId.of("UTC")));
  }

  @Test
  void testWeekFromMondayStaysOnMonday() throws RerunException {
    Instant monday = Instant.parse("2019-01-14T08:00:00Z");
    assertEquals(
        Instant.parse("2019-01-14T00:00:00Z"),
        SnapEvaluator.applySnap("week", monday, ZoneId.of("UTC")));
  }

  @Test
  void testYearUsesLocalCalendar() throws RerunException {
    // still 2018 in New York
    Instant t = Instant.parse("2019-01-01T03:00:00Z");
    assertEquals(
        Instant.parse("2018-01-01T05:00:00Z"),
        SnapEvaluator.applySnap("y", t, ZoneId.of("America/New_York")));
  }

  @Test
  void testUnknownSnapUnit() {
    RerunException e =
        assertThrows(
            RerunException.class,
            () -> SnapEvaluator.applySnap("s", Instant.EPOCH, ZoneId.of("UTC")));
    assertEquals(ErrorKind.UNIT, e.kind());
    assertTrue(e.span().isEmpty());
  }
}
