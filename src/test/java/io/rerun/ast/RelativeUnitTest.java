package io.rerun.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

public class RelativeUnitTest {

  @Test
  void testOffsetSpellings() {
    assertOffset(RelativeUnit.SECOND, "s", "sec", "secs", "second", "seconds");
    assertOffset(RelativeUnit.MINUTE, "m", "min", "mins", "minute", "minutes");
    assertOffset(RelativeUnit.HOUR, "h", "hr", "hrs", "hour", "hours");
    assertOffset(RelativeUnit.DAY, "d", "day", "days");
    assertOffset(RelativeUnit.WEEK, "w", "wk", "wks", "week", "weeks");
    assertOffset(RelativeUnit.MONTH, "mon", "month", "months");
    assertOffset(RelativeUnit.YEAR, "y", "yr", "yrs", "year", "years");
  }

  @Test
  void testSnapSpellings() {
    assertSnap(RelativeUnit.MINUTE, "m", "min", "minute");
    assertSnap(RelativeUnit.HOUR, "h", "hr", "hour");
    assertSnap(RelativeUnit.DAY, "d", "day");
    assertSnap(RelativeUnit.WEEK, "w", "week");
    assertSnap(RelativeUnit.MONTH, "mon", "month");
    assertSnap(RelativeUnit.YEAR, "y", "yr", "year");
  }

  @Test
  void testContainmentIsPermissive() {
    // any "w" is a week unless "day" or "hour" claims the token first
    assertEquals(Optional.of(RelativeUnit.WEEK), RelativeUnit.forOffset("xwz"));
    assertEquals(Optional.of(RelativeUnit.DAY), RelativeUnit.forOffset("weekday"));
    assertEquals(Optional.of(RelativeUnit.DAY), RelativeUnit.forSnap("weekday"));
    assertEquals(Optional.of(RelativeUnit.HOUR), RelativeUnit.forOffset("xhrx"));
  }

  @Test
  void testOrderDiffersBetweenOffsetAndSnap() {
    // offsets test week before year, snaps test year before week
    assertEquals(Optional.of(RelativeUnit.WEEK), RelativeUnit.forOffset("yrw"));
    assertEquals(Optional.of(RelativeUnit.YEAR), RelativeUnit.forSnap("yrw"));
  }

  @Test
  void testUnknownAndCaseSensitive() {
    assertTrue(RelativeUnit.forOffset("q").isEmpty());
    assertTrue(RelativeUnit.forOffset("D").isEmpty());
    assertTrue(RelativeUnit.forOffset(null).isEmpty());
    assertTrue(RelativeUnit.forSnap("s").isEmpty());
    assertTrue(RelativeUnit.forSnap("sec").isEmpty());
  }

  @Test
  void testFixedLengths() {
    assertEquals(604_800L, RelativeUnit.WEEK.seconds());
    assertEquals(31_536_000L, RelativeUnit.YEAR.seconds());
    assertFalse(RelativeUnit.MONTH.isFixed());
    assertThrows(UnsupportedOperationException.class, RelativeUnit.MONTH::seconds);
  }

  private static void assertOffset(RelativeUnit expected, String... spellings) {
    for (String s : spellings) {
      assertEquals(Optional.of(expected), RelativeUnit.forOffset(s), s);
    }
  }

  private static void assertSnap(RelativeUnit expected, String... spellings) {
    for (String s : spellings) {
      assertEquals(Optional.of(expected), RelativeUnit.forSnap(s), s);
    }
  }
}
