package io.recur.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for delta, end and duration invariants. */
public class RepDeltaTest {

  @Test
  void testRejectsZeroMultiplier() {
    assertThrows(IllegalArgumentException.class, () -> new DayDelta(0));
    assertThrows(IllegalArgumentException.class, () -> new YearDelta(-1));
    assertThrows(
        IllegalArgumentException.class, () -> new WeekDelta(0, List.of(Weekday.MONDAY)));
    assertThrows(IllegalArgumentException.class, () -> new MonthDeltaDate(0, List.of(1)));
    assertThrows(
        IllegalArgumentException.class, () -> new MonthDeltaWeek(0, 0, Weekday.MONDAY));
  }

  @Test
  void testWeekDeltaKeepsOrderAndDropsDuplicates() {
    WeekDelta delta =
        new WeekDelta(1, List.of(Weekday.SUNDAY, Weekday.MONDAY, Weekday.SUNDAY));
    assertEquals(List.of(Weekday.SUNDAY, Weekday.MONDAY), delta.on());
    assertEquals(Weekday.MONDAY, delta.lastDay());
    assertNotEquals(new WeekDelta(1, List.of(Weekday.MONDAY, Weekday.SUNDAY)), delta);
  }

  @Test
  void testWeekDeltaNeedsDays() {
    assertThrows(IllegalArgumentException.class, () -> new WeekDelta(1, List.of()));
  }

  @Test
  void testMonthDeltaDateSortsDays() {
    MonthDeltaDate delta = new MonthDeltaDate(1, List.of(31, 1, 15, 1));
    assertEquals(List.of(1, 15, 31), delta.days());
    assertEquals(1, delta.minDay());
    assertEquals(31, delta.maxDay());
  }

  @Test
  void testMonthDeltaDateRange() {
    assertThrows(IllegalArgumentException.class, () -> new MonthDeltaDate(1, List.of()));
    assertThrows(IllegalArgumentException.class, () -> new MonthDeltaDate(1, List.of(0)));
    assertThrows(IllegalArgumentException.class, () -> new MonthDeltaDate(1, List.of(32)));
  }

  @Test
  void testMonthDeltaWeekRange() {
    assertThrows(
        IllegalArgumentException.class, () -> new MonthDeltaWeek(1, -1, Weekday.MONDAY));
    assertThrows(
        IllegalArgumentException.class, () -> new MonthDeltaWeek(1, 5, Weekday.MONDAY));
    assertThrows(IllegalArgumentException.class, () -> new MonthDeltaWeek(1, 0, null));
    assertEquals(4, new MonthDeltaWeek(1, 4, Weekday.MONDAY).weekid());
  }

  @Test
  void testRepEnd() {
    assertSame(RepEnd.never(), RepEnd.never());
    assertEquals(RepEnd.Kind.COUNT, RepEnd.times(0).kind());
    assertEquals(
        RepEnd.until(SimpleDate.fromYmd(2021, 1, 1)), RepEnd.until(SimpleDate.fromYmd(2021, 1, 1)));
    assertThrows(IllegalArgumentException.class, () -> RepEnd.times(-1));
    assertThrows(IllegalArgumentException.class, () -> RepEnd.until(null));
  }

  @Test
  void testDuration() {
    assertEquals(new Duration(Duration.Kind.WEEK, 2), Duration.weeks(2));
    assertThrows(IllegalArgumentException.class, () -> Duration.days(-1));
    assertThrows(IllegalArgumentException.class, () -> new Duration(null, 1));
  }

  @Test
  void testRepetitionRequiresParts() {
    assertThrows(IllegalArgumentException.class, () -> new Repetition(null, RepEnd.never()));
    assertThrows(IllegalArgumentException.class, () -> new Repetition(new DayDelta(1), null));
  }

  @Test
  void testToStringUsesDisplay() {
    assertEquals("3 days", new DayDelta(3).toString());
    assertEquals("2 weeks", Duration.weeks(2).toString());
    assertEquals("ending after 1 occurrence", RepEnd.times(1).toString());
    assertEquals(
        "month on the 15th ending on 2021-06-30",
        new Repetition(
                new MonthDeltaDate(1, List.of(15)), RepEnd.until(SimpleDate.fromYmd(2021, 6, 30)))
            .toString());
  }
}
