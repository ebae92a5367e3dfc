package io.recur.display;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.model.DayDelta;
import io.recur.model.Duration;
import io.recur.model.MonthDeltaDate;
import io.recur.model.MonthDeltaWeek;
import io.recur.model.RepEnd;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.model.WeekDelta;
import io.recur.model.Weekday;
import io.recur.model.YearDelta;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DisplayTest {

  @Test
  void testDurations() {
    assertEquals("1 day", Display.render(Duration.days(1)));
    assertEquals("3 days", Display.render(Duration.days(3)));
    assertEquals("1 week", Display.render(Duration.weeks(1)));
    assertEquals("2 months", Display.render(Duration.months(2)));
    assertEquals("1 year", Display.render(Duration.years(1)));
    assertEquals("0 years", Display.render(Duration.years(0)));
  }

  @Test
  void testDayAndYear() {
    assertEquals("day", Display.render(new DayDelta(1)));
    assertEquals("4 days", Display.render(new DayDelta(4)));
    assertEquals("year", Display.render(new YearDelta(1)));
    assertEquals("2 years", Display.render(new YearDelta(2)));
  }

  @Test
  void testWeeks() {
    assertEquals("week on Monday", Display.render(new WeekDelta(1, List.of(Weekday.MONDAY))));
    assertEquals(
        "2 weeks on Wednesday, Monday",
        Display.render(new WeekDelta(2, List.of(Weekday.WEDNESDAY, Weekday.MONDAY))));
  }

  @Test
  void testMonthDates() {
    assertEquals("month on the 15th", Display.render(new MonthDeltaDate(1, List.of(15))));
    assertEquals(
        "3 months on the 1st, 2nd, 3rd, 4th",
        Display.render(new MonthDeltaDate(3, List.of(1, 2, 3, 4))));
    assertEquals(
        "month on the 11th, 12th, 13th, 21st, 22nd, 23rd, 31st",
        Display.render(new MonthDeltaDate(1, List.of(11, 12, 13, 21, 22, 23, 31))));
  }

  @Test
  void testMonthWeeks() {
    assertEquals(
        "1 month on the first Monday", Display.render(new MonthDeltaWeek(1, 0, Weekday.MONDAY)));
    assertEquals(
        "6 months on the fifth Friday", Display.render(new MonthDeltaWeek(6, 4, Weekday.FRIDAY)));
  }

  @Test
  void testEnds() {
    assertEquals("never ending", Display.render(RepEnd.never()));
    assertEquals(
        "ending on 2021-06-30", Display.render(RepEnd.until(SimpleDate.fromYmd(2021, 6, 30))));
    assertEquals("ending after 1 occurrence", Display.render(RepEnd.times(1)));
    assertEquals("ending after 0 occurrences", Display.render(RepEnd.times(0)));
  }

  @Test
  void testRepetitionOmitsNeverEnding() {
    assertEquals("day", Display.render(new Repetition(new DayDelta(1), RepEnd.never())));
    assertEquals(
        "2 years ending after 3 occurrences",
        Display.render(new Repetition(new YearDelta(2), RepEnd.times(3))));
  }

  @Test
  void testWeekidNames() {
    assertEquals("first", Display.weekidName(0));
    assertEquals("fifth", Display.weekidName(4));
  }
}
