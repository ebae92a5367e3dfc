package io.recur.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.model.DayDelta;
import io.recur.model.MonthDeltaDate;
import io.recur.model.MonthDeltaWeek;
import io.recur.model.RepDelta;
import io.recur.model.RepEnd;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.model.WeekDelta;
import io.recur.model.Weekday;
import io.recur.model.YearDelta;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Tests for stepping deltas and resolving repetitions. */
public class EvaluatorTest {

  private static SimpleDate date(int y, int m, int d) {
    return SimpleDate.fromYmd(y, m, d);
  }

  // step

  @Test
  void testStepDay() {
    assertEquals(date(2020, 9, 28), Evaluator.step(date(2020, 9, 20), new DayDelta(8)));
    assertEquals(date(2021, 1, 1), Evaluator.step(date(2020, 12, 31), new DayDelta(1)));
  }

  @Test
  void testStepWeekMovesToLastListedDay() {
    WeekDelta delta = new WeekDelta(3, List.of(Weekday.MONDAY));
    assertEquals(date(2020, 10, 12), Evaluator.step(date(2020, 9, 20), delta));
  }

  @Test
  void testStepWeekFromListedDay() {
    // 2020-10-12 is a Monday
    WeekDelta delta = new WeekDelta(1, List.of(Weekday.MONDAY));
    assertEquals(date(2020, 10, 19), Evaluator.step(date(2020, 10, 12), delta));
  }

  @Test
  void testStepWeekUsesLastListedWeekday() {
    WeekDelta delta = new WeekDelta(2, List.of(Weekday.FRIDAY, Weekday.MONDAY));
    assertEquals(date(2020, 10, 5), Evaluator.step(date(2020, 9, 20), delta));

    WeekDelta weekly = new WeekDelta(1, List.of(Weekday.FRIDAY, Weekday.MONDAY));
    assertEquals(date(2020, 9, 28), Evaluator.step(date(2020, 9, 20), weekly));

    WeekDelta calendarOrder = new WeekDelta(2, List.of(Weekday.MONDAY, Weekday.FRIDAY));
    assertEquals(date(2020, 10, 9), Evaluator.step(date(2020, 9, 20), calendarOrder));
  }

  @Test
  void testStepMonthDateClampsToMonthEnd() {
    assertEquals(
        date(2020, 2, 29), Evaluator.step(date(2019, 11, 30), new MonthDeltaDate(4, List.of(31))));
    assertEquals(
        date(2020, 3, 31),
        Evaluator.step(date(2019, 11, 30), new MonthDeltaDate(4, List.of(15, 31))));
  }

  @Test
  void testStepMonthDateBeforeEarliestDay() {
    SimpleDate start = date(2019, 11, 10);
    assertEquals(date(2020, 1, 15), Evaluator.step(start, new MonthDeltaDate(3, List.of(15))));
    assertEquals(
        date(2020, 1, 20), Evaluator.step(start, new MonthDeltaDate(3, List.of(11, 15, 20))));
  }

  @Test
  void testStepMonthDateAfterEarliestDay() {
    SimpleDate start = date(2019, 11, 20);
    assertEquals(date(2020, 2, 15), Evaluator.step(start, new MonthDeltaDate(3, List.of(15))));
    assertEquals(
        date(2020, 2, 25), Evaluator.step(start, new MonthDeltaDate(3, List.of(10, 15, 25))));
  }

  @Test
  void testStepMonthDateWithinMonth() {
    MonthDeltaDate delta = new MonthDeltaDate(1, List.of(15, 20));
    assertEquals(date(2020, 1, 20), Evaluator.step(date(2020, 1, 10), delta));
  }

  @Test
  void testStepMonthDateNeverStaysPut() {
    // the 30th clamps to the 29th in February, which is where it started
    assertEquals(
        date(2020, 3, 30), Evaluator.step(date(2020, 2, 29), new MonthDeltaDate(1, List.of(30))));
  }

  @Test
  void testStepMonthWeekBeforeAnchor() {
    MonthDeltaWeek delta = new MonthDeltaWeek(2, 2, Weekday.MONDAY);
    assertEquals(date(2020, 10, 12), Evaluator.step(date(2020, 9, 1), delta));
  }

  @Test
  void testStepMonthWeekAfterAnchor() {
    MonthDeltaWeek delta = new MonthDeltaWeek(2, 2, Weekday.MONDAY);
    assertEquals(date(2020, 11, 9), Evaluator.step(date(2020, 9, 21), delta));
  }

  @Test
  void testStepMonthWeekZeroAndOneLandOnFirst() {
    // first Monday of September 2020 is the 7th, of October the 5th
    SimpleDate start = date(2020, 9, 1);
    MonthDeltaWeek zero = new MonthDeltaWeek(2, 0, Weekday.MONDAY);
    MonthDeltaWeek one = new MonthDeltaWeek(2, 1, Weekday.MONDAY);
    assertEquals(date(2020, 10, 5), Evaluator.step(start, zero));
    assertEquals(date(2020, 10, 5), Evaluator.step(start, one));
  }

  @Test
  void testStepMonthWeekFourthWeekid() {
    // weekid 4 is three weeks past the first Friday: 2021-01-22, then 2021-02-26
    MonthDeltaWeek delta = new MonthDeltaWeek(1, 4, Weekday.FRIDAY);
    assertEquals(date(2021, 1, 22), Evaluator.step(date(2021, 1, 10), delta));
    assertEquals(date(2021, 2, 26), Evaluator.step(date(2021, 1, 22), delta));
  }

  @Test
  void testStepMonthWeekFirst() {
    // first Tuesday of November 2020 is the 3rd
    MonthDeltaWeek delta = new MonthDeltaWeek(1, 0, Weekday.TUESDAY);
    assertEquals(date(2020, 11, 3), Evaluator.step(date(2020, 10, 20), delta));
  }

  @Test
  void testStepYear() {
    assertEquals(date(2021, 9, 19), Evaluator.step(date(2020, 9, 19), new YearDelta(1)));
    assertEquals(date(2021, 2, 28), Evaluator.step(date(2020, 2, 29), new YearDelta(1)));
  }

  @Test
  void testStepAlwaysAdvances() {
    List<RepDelta> deltas =
        List.of(
            new DayDelta(1),
            new WeekDelta(1, List.of(Weekday.MONDAY, Weekday.SUNDAY)),
            new MonthDeltaDate(1, List.of(1)),
            new MonthDeltaDate(1, List.of(29, 30, 31)),
            new MonthDeltaWeek(1, 0, Weekday.WEDNESDAY),
            new MonthDeltaWeek(1, 4, Weekday.FRIDAY),
            new YearDelta(1));

    SimpleDate day = date(2019, 12, 1);
    for (int i = 0; i < 500; i++) {
      for (RepDelta delta : deltas) {
        SimpleDate next = Evaluator.step(day, delta);
        assertTrue(next.isAfter(day), delta + " from " + day + " gave " + next);
      }
      day = Evaluator.step(day, new DayDelta(1));
    }
  }

  // last

  @Test
  void testLastNeverEnding() {
    Repetition r = new Repetition(new DayDelta(1), RepEnd.never());
    assertEquals(SimpleDate.MAX, Evaluator.last(date(2020, 9, 20), r));
  }

  @Test
  void testLastCount() {
    Repetition r = new Repetition(new DayDelta(1), RepEnd.times(5));
    assertEquals(date(2020, 9, 25), Evaluator.last(date(2020, 9, 20), r));
  }

  @Test
  void testLastZeroCount() {
    Repetition r = new Repetition(new YearDelta(3), RepEnd.times(0));
    assertEquals(date(2020, 9, 20), Evaluator.last(date(2020, 9, 20), r));
  }

  @Test
  void testLastUntilDate() {
    Repetition daily = new Repetition(new DayDelta(1), RepEnd.until(date(2020, 12, 31)));
    assertEquals(date(2020, 12, 31), Evaluator.last(date(2020, 9, 20), daily));

    Repetition quarterly =
        new Repetition(new MonthDeltaDate(3, List.of(15)), RepEnd.until(date(2021, 12, 31)));
    assertEquals(date(2021, 12, 15), Evaluator.last(date(2020, 9, 20), quarterly));
  }

  @Test
  void testLastCountMonthly() {
    Repetition r = new Repetition(new MonthDeltaDate(3, List.of(15)), RepEnd.times(5));
    assertEquals(date(2021, 12, 15), Evaluator.last(date(2020, 9, 20), r));
  }

  @Test
  void testLastEndBeforeStart() {
    Repetition r = new Repetition(new DayDelta(1), RepEnd.until(date(2020, 1, 1)));
    assertEquals(date(2020, 9, 20), Evaluator.last(date(2020, 9, 20), r));
  }

  // occurrences

  @Test
  void testOccurrencesCount() {
    Repetition r = new Repetition(new WeekDelta(1, List.of(Weekday.MONDAY)), RepEnd.times(3));
    List<SimpleDate> dates =
        Evaluator.occurrences(date(2020, 9, 20), r).collect(Collectors.toList());
    assertEquals(List.of(date(2020, 9, 28), date(2020, 10, 5), date(2020, 10, 12)), dates);
  }

  @Test
  void testOccurrencesUntilDateIsInclusive() {
    Repetition r = new Repetition(new DayDelta(7), RepEnd.until(date(2020, 10, 4)));
    List<SimpleDate> dates =
        Evaluator.occurrences(date(2020, 9, 20), r).collect(Collectors.toList());
    assertEquals(List.of(date(2020, 9, 27), date(2020, 10, 4)), dates);
  }

  @Test
  void testOccurrencesNeverEndingIsLazy() {
    Repetition r = new Repetition(new YearDelta(1), RepEnd.never());
    List<SimpleDate> dates =
        Evaluator.occurrences(date(2020, 2, 29), r).limit(3).collect(Collectors.toList());
    assertEquals(List.of(date(2021, 2, 28), date(2022, 2, 28), date(2023, 2, 28)), dates);
  }

  @Test
  void testOccurrencesEndWithLast() {
    SimpleDate start = date(2020, 9, 20);
    Repetition r =
        new Repetition(new MonthDeltaWeek(1, 2, Weekday.THURSDAY), RepEnd.until(date(2021, 6, 1)));
    List<SimpleDate> dates = Evaluator.occurrences(start, r).collect(Collectors.toList());
    assertFalse(dates.isEmpty());
    assertEquals(Evaluator.last(start, r), dates.get(dates.size() - 1));
  }

  @Test
  void testNextN() {
    Repetition r = new Repetition(new DayDelta(1), RepEnd.times(2));
    assertEquals(
        List.of(date(2020, 9, 21), date(2020, 9, 22)), Evaluator.nextN(date(2020, 9, 20), r, 10));
    assertEquals(List.of(date(2020, 9, 21)), Evaluator.nextN(date(2020, 9, 20), r, 1));
    assertTrue(Evaluator.nextN(date(2020, 9, 20), r, 0).isEmpty());
  }
}
