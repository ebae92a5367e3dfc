package io.recur.eval;

import io.recur.model.DayDelta;
import io.recur.model.Duration;
import io.recur.model.MonthDeltaDate;
import io.recur.model.MonthDeltaWeek;
import io.recur.model.RepDelta;
import io.recur.model.RepEnd;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.model.WeekDelta;
import io.recur.model.Weekday;
import io.recur.model.YearDelta;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Evaluates repetitions to compute occurrences.
 *
 * <h2>One step</h2>
 *
 * <p>{@link #step} applies a delta once:
 *
 * <ul>
 *   <li>Day: add {@code nth} days.
 *   <li>Week: move forward to the last listed weekday (staying put if already on it), then add
 *       {@code nth} weeks.
 *   <li>Month on dates: add {@code nth} months if the current day is on or past the earliest
 *       listed day, else {@code nth - 1}; then land on the latest listed day, clamped to the
 *       month length.
 *   <li>Month on weekday: the anchor is this month's first matching weekday moved on by
 *       {@code weekid - 1} weeks (none for weekid 0); add {@code nth} months if the current day
 *       is on or past the anchor, else {@code nth - 1}; then land on the same position in the
 *       resulting month.
 *   <li>Year: add {@code nth} years.
 * </ul>
 *
 * <p>Every step returns a date strictly after its input.
 *
 * <h2>End conditions</h2>
 *
 * <p>{@link #last} resolves the final occurrence: 9999-12-31 for a schedule that never ends,
 * {@code count} steps for a count, and the last step not after the date for a date.
 */
public final class Evaluator {
  private Evaluator() {}

  /**
   * Computes the occurrence that follows a date.
   *
   * @param date the current occurrence
   * @param delta the recurrence step
   * @return the next occurrence
   */
  public static SimpleDate step(SimpleDate date, RepDelta delta) {
    if (delta instanceof DayDelta d) {
      return date.plus(Duration.days(d.nth()));
    } else if (delta instanceof WeekDelta w) {
      return stepWeek(date, w);
    } else if (delta instanceof MonthDeltaDate md) {
      return stepMonthDate(date, md);
    } else if (delta instanceof MonthDeltaWeek mw) {
      return stepMonthWeek(date, mw);
    } else if (delta instanceof YearDelta y) {
      return date.plus(Duration.years(y.nth()));
    }
    throw new IllegalArgumentException("unknown delta: " + delta.getClass());
  }

  /**
   * Computes the final occurrence of a repetition starting at a date.
   *
   * @param start the first occurrence
   * @param repetition the repetition
   * @return the last occurrence, {@link SimpleDate#MAX} if the repetition never ends
   */
  public static SimpleDate last(SimpleDate start, Repetition repetition) {
    RepEnd end = repetition.end();
    SimpleDate current = start;

    switch (end.kind()) {
      case NEVER -> current = SimpleDate.MAX;
      case COUNT -> {
        for (long i = 0; i < end.count(); i++) {
          current = step(current, repetition.delta());
        }
      }
      case DATE -> {
        while (current.isBefore(end.date())) {
          SimpleDate next = step(current, repetition.delta());
          if (next.isAfter(end.date())) {
            return current;
          }
          current = next;
        }
      }
    }

    return current;
  }

  /**
   * Returns a lazy stream of the occurrences that follow a start date.
   *
   * <p>The start date itself is not included. The stream holds {@code count} dates for a count
   * end, the dates not after the end date for a date end, and is unbounded for a repetition that
   * never ends.
   *
   * @param start the first occurrence (exclusive)
   * @param repetition the repetition
   * @return a stream of occurrences in ascending order
   */
  public static Stream<SimpleDate> occurrences(SimpleDate start, Repetition repetition) {
    RepEnd end = repetition.end();
    Iterator<SimpleDate> iterator =
        new Iterator<>() {
          private SimpleDate current = start;
          private long produced = 0;

          @Override
          public boolean hasNext() {
            return switch (end.kind()) {
              case NEVER -> true;
              case COUNT -> produced < end.count();
              case DATE -> !step(current, repetition.delta()).isAfter(end.date());
            };
          }

          @Override
          public SimpleDate next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            current = step(current, repetition.delta());
            produced++;
            return current;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Computes up to n occurrences that follow a start date.
   *
   * @param start the first occurrence (exclusive)
   * @param repetition the repetition
   * @param n the maximum number of occurrences
   * @return the occurrences, fewer than n if the repetition ends first
   */
  public static List<SimpleDate> nextN(SimpleDate start, Repetition repetition, int n) {
    List<SimpleDate> results = new ArrayList<>(Math.max(0, n));
    occurrences(start, repetition).limit(Math.max(0, n)).forEach(results::add);
    return results;
  }

  private static SimpleDate stepWeek(SimpleDate date, WeekDelta delta) {
    SimpleDate end = advanceTo(date, delta.lastDay());
    return end.plus(Duration.weeks(delta.nth()));
  }

  private static SimpleDate stepMonthDate(SimpleDate date, MonthDeltaDate delta) {
    long months = date.day() >= delta.minDay() ? delta.nth() : delta.nth() - 1;
    SimpleDate end = landOn(date.plus(Duration.months(months)), delta.maxDay());

    // clamped onto the input date, take the next cycle
    if (!end.isAfter(date)) {
      end = landOn(date.plus(Duration.months(delta.nth())), delta.maxDay());
    }
    return end;
  }

  private static SimpleDate landOn(SimpleDate date, int day) {
    return date.withDay(Math.min(day, date.lengthOfMonth()));
  }

  private static SimpleDate stepMonthWeek(SimpleDate date, MonthDeltaWeek delta) {
    SimpleDate anchor = ordinalWeekday(date.withDay(1), delta);

    long months = date.day() >= anchor.day() ? delta.nth() : delta.nth() - 1;
    SimpleDate end = date.plus(Duration.months(months)).withDay(1);
    return ordinalWeekday(end, delta);
  }

  /**
   * Finds the first matching weekday of the month and moves {@code weekid - 1} weeks on; weekid
   * 0 stays on the first one. A missing fifth weekday spills into the next month.
   */
  private static SimpleDate ordinalWeekday(SimpleDate firstOfMonth, MonthDeltaWeek delta) {
    SimpleDate first = advanceTo(firstOfMonth, delta.day());
    return first.plus(Duration.weeks(Math.max(0, delta.weekid() - 1)));
  }

  private static SimpleDate advanceTo(SimpleDate date, Weekday weekday) {
    SimpleDate current = date;
    Weekday currentDay = current.weekday();
    while (currentDay != weekday) {
      current = current.plus(Duration.days(1));
      currentDay = currentDay.next();
    }
    return current;
  }
}
