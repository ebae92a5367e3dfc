package io.recur;

import io.recur.display.Display;
import io.recur.eval.Evaluator;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.parser.Parser;
import java.util.List;
import java.util.stream.Stream;

/**
 * A repetition anchored at its start date.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Recurrence rent = Recurrence.parse("monthly on the 1st", "after 12 times",
 *     SimpleDate.fromYmd(2021, 1, 1));
 * SimpleDate last = rent.last(); // 2022-01-01
 * List<SimpleDate> upcoming = rent.nextN(3);
 * }</pre>
 */
public final class Recurrence {
  private final SimpleDate start;
  private final Repetition repetition;

  private Recurrence(SimpleDate start, Repetition repetition) {
    this.start = start;
    this.repetition = repetition;
  }

  /**
   * Parses a schedule phrase and an end phrase.
   *
   * @param schedule the schedule phrase, e.g. "every 2 weeks on mon, fri"
   * @param end the end phrase, e.g. "after 4 times", or blank for never
   * @param start the first occurrence, also supplying omitted weekdays and days
   * @return the parsed recurrence
   * @throws DateException if either phrase is invalid
   */
  public static Recurrence parse(String schedule, String end, SimpleDate start)
      throws DateException {
    return new Recurrence(start, Parser.parseRepetition(schedule, end, start));
  }

  /**
   * Anchors a repetition at a start date.
   *
   * @param start the first occurrence
   * @param repetition the repetition
   * @return the recurrence
   */
  public static Recurrence of(SimpleDate start, Repetition repetition) {
    if (start == null || repetition == null) {
      throw new IllegalArgumentException("start and repetition must not be null");
    }
    return new Recurrence(start, repetition);
  }

  /**
   * Validates a schedule phrase and an end phrase without throwing.
   *
   * @param schedule the schedule phrase
   * @param end the end phrase
   * @return true if both phrases are valid
   */
  public static boolean validate(String schedule, String end) {
    try {
      // the reference only fills in defaults, any date will do
      Parser.parseRepetition(schedule, end, SimpleDate.MAX);
      return true;
    } catch (DateException e) {
      return false;
    }
  }

  /**
   * Returns the first occurrence.
   *
   * @return the start date
   */
  public SimpleDate start() {
    return start;
  }

  /**
   * Returns the repetition.
   *
   * @return the repetition
   */
  public Repetition repetition() {
    return repetition;
  }

  /**
   * Computes the final occurrence.
   *
   * @return the last occurrence, {@link SimpleDate#MAX} if the recurrence never ends
   */
  public SimpleDate last() {
    return Evaluator.last(start, repetition);
  }

  /**
   * Returns a lazy stream of the occurrences after the start date.
   *
   * @return a stream of occurrences
   */
  public Stream<SimpleDate> occurrences() {
    return Evaluator.occurrences(start, repetition);
  }

  /**
   * Computes up to n occurrences after the start date.
   *
   * @param n the number of occurrences to compute
   * @return the occurrences, fewer than n if the recurrence ends first
   */
  public List<SimpleDate> nextN(int n) {
    return Evaluator.nextN(start, repetition, n);
  }

  /**
   * Checks if a date is the start date or one of the occurrences.
   *
   * @param date the date to check
   * @return true if the recurrence falls on the date
   */
  public boolean matches(SimpleDate date) {
    if (date.equals(start)) {
      return true;
    }
    return occurrences().takeWhile(d -> !d.isAfter(date)).anyMatch(date::equals);
  }

  /**
   * Returns the recurrence as an English phrase.
   *
   * @return e.g. "every 2 weeks on Friday ending after 4 occurrences from 2021-01-01"
   */
  @Override
  public String toString() {
    return "every " + Display.render(repetition) + " from " + start;
  }
}
