package io.recur.model;

import io.recur.display.Display;

/**
 * A month-based delta on an ordinal weekday, like "every month on the second tuesday".
 *
 * @param nth the number of months between occurrences
 * @param weekid the zero-indexed ordinal of the weekday (0 = first, 4 = fifth); a step moves
 *     {@code weekid - 1} weeks past the first matching weekday, and not at all for 0
 * @param day the weekday
 */
public record MonthDeltaWeek(long nth, int weekid, Weekday day) implements MonthDelta {
  /** The highest supported weekid (the fifth occurrence). */
  public static final int MAX_WEEKID = 4;

  /** Validates the components. */
  public MonthDeltaWeek {
    RepDelta.requirePositive(nth);
    if (weekid < 0 || weekid > MAX_WEEKID) {
      throw new IllegalArgumentException("weekid out of range: " + weekid);
    }
    if (day == null) {
      throw new IllegalArgumentException("weekday must not be null");
    }
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
