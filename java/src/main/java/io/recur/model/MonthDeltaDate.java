package io.recur.model;

import io.recur.display.Display;
import java.util.List;
import java.util.TreeSet;

/**
 * A month-based delta on fixed days of the month, like "every 3 months on the 15th".
 *
 * @param nth the number of months between occurrences
 * @param days the days of the month (1-31), ascending without duplicates
 */
public record MonthDeltaDate(long nth, List<Integer> days) implements MonthDelta {
  /** Validates the multiplier and normalizes the day list. */
  public MonthDeltaDate {
    RepDelta.requirePositive(nth);
    if (days == null || days.isEmpty()) {
      throw new IllegalArgumentException("month delta needs at least one day");
    }
    for (Integer day : days) {
      if (day == null || day < 1 || day > 31) {
        throw new IllegalArgumentException("day of month out of range: " + day);
      }
    }
    days = List.copyOf(new TreeSet<>(days));
  }

  /**
   * Returns the earliest day of the list.
   *
   * @return the smallest day
   */
  public int minDay() {
    return days.get(0);
  }

  /**
   * Returns the latest day of the list.
   *
   * @return the largest day
   */
  public int maxDay() {
    return days.get(days.size() - 1);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
