package io.recur.model;

/**
 * Sealed interface for recurrence deltas, the rule that turns one occurrence into the next.
 *
 * <p>There are 4 kinds of delta:
 *
 * <ul>
 *   <li>{@link DayDelta} - "every 3 days"
 *   <li>{@link WeekDelta} - "every 2 weeks on mon, wed"
 *   <li>{@link MonthDelta} - "every month on the 15th", "monthly on the second tuesday"
 *   <li>{@link YearDelta} - "annually"
 * </ul>
 */
public sealed interface RepDelta permits DayDelta, WeekDelta, MonthDelta, YearDelta {
  /**
   * Returns the repeat multiplier.
   *
   * @return the number of units between occurrences
   */
  long nth();

  /** Rejects multipliers that would never move a date forward. */
  static void requirePositive(long nth) {
    if (nth < 1) {
      throw new IllegalArgumentException("repeat multiplier must be positive: " + nth);
    }
  }
}
