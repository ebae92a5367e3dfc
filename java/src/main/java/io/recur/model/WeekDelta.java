package io.recur.model;

import io.recur.display.Display;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A week-based delta like "every 2 weeks on monday, thursday".
 *
 * <p>A step moves forward to the last weekday in {@link #on()} and then by {@code nth} weeks.
 *
 * @param nth the number of weeks between occurrences
 * @param on the weekdays in the order given, without duplicates
 */
public record WeekDelta(long nth, List<Weekday> on) implements RepDelta {
  /** Validates the multiplier and drops repeated weekdays. */
  public WeekDelta {
    RepDelta.requirePositive(nth);
    if (on == null || on.isEmpty()) {
      throw new IllegalArgumentException("week delta needs at least one weekday");
    }
    on = List.copyOf(new LinkedHashSet<>(on));
  }

  /**
   * Returns the weekday a step first moves to.
   *
   * @return the last weekday of the list
   */
  public Weekday lastDay() {
    return on.get(on.size() - 1);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
