package io.recur.model;

import io.recur.display.Display;

/**
 * A day-based delta like "every 3 days".
 *
 * @param nth the number of days between occurrences
 */
public record DayDelta(long nth) implements RepDelta {
  /** Validates the multiplier. */
  public DayDelta {
    RepDelta.requirePositive(nth);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
