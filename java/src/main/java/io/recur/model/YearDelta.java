package io.recur.model;

import io.recur.display.Display;

/**
 * A year-based delta like "every 2 years" or "annually".
 *
 * @param nth the number of years between occurrences
 */
public record YearDelta(long nth) implements RepDelta {
  /** Validates the multiplier. */
  public YearDelta {
    RepDelta.requirePositive(nth);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
