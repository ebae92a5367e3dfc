package io.recur.model;

import io.recur.display.Display;

/**
 * A complete recurring schedule: how to step from one occurrence to the next, and when to stop.
 *
 * @param delta the recurrence step
 * @param end the end condition
 */
public record Repetition(RepDelta delta, RepEnd end) {
  /** Validates the components. */
  public Repetition {
    if (delta == null) {
      throw new IllegalArgumentException("delta must not be null");
    }
    if (end == null) {
      throw new IllegalArgumentException("end must not be null");
    }
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
