package io.recur.model;

import io.recur.display.Display;

/**
 * Represents when a recurring schedule stops.
 *
 * @param kind the type of end condition
 * @param date the last allowed date (only used when kind is DATE)
 * @param count the number of repetitions (only used when kind is COUNT)
 */
public record RepEnd(Kind kind, SimpleDate date, long count) {

  private static final RepEnd NEVER = new RepEnd(Kind.NEVER, null, 0);

  /** The type of end condition. */
  public enum Kind {
    /** The schedule never ends. */
    NEVER,
    /** The schedule ends on or before a date. */
    DATE,
    /** The schedule ends after a number of repetitions. */
    COUNT
  }

  /** Validates that the fields match the kind. */
  public RepEnd {
    if (kind == null) {
      throw new IllegalArgumentException("end kind must not be null");
    }
    if (kind == Kind.DATE && date == null) {
      throw new IllegalArgumentException("end date must not be null");
    }
    if (count < 0) {
      throw new IllegalArgumentException("repetition count must not be negative: " + count);
    }
  }

  /**
   * Returns the end condition of a schedule that never ends.
   *
   * @return the never-ending condition
   */
  public static RepEnd never() {
    return NEVER;
  }

  /**
   * Creates an end condition that stops at the last occurrence not after a date.
   *
   * @param date the last allowed date
   * @return a new date end condition
   */
  public static RepEnd until(SimpleDate date) {
    return new RepEnd(Kind.DATE, date, 0);
  }

  /**
   * Creates an end condition that stops after a number of repetitions.
   *
   * @param count the number of repetitions
   * @return a new count end condition
   */
  public static RepEnd times(long count) {
    return new RepEnd(Kind.COUNT, null, count);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
