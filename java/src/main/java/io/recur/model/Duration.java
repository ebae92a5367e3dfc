package io.recur.model;

import io.recur.display.Display;

/**
 * A calendar-relative offset in a single unit. The amount is never negative; direction comes
 * from {@link SimpleDate#plus} or {@link SimpleDate#minus}.
 *
 * @param kind the calendar unit
 * @param amount the number of units
 */
public record Duration(Kind kind, long amount) {

  /** The calendar unit of a duration. */
  public enum Kind {
    DAY("day", "days"),
    WEEK("week", "weeks"),
    MONTH("month", "months"),
    YEAR("year", "years");

    private final String singular;
    private final String plural;

    Kind(String singular, String plural) {
      this.singular = singular;
      this.plural = plural;
    }

    /**
     * Returns the unit name for the given amount.
     *
     * @param amount the amount
     * @return the singular name for 1, the plural otherwise
     */
    public String display(long amount) {
      return amount == 1 ? singular : plural;
    }
  }

  /** Validates the components. */
  public Duration {
    if (kind == null) {
      throw new IllegalArgumentException("duration kind must not be null");
    }
    if (amount < 0) {
      throw new IllegalArgumentException("duration must not be negative: " + amount);
    }
  }

  /**
   * Creates a duration of days.
   *
   * @param n the number of days
   * @return a new duration
   */
  public static Duration days(long n) {
    return new Duration(Kind.DAY, n);
  }

  /**
   * Creates a duration of weeks.
   *
   * @param n the number of weeks
   * @return a new duration
   */
  public static Duration weeks(long n) {
    return new Duration(Kind.WEEK, n);
  }

  /**
   * Creates a duration of months.
   *
   * @param n the number of months
   * @return a new duration
   */
  public static Duration months(long n) {
    return new Duration(Kind.MONTH, n);
  }

  /**
   * Creates a duration of years.
   *
   * @param n the number of years
   * @return a new duration
   */
  public static Duration years(long n) {
    return new Duration(Kind.YEAR, n);
  }

  @Override
  public String toString() {
    return Display.render(this);
  }
}
