package io.recur.model;

/** Proleptic Gregorian calendar primitives. */
public final class Gregorian {
  /** Days before the first of each month in a common year. */
  private static final int[] MONTH_OFFSETS = {
    0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334
  };

  /** Earliest year {@link #weekdayOf} can resolve. */
  public static final long FIRST_WEEKDAY_YEAR = 1700;

  private Gregorian() {}

  /**
   * Returns whether the year has a February 29th.
   *
   * @param year the year
   * @return true for leap years
   */
  public static boolean isLeapYear(long year) {
    if (year % 400 == 0) {
      return true;
    } else if (year % 100 == 0) {
      return false;
    }
    return year % 4 == 0;
  }

  /**
   * Returns the number of days in a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the length of the month in days
   * @throws IllegalArgumentException if month is outside 1-12
   */
  public static int daysInMonth(long year, long month) {
    if (month == 2) {
      return isLeapYear(year) ? 29 : 28;
    }
    if (month == 1 || month == 3 || month == 5 || month == 7 || month == 8 || month == 10
        || month == 12) {
      return 31;
    }
    if (month == 4 || month == 6 || month == 9 || month == 11) {
      return 30;
    }
    throw new IllegalArgumentException("month out of range: " + month);
  }

  /**
   * Returns the day of the week of a date.
   *
   * <p>Counts days from 1700-01-01, a Friday, with a leap year correction for the years in
   * between. Dates before 1700 are not supported.
   *
   * @param date the date
   * @return the weekday
   * @throws IllegalArgumentException if the year is before 1700
   */
  public static Weekday weekdayOf(SimpleDate date) {
    if (date.year() < FIRST_WEEKDAY_YEAR) {
      throw new IllegalArgumentException("weekday unavailable before 1700: " + date);
    }

    long afterFeb = date.month() > 2 ? 0 : 1;
    long aux = date.year() - FIRST_WEEKDAY_YEAR - afterFeb;
    long day =
        (4 // 1700-01-01 is a friday
                + (aux + afterFeb) * 365
                + (aux / 4 - aux / 100 + (aux + 100) / 400)
                + MONTH_OFFSETS[date.month() - 1]
                + (date.day() - 1))
            % 7;

    return Weekday.values()[(int) day];
  }
}
