package io.recur.model;

/**
 * A single day of the proleptic Gregorian calendar, without time of day.
 *
 * @param year the year (0 or later)
 * @param month the month (1-12)
 * @param day the day of the month (1 to the length of the month)
 */
public record SimpleDate(long year, int month, int day) implements Comparable<SimpleDate> {

  /** The latest representable date, used as the last occurrence of a never ending schedule. */
  public static final SimpleDate MAX = new SimpleDate(9999, 12, 31);

  /** Validates that the day exists in the calendar. */
  public SimpleDate {
    if (year < 0) {
      throw new IllegalArgumentException("year out of range: " + year);
    }
    if (month < 1 || month > 12) {
      throw new IllegalArgumentException("month out of range: " + month);
    }
    if (day < 1 || day > Gregorian.daysInMonth(year, month)) {
      throw new IllegalArgumentException(
          String.format("day out of range for %04d-%02d: %d", year, month, day));
    }
  }

  /**
   * Creates a date from its components.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of the month
   * @return a new date
   */
  public static SimpleDate fromYmd(long year, int month, int day) {
    return new SimpleDate(year, month, day);
  }

  /**
   * Returns the day of the week of this date.
   *
   * @return the weekday
   * @see Gregorian#weekdayOf(SimpleDate)
   */
  public Weekday weekday() {
    return Gregorian.weekdayOf(this);
  }

  /**
   * Returns the number of days in this date's month.
   *
   * @return the length of the month
   */
  public int lengthOfMonth() {
    return Gregorian.daysInMonth(year, month);
  }

  /**
   * Returns a copy of this date with the day of month changed.
   *
   * @param newDay the day of the month
   * @return a new date in the same month
   */
  public SimpleDate withDay(int newDay) {
    return new SimpleDate(year, month, newDay);
  }

  /**
   * Adds a duration to this date.
   *
   * <p>Days and weeks are carried over month ends until the day fits. Months and years are added
   * to their own field. The resulting day is clamped to the length of the resulting month, so
   * 2020-01-31 plus one month is 2020-02-29.
   *
   * @param duration the duration to add
   * @return the later date
   */
  public SimpleDate plus(Duration duration) {
    long y = year;
    long m = month;
    long d = day;

    switch (duration.kind()) {
      case DAY -> d = Math.addExact(d, duration.amount());
      case WEEK -> d = Math.addExact(d, Math.multiplyExact(duration.amount(), 7));
      case MONTH -> m = Math.addExact(m, duration.amount());
      case YEAR -> y = Math.addExact(y, duration.amount());
    }

    while (true) {
      long extraYears = m / 12;
      long relativeMonth = m % 12;

      if (relativeMonth == 0) {
        extraYears -= 1;
        relativeMonth += 12;
      }

      y += extraYears;
      m = relativeMonth;

      // an unchanged day means only month or year moved, clamped below
      if (d == day || d <= Gregorian.daysInMonth(y, m)) {
        break;
      }
      d -= Gregorian.daysInMonth(y, m);
      m += 1;
    }

    int clamped = (int) Math.min(d, Gregorian.daysInMonth(y, m));
    return new SimpleDate(y, (int) m, clamped);
  }

  /**
   * Subtracts a duration from this date.
   *
   * <p>Days and weeks are taken away one day at a time, borrowing from the previous month when
   * the day reaches zero. Months and years are subtracted from their own field and the day is
   * clamped. Subtraction does not always undo {@link #plus}: 2019-01-31 plus one month is
   * 2019-02-28, and that minus one month is 2019-01-28.
   *
   * @param duration the duration to subtract
   * @return the earlier date
   * @throws IllegalArgumentException if the result would fall before year 0
   */
  public SimpleDate minus(Duration duration) {
    long y = year;
    long m = month;
    long d = day;

    long monthsToSub = 0;
    long daysToSub = 0;
    switch (duration.kind()) {
      case DAY -> daysToSub = duration.amount();
      case WEEK -> daysToSub = Math.multiplyExact(duration.amount(), 7);
      case MONTH -> monthsToSub = duration.amount();
      case YEAR -> y -= duration.amount();
    }

    for (long i = 0; i < daysToSub; i++) {
      d -= 1;
      if (d == 0) {
        m -= 1;
        if (m == 0) {
          y -= 1;
          m = 12;
        }
        d = Gregorian.daysInMonth(y, m);
      }
    }

    for (long i = 0; i < monthsToSub; i++) {
      m -= 1;
      if (m == 0) {
        y -= 1;
        m = 12;
      }
    }

    int clamped = (int) Math.min(d, Gregorian.daysInMonth(y, m));
    return new SimpleDate(y, (int) m, clamped);
  }

  /**
   * Checks if this date is after the given date.
   *
   * @param other the other date
   * @return true if this date is strictly later
   */
  public boolean isAfter(SimpleDate other) {
    return compareTo(other) > 0;
  }

  /**
   * Checks if this date is before the given date.
   *
   * @param other the other date
   * @return true if this date is strictly earlier
   */
  public boolean isBefore(SimpleDate other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(SimpleDate other) {
    if (year != other.year) {
      return Long.compare(year, other.year);
    } else if (month != other.month) {
      return Integer.compare(month, other.month);
    }
    return Integer.compare(day, other.day);
  }

  /** Returns the date as YYYY-MM-DD. */
  @Override
  public String toString() {
    return String.format("%04d-%02d-%02d", year, month, day);
  }
}
