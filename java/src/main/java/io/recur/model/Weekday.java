package io.recur.model;

import java.util.Optional;

/** Represents a day of the week, Monday first. */
public enum Weekday {
  MONDAY("Monday", "mon"),
  TUESDAY("Tuesday", "tue"),
  WEDNESDAY("Wednesday", "wed"),
  THURSDAY("Thursday", "thu"),
  FRIDAY("Friday", "fri"),
  SATURDAY("Saturday", "sat"),
  SUNDAY("Sunday", "sun");

  private final String displayName;
  private final String abbreviation;

  Weekday(String displayName, String abbreviation) {
    this.displayName = displayName;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the three-letter lowercase abbreviation ("mon", "tue", ...).
   *
   * @return the abbreviation
   */
  public String abbreviation() {
    return abbreviation;
  }

  /**
   * Returns the weekday that follows this one, wrapping from Sunday to Monday.
   *
   * @return the next weekday
   */
  public Weekday next() {
    return values()[(ordinal() + 1) % 7];
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns a Weekday from its display name ("Monday", "Tuesday", ...).
   *
   * @param name the display name
   * @return the weekday if the name matches exactly
   */
  public static Optional<Weekday> fromDisplayName(String name) {
    for (Weekday day : values()) {
      if (day.displayName.equals(name)) {
        return Optional.of(day);
      }
    }
    return Optional.empty();
  }
}
