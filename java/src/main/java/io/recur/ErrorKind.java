package io.recur;

/** The part of the input that could not be understood. */
public enum ErrorKind {
  /** Schedule error - the repetition phrase matches no known pattern. */
  SCHEDULE("schedule"),
  /** End error - the repetition end phrase is neither a count nor a date. */
  END("end"),
  /** Date error - a date is malformed or out of range. */
  DATE("date");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
