package io.recur.display;

import io.recur.model.DayDelta;
import io.recur.model.Duration;
import io.recur.model.MonthDeltaDate;
import io.recur.model.MonthDeltaWeek;
import io.recur.model.RepDelta;
import io.recur.model.RepEnd;
import io.recur.model.Repetition;
import io.recur.model.WeekDelta;
import io.recur.model.Weekday;
import io.recur.model.YearDelta;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders durations and repetitions as English phrases, meant to follow "every", as in "every 2
 * weeks on Monday, Friday ending after 4 occurrences".
 */
public final class Display {
  private static final String[] WEEKID_NAMES = {"first", "second", "third", "fourth", "fifth"};

  private Display() {}

  /**
   * Renders a duration, e.g. "1 day" or "3 weeks".
   *
   * @param duration the duration
   * @return the phrase
   */
  public static String render(Duration duration) {
    return duration.amount() + " " + duration.kind().display(duration.amount());
  }

  /**
   * Renders a repetition: its delta, followed by its end condition unless it never ends.
   *
   * @param repetition the repetition
   * @return the phrase
   */
  public static String render(Repetition repetition) {
    String delta = render(repetition.delta());
    if (repetition.end().kind() == RepEnd.Kind.NEVER) {
      return delta;
    }
    return delta + " " + render(repetition.end());
  }

  /**
   * Renders any recurrence delta.
   *
   * @param delta the delta
   * @return the phrase
   */
  public static String render(RepDelta delta) {
    if (delta instanceof DayDelta d) {
      return render(d);
    } else if (delta instanceof WeekDelta w) {
      return render(w);
    } else if (delta instanceof MonthDeltaDate md) {
      return render(md);
    } else if (delta instanceof MonthDeltaWeek mw) {
      return render(mw);
    } else if (delta instanceof YearDelta y) {
      return render(y);
    }
    throw new IllegalArgumentException("unknown delta: " + delta.getClass());
  }

  /**
   * Renders a day delta, e.g. "day" or "3 days".
   *
   * @param delta the delta
   * @return the phrase
   */
  public static String render(DayDelta delta) {
    return delta.nth() == 1 ? "day" : delta.nth() + " days";
  }

  /**
   * Renders a week delta, e.g. "week on Monday" or "2 weeks on Monday, Thursday".
   *
   * @param delta the delta
   * @return the phrase
   */
  public static String render(WeekDelta delta) {
    String unit = delta.nth() == 1 ? "week" : delta.nth() + " weeks";
    return unit + " on " + formatDayList(delta.on());
  }

  /**
   * Renders a fixed-day month delta, e.g. "month on the 1st" or "3 months on the 15th, 31st".
   *
   * @param delta the delta
   * @return the phrase
   */
  public static String render(MonthDeltaDate delta) {
    String unit = delta.nth() == 1 ? "month" : delta.nth() + " months";
    String days =
        delta.days().stream().map(Display::ordinalNumber).collect(Collectors.joining(", "));
    return unit + " on the " + days;
  }

  /**
   * Renders an ordinal-weekday month delta, e.g. "1 month on the second Tuesday".
   *
   * @param delta the delta
   * @return the phrase
   */
  public static String render(MonthDeltaWeek delta) {
    String unit = delta.nth() == 1 ? "month" : "months";
    return String.format(
        "%d %s on the %s %s", delta.nth(), unit, weekidName(delta.weekid()), delta.day());
  }

  /**
   * Renders a year delta, e.g. "year" or "2 years".
   *
   * @param delta the delta
   * @return the phrase
   */
  public static String render(YearDelta delta) {
    return delta.nth() == 1 ? "year" : delta.nth() + " years";
  }

  /**
   * Renders an end condition, e.g. "ending on 2021-12-31".
   *
   * @param end the end condition
   * @return the phrase
   */
  public static String render(RepEnd end) {
    return switch (end.kind()) {
      case NEVER -> "never ending";
      case DATE -> "ending on " + end.date();
      case COUNT ->
          String.format(
              "ending after %d %s", end.count(), end.count() == 1 ? "occurrence" : "occurrences");
    };
  }

  /**
   * Returns the ordinal word for a zero-indexed weekid.
   *
   * @param weekid the weekid (0-4)
   * @return "first" to "fifth"
   */
  public static String weekidName(int weekid) {
    return WEEKID_NAMES[weekid];
  }

  private static String formatDayList(List<Weekday> days) {
    return days.stream().map(Weekday::toString).collect(Collectors.joining(", "));
  }

  private static String ordinalNumber(int n) {
    return n + ordinalSuffix(n);
  }

  private static String ordinalSuffix(int n) {
    int mod100 = n % 100;
    if (mod100 >= 11 && mod100 <= 13) {
      return "th";
    }
    return switch (n % 10) {
      case 1 -> "st";
      case 2 -> "nd";
      case 3 -> "rd";
      default -> "th";
    };
  }
}
