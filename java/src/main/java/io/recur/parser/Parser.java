package io.recur.parser;

import io.recur.DateException;
import io.recur.Span;
import io.recur.model.DayDelta;
import io.recur.model.Gregorian;
import io.recur.model.MonthDelta;
import io.recur.model.MonthDeltaDate;
import io.recur.model.MonthDeltaWeek;
import io.recur.model.RepDelta;
import io.recur.model.RepEnd;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.model.WeekDelta;
import io.recur.model.Weekday;
import io.recur.model.YearDelta;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses repetition phrases such as "every 3 weeks on mon, wed", "quarterly" or "after 5 times".
 *
 * <p>Input is matched case-insensitively after trimming and collapsing whitespace. Each grammar
 * is an ordered list of phrases; the first phrase that matches the whole text wins. Weekly and
 * monthly phrases may be followed by an {@code on ...} clause listing weekdays or days of the
 * month. Errors report positions within the normalized text.
 */
public final class Parser {
  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  private static final List<Phrase> DAY_PHRASES =
      List.of(
          Phrase.counted("every (\\d+) days?"),
          Phrase.counted("(\\d+) days?"),
          Phrase.fixed("daily", 1),
          Phrase.fixed("every day", 1));

  private static final List<Phrase> WEEK_PHRASES =
      List.of(
          Phrase.counted("every (\\d+) weeks?"),
          Phrase.counted("(\\d+) weeks?"),
          Phrase.fixed("every week", 1),
          Phrase.fixed("weekly", 1),
          Phrase.fixed("every fortnight", 2),
          Phrase.fixed("fortnightly", 2));

  private static final List<Phrase> MONTH_PHRASES =
      List.of(
          Phrase.counted("every (\\d+) months?"),
          Phrase.counted("(\\d+) months?"),
          Phrase.fixed("every month", 1),
          Phrase.fixed("monthly", 1),
          Phrase.fixed("every quarter", 3),
          Phrase.fixed("quarterly", 3));

  private static final List<Phrase> YEAR_PHRASES =
      List.of(
          Phrase.counted("every (\\d+) years?"),
          Phrase.counted("(\\d+) years?"),
          Phrase.fixed("every year", 1),
          Phrase.fixed("annually", 1),
          Phrase.fixed("yearly", 1));

  /** Ordinal words and their weekid, the index in this list. */
  private static final List<List<String>> ORDINALS =
      List.of(
          List.of("first", "1st"),
          List.of("second", "2nd"),
          List.of("third", "3rd"),
          List.of("fourth", "4th"),
          List.of("fifth", "5th"));

  private static final List<String> COUNT_WORDS = List.of("after", "times", "occurrences", "reps");

  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern DATE = Pattern.compile("(\\d+)-(\\d+)-(\\d+)");

  private static final String ON_CLAUSE = " on ";

  private Parser() {}

  /**
   * Parses a schedule phrase and an end phrase into a repetition.
   *
   * @param schedule the schedule phrase, e.g. "every 2 weeks on friday"
   * @param end the end phrase, e.g. "2021-06-30", "after 10 times" or blank for never
   * @param reference the start date, supplying defaults for omitted weekdays and days
   * @return the parsed repetition
   * @throws DateException if either phrase is invalid
   */
  public static Repetition parseRepetition(String schedule, String end, SimpleDate reference)
      throws DateException {
    return new Repetition(parseDelta(schedule, reference), parseEnd(end));
  }

  /**
   * Parses a schedule phrase of any unit. The unit is chosen by keyword: "year" or "annual",
   * then "month" or "quarter", then "week" or "fortnight", and days otherwise.
   *
   * @param text the schedule phrase
   * @param reference the start date, supplying defaults for omitted weekdays and days
   * @return the parsed delta
   * @throws DateException if the phrase is invalid
   */
  public static RepDelta parseDelta(String text, SimpleDate reference) throws DateException {
    String s = normalize(text);
    if (s.isEmpty()) {
      throw DateException.schedule("empty schedule", new Span(0, 0), s);
    }

    if (s.contains("year") || s.contains("annual")) {
      log.debug("Parsing schedule '{}' as yearly", s);
      return parseYearDelta(s);
    } else if (s.contains("month") || s.contains("quarter")) {
      log.debug("Parsing schedule '{}' as monthly", s);
      return parseMonthDelta(s, reference);
    } else if (s.contains("week") || s.contains("fortnight")) {
      log.debug("Parsing schedule '{}' as weekly", s);
      return parseWeekDelta(s, reference);
    }
    log.debug("Parsing schedule '{}' as daily", s);
    return parseDayDelta(s);
  }

  /**
   * Parses a day phrase: "every N days", "N days", "daily" or "every day".
   *
   * @param text the phrase
   * @return the parsed delta
   * @throws DateException if the phrase is invalid
   */
  public static DayDelta parseDayDelta(String text) throws DateException {
    String s = normalize(text);
    return new DayDelta(matchMultiplier(DAY_PHRASES, s, s));
  }

  /**
   * Parses a week phrase: "every N weeks", "N weeks", "every week", "weekly" or "fortnightly",
   * optionally followed by "on" and a list of weekdays. Without a list the reference date's
   * weekday is used.
   *
   * @param text the phrase
   * @param reference the start date
   * @return the parsed delta
   * @throws DateException if the phrase is invalid
   */
  public static WeekDelta parseWeekDelta(String text, SimpleDate reference) throws DateException {
    String s = normalize(text);
    int onIndex = s.indexOf(ON_CLAUSE);
    String head = onIndex >= 0 ? s.substring(0, onIndex) : s;

    long nth = matchMultiplier(WEEK_PHRASES, head, s);

    if (onIndex < 0) {
      return new WeekDelta(nth, List.of(reference.weekday()));
    }

    String tail = s.substring(onIndex);
    List<Weekday> days = new ArrayList<>();
    for (Weekday day : Weekday.values()) {
      if (tail.contains(day.abbreviation())) {
        days.add(day);
      }
    }
    if (days.isEmpty()) {
      throw DateException.schedule(
          "expected weekdays after 'on'", new Span(onIndex, s.length()), s);
    }
    return new WeekDelta(nth, days);
  }

  /**
   * Parses a month phrase: "every N months", "N months", "every month", "monthly" or
   * "quarterly", optionally followed by "on" and either days of the month ("on the 1st, 15th")
   * or an ordinal weekday ("on the second tuesday"). Without a clause the reference date's day
   * of month is used.
   *
   * @param text the phrase
   * @param reference the start date
   * @return the parsed delta
   * @throws DateException if the phrase is invalid
   */
  public static MonthDelta parseMonthDelta(String text, SimpleDate reference)
      throws DateException {
    String s = normalize(text);
    int onIndex = s.indexOf(ON_CLAUSE);
    String head = onIndex >= 0 ? s.substring(0, onIndex) : s;

    long nth = matchMultiplier(MONTH_PHRASES, head, s);

    if (onIndex < 0) {
      return new MonthDeltaDate(nth, List.of(reference.day()));
    }

    String tail = s.substring(onIndex);
    Optional<Weekday> weekday = findWeekday(tail);
    if (weekday.isPresent()) {
      int weekid = findWeekid(tail);
      if (weekid < 0) {
        throw DateException.schedule(
            "expected first, second, third, fourth or fifth before weekday",
            new Span(onIndex, s.length()),
            s);
      }
      return new MonthDeltaWeek(nth, weekid, weekday.get());
    }

    List<Integer> days = new ArrayList<>();
    Matcher m = NUMBER.matcher(tail);
    while (m.find()) {
      Span span = new Span(m.start(), m.end()).shift(onIndex);
      long day = parseNumber(m.group(), span, s);
      if (day < 1 || day > 31) {
        throw DateException.schedule("day of month out of range", span, s);
      }
      days.add((int) day);
    }
    if (days.isEmpty()) {
      throw DateException.schedule(
          "expected days of the month after 'on'", new Span(onIndex, s.length()), s);
    }
    return new MonthDeltaDate(nth, days);
  }

  /**
   * Parses a year phrase: "every N years", "N years", "every year", "annually" or "yearly".
   *
   * @param text the phrase
   * @return the parsed delta
   * @throws DateException if the phrase is invalid
   */
  public static YearDelta parseYearDelta(String text) throws DateException {
    String s = normalize(text);
    return new YearDelta(matchMultiplier(YEAR_PHRASES, s, s));
  }

  /**
   * Parses an end phrase. Blank text or text containing "never" never ends; text containing
   * "after", "times", "occurrences" or "reps" ends after the first number in it; anything else
   * must contain a YYYY-MM-DD date.
   *
   * @param text the phrase
   * @return the parsed end condition
   * @throws DateException if no count or valid date can be found
   */
  public static RepEnd parseEnd(String text) throws DateException {
    String s = normalize(text);
    if (s.isEmpty() || s.contains("never")) {
      return RepEnd.never();
    }

    for (String word : COUNT_WORDS) {
      if (s.contains(word)) {
        Matcher m = NUMBER.matcher(s);
        if (!m.find()) {
          throw DateException.end("couldn't parse ending schedule", Span.of(s), s);
        }
        Span span = new Span(m.start(), m.end());
        try {
          return RepEnd.times(Long.parseLong(m.group()));
        } catch (NumberFormatException e) {
          throw DateException.end("unparsable integer: " + m.group(), span, s);
        }
      }
    }

    Matcher m = DATE.matcher(s);
    if (!m.find()) {
      throw DateException.end("invalid end date", Span.of(s), s);
    }
    return RepEnd.until(toDate(m, s));
  }

  /**
   * Parses a date written as YYYY-MM-DD.
   *
   * @param text the date text
   * @return the parsed date
   * @throws DateException if the text is malformed or names a day that does not exist
   */
  public static SimpleDate parseDate(String text) throws DateException {
    String s = text == null ? "" : text.trim();
    Matcher m = DATE.matcher(s);
    if (!m.matches()) {
      throw DateException.date("invalid date", Span.of(s), s);
    }
    return toDate(m, s);
  }

  private static SimpleDate toDate(Matcher m, String input) throws DateException {
    Span span = new Span(m.start(), m.end());
    long year;
    long month;
    long day;
    try {
      year = Long.parseLong(m.group(1));
      month = Long.parseLong(m.group(2));
      day = Long.parseLong(m.group(3));
    } catch (NumberFormatException e) {
      throw DateException.date("unparsable integer in date", span, input);
    }

    if (month < 1 || month > 12) {
      throw DateException.date("invalid month", new Span(m.start(2), m.end(2)), input);
    }
    if (day < 1 || day > Gregorian.daysInMonth(year, month)) {
      throw DateException.date("invalid date", span, input);
    }
    return new SimpleDate(year, (int) month, (int) day);
  }

  private static long matchMultiplier(List<Phrase> phrases, String head, String input)
      throws DateException {
    for (Phrase phrase : phrases) {
      Matcher m = phrase.pattern().matcher(head);
      if (!m.matches()) {
        continue;
      }
      if (m.groupCount() == 0) {
        return phrase.fixed();
      }

      Span span = new Span(m.start(1), m.end(1));
      long nth = parseNumber(m.group(1), span, input);
      if (nth == 0) {
        throw DateException.schedule("zero interval", span, input);
      }
      return nth;
    }
    throw DateException.schedule("couldn't parse schedule", Span.of(head), input);
  }

  private static long parseNumber(String digits, Span span, String input) throws DateException {
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw DateException.schedule("unparsable integer: " + digits, span, input);
    }
  }

  private static Optional<Weekday> findWeekday(String clause) {
    for (Weekday day : Weekday.values()) {
      if (clause.contains(day.abbreviation())) {
        return Optional.of(day);
      }
    }
    return Optional.empty();
  }

  private static int findWeekid(String clause) {
    for (int weekid = 0; weekid < ORDINALS.size(); weekid++) {
      for (String word : ORDINALS.get(weekid)) {
        if (clause.contains(word)) {
          return weekid;
        }
      }
    }
    return -1;
  }

  private static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  /** A phrase pattern, either capturing its multiplier or implying a fixed one. */
  private record Phrase(Pattern pattern, long fixed) {
    static Phrase counted(String regex) {
      return new Phrase(Pattern.compile(regex), 0);
    }

    static Phrase fixed(String literal, long nth) {
      return new Phrase(Pattern.compile(Pattern.quote(literal)), nth);
    }
  }
}
