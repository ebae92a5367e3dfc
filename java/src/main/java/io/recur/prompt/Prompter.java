package io.recur.prompt;

import io.recur.DateException;
import io.recur.model.Repetition;
import io.recur.model.SimpleDate;
import io.recur.parser.Parser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks for a start date and a repetition on a character stream.
 *
 * <p>Each question is written to the output and answered by one line of input. An exhausted
 * input counts as a blank answer. The streams are not closed.
 *
 * <pre>{@code
 * Prompter prompter = new Prompter(reader, writer);
 * SimpleDate start = prompter.readStartDate();
 * Optional<Repetition> repetition = prompter.readRepetition(start);
 * }</pre>
 */
public final class Prompter {
  private static final Logger log = LoggerFactory.getLogger(Prompter.class);

  static final String START_PROMPT = "start date (yyyy-mm-dd, blank for today): ";
  static final String SCHEDULE_PROMPT = "repetition schedule (blank for none): ";
  static final String END_PROMPT = "repetition end (blank for none): ";

  private final BufferedReader in;
  private final PrintWriter out;
  private final Clock clock;

  /**
   * Creates a prompter whose "today" follows the system clock.
   *
   * @param in the answers
   * @param out where questions are written
   */
  public Prompter(BufferedReader in, PrintWriter out) {
    this(in, out, Clock.systemDefaultZone());
  }

  /**
   * Creates a prompter.
   *
   * @param in the answers
   * @param out where questions are written
   * @param clock the clock supplying today's date for a blank start date
   */
  public Prompter(BufferedReader in, PrintWriter out, Clock clock) {
    if (in == null || out == null || clock == null) {
      throw new IllegalArgumentException("in, out and clock must not be null");
    }
    this.in = in;
    this.out = out;
    this.clock = clock;
  }

  /**
   * Asks for the start date.
   *
   * @return the date entered, or today for a blank answer
   * @throws IOException if the input cannot be read
   * @throws DateException if the answer is not a valid YYYY-MM-DD date
   */
  public SimpleDate readStartDate() throws IOException, DateException {
    String answer = ask(START_PROMPT);
    if (answer.isEmpty()) {
      SimpleDate today = today();
      log.debug("No start date entered, using today {}", today);
      return today;
    }
    SimpleDate start = Parser.parseDate(answer);
    log.debug("Read start date {}", start);
    return start;
  }

  /**
   * Asks for a repetition schedule and, unless it is blank, its end.
   *
   * @param start the start date, supplying defaults for omitted weekdays and days
   * @return the repetition, empty for a blank schedule
   * @throws IOException if the input cannot be read
   * @throws DateException if the schedule or the end is invalid
   */
  public Optional<Repetition> readRepetition(SimpleDate start)
      throws IOException, DateException {
    String schedule = ask(SCHEDULE_PROMPT);
    if (schedule.isEmpty()) {
      log.debug("No repetition schedule entered");
      return Optional.empty();
    }
    String end = ask(END_PROMPT);
    Repetition repetition = Parser.parseRepetition(schedule, end, start);
    log.debug("Read repetition '{}' starting {}", repetition, start);
    return Optional.of(repetition);
  }

  private String ask(String question) throws IOException {
    out.print(question);
    out.flush();
    String line = in.readLine();
    return line == null ? "" : line.trim();
  }

  private SimpleDate today() {
    LocalDate now = LocalDate.now(clock);
    return new SimpleDate(now.getYear(), now.getMonthValue(), now.getDayOfMonth());
  }
}
