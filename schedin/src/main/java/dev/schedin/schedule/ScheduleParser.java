package dev.schedin.schedule;

import dev.schedin.exceptions.ScheduleError;
import dev.schedin.exceptions.SchedinScheduleException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses scheduling expressions.
 *
 * <pre>
 * expression    := routine_token timing
 * routine_token := "@once" | "@every" | "@daily"
 * timing(once)  := date_token time_token     e.g. "2024-01-01 09:00:00" (UTC)
 * timing(every) := integer unit              unit in {sec, min, hr, day}
 * timing(daily) := (empty)
 * </pre>
 *
 * <p>{@code @every} amounts are normalized to seconds, so {@code "@every 1 hr"} and {@code "@every
 * 60 min"} parse to the same schedule. The only side effect is reading the clock to reject {@code
 * @once} timestamps that are not in the future.
 */
public class ScheduleParser {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleParser.class);

  public static final DateTimeFormatter DATE_TIME_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  /** Longest {@code @every} interval; keeps the next run well inside postgres timestamptz range. */
  public static final Duration MAX_INTERVAL = Duration.ofDays(3_652_425); // 10,000 years

  private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

  private final Clock clock;

  public ScheduleParser() {
    this(Clock.systemUTC());
  }

  public ScheduleParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Parse a scheduling expression.
   *
   * @param expression expression such as {@code "@every 10 min"}
   * @return the parsed routine and timing
   * @throws SchedinScheduleException describing the first rule the expression breaks
   */
  public ParsedSchedule parse(String expression) {
    logger.debug("parse schedule '{}'", expression);

    if (expression == null || expression.isBlank()) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_SYNTAX, expression, "Missing 'routine' parameter");
    }

    Iterator<String> tokens = Arrays.asList(expression.trim().split("\\s+")).iterator();
    var routineToken = tokens.next();
    if (!routineToken.startsWith("@")) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_SYNTAX,
          expression,
          "'routine' must start with '@', found '%s'".formatted(routineToken));
    }

    var routine = Routine.fromKeyword(routineToken);
    var schedule =
        switch (routine) {
          case ONCE -> ParsedSchedule.once(dateTime(expression, tokens));
          case EVERY -> ParsedSchedule.every(interval(expression, tokens));
          case DAILY -> ParsedSchedule.daily();
          case INVALID -> throw new SchedinScheduleException(
              ScheduleError.INVALID_ROUTINE,
              expression,
              "'%s' is not one of @once, @every, @daily".formatted(routineToken));
        };

    if (tokens.hasNext()) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_SYNTAX,
          expression,
          "unexpected '%s' after %s schedule".formatted(tokens.next(), routine.keyword()));
    }
    return schedule;
  }

  private Instant dateTime(String expression, Iterator<String> tokens) {
    if (!tokens.hasNext()) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_DATE_TIME_FORMAT, expression, "Missing 'date' field");
    }
    var date = tokens.next();
    if (!tokens.hasNext()) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_DATE_TIME_FORMAT, expression, "Missing 'time' field");
    }
    var time = tokens.next();

    Instant at;
    try {
      at = LocalDateTime.parse(date + " " + time, DATE_TIME_FORMAT).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_DATE_TIME_FORMAT,
          expression,
          "expected YYYY-MM-DD HH:MM:SS, found '%s %s'".formatted(date, time));
    }

    var now = clock.instant();
    if (!at.isAfter(now)) {
      logger.debug("@once timestamp {} is not after current time {}", at, now);
      throw new SchedinScheduleException(
          ScheduleError.ALREADY_ELAPSED, expression, "%s is not after %s".formatted(at, now));
    }
    return at;
  }

  private static long interval(String expression, Iterator<String> tokens) {
    if (!tokens.hasNext()) {
      throw new SchedinScheduleException(ScheduleError.INVALID_TIME, expression, "Missing 'time'");
    }
    var timeToken = tokens.next();

    if (!INTEGER.matcher(timeToken).matches()) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_TIME,
          expression,
          "'%s' must be an integer".formatted(timeToken));
    }

    long amount;
    try {
      amount = Long.parseLong(timeToken);
    } catch (NumberFormatException e) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_TIME, expression, "'%s' is too large".formatted(timeToken));
    }
    if (amount < 0) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_TIME, expression, "'%d' must not be negative".formatted(amount));
    }

    var unitToken = tokens.hasNext() ? tokens.next() : null;
    var timeframe =
        Timeframe.fromKeyword(unitToken)
            .orElseThrow(
                () ->
                    new SchedinScheduleException(
                        ScheduleError.INVALID_TIMEFRAME,
                        expression,
                        "Valid time frames: sec/min/hr/day"));

    long seconds;
    try {
      seconds = timeframe.toSeconds(amount);
    } catch (ArithmeticException e) {
      seconds = Long.MAX_VALUE;
    }
    if (seconds > MAX_INTERVAL.getSeconds()) {
      throw new SchedinScheduleException(
          ScheduleError.INVALID_TIME,
          expression,
          "%d %s is longer than %d days"
              .formatted(amount, timeframe.keyword(), MAX_INTERVAL.toDays()));
    }
    return seconds;
  }
}
