package dev.schedin.schedule;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Derives the next execution time of a parsed schedule. {@code @once} schedules run at their
 * timestamp; recurring schedules run one interval after the current time. The result depends only
 * on the schedule and the clock, so it can be recomputed from a stored expression at any time.
 */
public class NextRunCalculator {

  private final Clock clock;

  public NextRunCalculator() {
    this(Clock.systemUTC());
  }

  public NextRunCalculator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Instant nextRun(ParsedSchedule schedule) {
    Objects.requireNonNull(schedule, "schedule must not be null");
    var timing = schedule.timing();
    if (timing instanceof Timing.At at) {
      return at.instant();
    } else if (timing instanceof Timing.Interval interval) {
      // postgres timestamptz keeps microseconds
      return now().plusSeconds(interval.seconds());
    } else {
      throw new IllegalStateException("Unknown timing type " + timing);
    }
  }

  /** Current time at storage precision */
  public Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
