package dev.schedin.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The structured form of a scheduling expression. {@code ONCE} schedules carry a {@link
 * Timing.At}; {@code EVERY} and {@code DAILY} schedules carry a {@link Timing.Interval}.
 */
public record ParsedSchedule(Routine routine, Timing timing) {

  public static final long DAILY_SECONDS = Timeframe.DAY.seconds();

  public ParsedSchedule {
    Objects.requireNonNull(routine, "routine must not be null");
    Objects.requireNonNull(timing, "timing must not be null");
    switch (routine) {
      case ONCE -> {
        if (!(timing instanceof Timing.At)) {
          throw new IllegalArgumentException("@once schedules require an absolute timestamp");
        }
      }
      case EVERY, DAILY -> {
        if (!(timing instanceof Timing.Interval)) {
          throw new IllegalArgumentException("Recurring schedules require an interval");
        }
      }
      case INVALID -> throw new IllegalArgumentException("Schedule routine must be valid");
    }
  }

  public static ParsedSchedule once(Instant at) {
    return new ParsedSchedule(Routine.ONCE, new Timing.At(at));
  }

  public static ParsedSchedule every(long seconds) {
    return new ParsedSchedule(Routine.EVERY, new Timing.Interval(seconds));
  }

  public static ParsedSchedule daily() {
    return new ParsedSchedule(Routine.DAILY, new Timing.Interval(DAILY_SECONDS));
  }

  /** Interval in seconds for recurring schedules; empty for {@code @once}. */
  public Optional<Long> intervalSeconds() {
    if (timing instanceof Timing.Interval interval) {
      return Optional.of(interval.seconds());
    }
    return Optional.empty();
  }

  public boolean isRecurring() {
    return routine != Routine.ONCE;
  }
}
