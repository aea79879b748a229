package dev.schedin.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.schedin.utils.MutableClock;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class NextRunCalculatorTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
  private final ScheduleParser parser = new ScheduleParser(clock);
  private final NextRunCalculator calculator = new NextRunCalculator(clock);

  @Test
  public void recurringRunsOneIntervalFromNow() {
    assertEquals(
        Instant.parse("2024-06-01T12:10:00Z"), calculator.nextRun(parser.parse("@every 10 min")));
    assertEquals(
        Instant.parse("2024-06-01T12:00:10Z"), calculator.nextRun(parser.parse("@every 10 sec")));
    assertEquals(Instant.parse("2024-06-02T12:00:00Z"), calculator.nextRun(parser.parse("@daily")));
  }

  @Test
  public void onceRunsAtItsTimestamp() {
    var schedule = parser.parse("@once 2024-07-04 09:30:00");
    assertEquals(Instant.parse("2024-07-04T09:30:00Z"), calculator.nextRun(schedule));

    clock.advance(Duration.ofDays(1));
    assertEquals(Instant.parse("2024-07-04T09:30:00Z"), calculator.nextRun(schedule));
  }

  @Test
  public void recurringFollowsTheClock() {
    var schedule = parser.parse("@every 1 hr");
    var first = calculator.nextRun(schedule);
    clock.advance(Duration.ofMinutes(5));
    assertEquals(first.plus(Duration.ofMinutes(5)), calculator.nextRun(schedule));
  }

  @Test
  public void nowIsTruncatedToMicroseconds() {
    clock.set(Instant.parse("2024-06-01T12:00:00.123456789Z"));
    assertEquals(Instant.parse("2024-06-01T12:00:00.123456Z"), calculator.now());
    assertEquals(
        Instant.parse("2024-06-01T12:00:30.123456Z"),
        calculator.nextRun(parser.parse("@every 30 sec")));
  }

  @Test
  public void nullScheduleIsRejected() {
    assertThrows(NullPointerException.class, () -> calculator.nextRun(null));
  }
}
