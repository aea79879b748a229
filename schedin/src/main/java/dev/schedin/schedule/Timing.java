package dev.schedin.schedule;

import java.time.Instant;
import java.util.Objects;

/**
 * Timing payload of a parsed schedule: either a recurring interval, normalized to seconds, or an
 * absolute instant.
 */
public sealed interface Timing permits Timing.Interval, Timing.At {

  record Interval(long seconds) implements Timing {
    public Interval {
      if (seconds < 0) {
        throw new IllegalArgumentException("Interval must not be negative");
      }
    }
  }

  record At(Instant instant) implements Timing {
    public At {
      Objects.requireNonNull(instant, "instant must not be null");
    }
  }
}
