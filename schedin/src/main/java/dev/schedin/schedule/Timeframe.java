package dev.schedin.schedule;

import java.util.Optional;

/** Units accepted by {@code @every}, with their multiplier to seconds. */
public enum Timeframe {
  SEC("sec", 1L),
  MIN("min", 60L),
  HR("hr", 60L * 60L),
  DAY("day", 60L * 60L * 24L);

  private final String keyword;
  private final long seconds;

  Timeframe(String keyword, long seconds) {
    this.keyword = keyword;
    this.seconds = seconds;
  }

  public String keyword() {
    return keyword;
  }

  public long seconds() {
    return seconds;
  }

  /**
   * Converts an amount of this unit to seconds.
   *
   * @throws ArithmeticException if the result overflows a long
   */
  public long toSeconds(long amount) {
    return Math.multiplyExact(amount, seconds);
  }

  public static Optional<Timeframe> fromKeyword(String token) {
    for (var tf : values()) {
      if (tf.keyword.equals(token)) {
        return Optional.of(tf);
      }
    }
    return Optional.empty();
  }
}
