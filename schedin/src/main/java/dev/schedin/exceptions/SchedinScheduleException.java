package dev.schedin.exceptions;

import java.util.Objects;

/**
 * {@code SchedinScheduleException} is thrown when a scheduling expression such as {@code "@every
 * 10 min"} cannot be parsed, or describes a moment that has already passed. The {@link
 * ScheduleError} tells which rule was broken; the message is suitable for showing to the user who
 * typed the expression.
 */
public class SchedinScheduleException extends RuntimeException {
  private final ScheduleError error;
  private final String expression;

  public SchedinScheduleException(ScheduleError error, String expression, String detail) {
    super(
        detail == null || detail.isEmpty()
            ? Objects.requireNonNull(error).reason()
            : "%s: %s".formatted(Objects.requireNonNull(error).reason(), detail));
    this.error = error;
    this.expression = expression;
  }

  /** The rule the expression broke */
  public ScheduleError error() {
    return error;
  }

  /** The rejected expression, as supplied (may be null) */
  public String expression() {
    return expression;
  }
}
