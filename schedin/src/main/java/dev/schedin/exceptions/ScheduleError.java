package dev.schedin.exceptions;

/** The ways a scheduling expression can be rejected. All of them are caller input problems. */
public enum ScheduleError {
  INVALID_SYNTAX("Invalid syntax for 'schedule'"),
  INVALID_ROUTINE("Invalid 'routine'"),
  INVALID_TIME("Invalid 'time'"),
  INVALID_TIMEFRAME("Invalid 'timeframe'"),
  INVALID_DATE_TIME_FORMAT("Invalid DateTime format"),
  ALREADY_ELAPSED("Invalid DateTime: It has already elapsed");

  private final String reason;

  ScheduleError(String reason) {
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
