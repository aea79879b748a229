package dev.schedin.exceptions;

public enum CrudError {
  /** User-provided job data (schedule or payload shape) is invalid */
  VALIDATION("Invalid JSON Parameters"),

  /** A job or payload row could not be inserted */
  INSERTION("Cannot Insert into Database"),

  /** Jobs could not be read */
  READ("Unable to Read from Database"),

  /** A transaction could not be started, executed or committed */
  TRANSACTION("Unable to create Transaction"),

  /** No connection could be obtained from the pool */
  POOLING("Unable to Pool Database");

  private final String reason;

  CrudError(String reason) {
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
