package dev.schedin.exceptions;

import java.sql.SQLException;
import java.util.Objects;

/**
 * {@code SchedinCrudException} is thrown by the job persistence and selection operations. The
 * {@link CrudError} classifies the failure; for storage failures the underlying {@link
 * SQLException} is the cause. Any transaction that was open when the failure happened has been
 * rolled back before this exception is thrown, so the operation must be treated as not having
 * happened.
 */
public class SchedinCrudException extends RuntimeException {
  private final CrudError error;

  public SchedinCrudException(CrudError error, String message) {
    this(error, message, null);
  }

  public SchedinCrudException(CrudError error, String message, Throwable cause) {
    super(formatMessage(error, message, cause), cause);
    this.error = error;
  }

  private static String formatMessage(CrudError error, String message, Throwable cause) {
    Objects.requireNonNull(error, "error must not be null");
    var sb = new StringBuilder(error.reason());
    if (message != null && !message.isEmpty()) {
      sb.append(": ").append(message);
    }
    if (cause instanceof SQLException sqle && sqle.getSQLState() != null) {
      sb.append(" (SQLSTATE ").append(sqle.getSQLState()).append(")");
    }
    return sb.toString();
  }

  /** Classification of the failure */
  public CrudError error() {
    return error;
  }
}
