package dev.schedin.internal;

import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Named points inside the persistence workflow where tests can inject behavior, such as failing a
 * statement after earlier statements of the same transaction succeeded.
 */
public final class DebugTriggers {

  private DebugTriggers() {}

  public static final class DebugAction {
    private SQLException sqlExceptionToThrow;

    public SQLException getSqlExceptionToThrow() {
      return this.sqlExceptionToThrow;
    }

    public DebugAction setSqlExceptionToThrow(SQLException sqle) {
      this.sqlExceptionToThrow = sqle;
      return this;
    }
  }

  private static final Map<String, DebugAction> pointTriggers = new ConcurrentHashMap<>();
  private static final Map<String, AtomicLong> hitCounts = new ConcurrentHashMap<>();

  /** Counts the hit and throws the exception configured for {@code name}, if any. */
  public static void debugTriggerPoint(String name) throws SQLException {
    hitCounts.computeIfAbsent(name, n -> new AtomicLong()).incrementAndGet();

    DebugAction action = pointTriggers.get(name);
    if (action == null) {
      return;
    }

    SQLException sqle = action.getSqlExceptionToThrow();
    if (sqle != null) {
      throw sqle;
    }
  }

  public static void setDebugTrigger(String name, DebugAction action) {
    pointTriggers.put(name, action);
  }

  public static void clearDebugTriggers() {
    pointTriggers.clear();
  }

  public static long getHitCount(String name) {
    var count = hitCounts.get(name);
    return count == null ? 0 : count.get();
  }

  // ----- Constants (Should use in just one place in the code) -----

  public static final String DEBUG_TRIGGER_PAYLOAD_INSERT = "DEBUG_TRIGGER_PAYLOAD_INSERT";
  public static final String DEBUG_TRIGGER_JOB_COMMIT = "DEBUG_TRIGGER_JOB_COMMIT";
  public static final String DEBUG_TRIGGER_DELETE_COMMIT = "DEBUG_TRIGGER_DELETE_COMMIT";
  public static final String DEBUG_TRIGGER_STATUS_COMMIT = "DEBUG_TRIGGER_STATUS_COMMIT";
}
