package dev.schedin.job;

import java.util.Locale;

/** Lifecycle state of a job, stored lowercase in {@code jobs.job_status}. */
public enum JobStatus {
  /** Waiting for its next run; always has a next run time */
  SCHEDULED,

  /** Picked up by a runner */
  RUNNING,

  /** Never selected for execution */
  DISABLED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobStatus fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
