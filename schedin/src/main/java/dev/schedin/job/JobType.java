package dev.schedin.job;

import java.util.Locale;

/** Discriminator of a job's payload, stored lowercase in {@code jobs.job_type}. */
public enum JobType {
  TASK,
  CODE,
  BIN;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobType fromDbValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
