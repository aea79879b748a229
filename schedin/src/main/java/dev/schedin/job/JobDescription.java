package dev.schedin.job;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;

import org.jspecify.annotations.Nullable;

/**
 * A job to be created: its name (unique per owner), an optional description, an optional
 * scheduling expression and its payload. A job without a schedule is stored disabled.
 */
public record JobDescription(
    String name, @Nullable String description, @Nullable String schedule, Payload payload) {

  public JobDescription(String name, String schedule, Payload payload) {
    this(name, null, schedule, payload);
  }

  public JobDescription withDescription(String v) {
    return new JobDescription(name, v, schedule, payload);
  }

  public JobDescription withSchedule(String v) {
    return new JobDescription(name, description, v, payload);
  }

  /**
   * Checks that the job has a name and exactly one well-formed payload.
   *
   * @throws SchedinCrudException with {@link CrudError#VALIDATION}
   */
  public void validate() {
    if (name == null || name.isBlank()) {
      throw new SchedinCrudException(CrudError.VALIDATION, "Job 'name' is required");
    }
    if (payload == null) {
      throw new SchedinCrudException(
          CrudError.VALIDATION, "Job %s requires one of task, code or bin".formatted(name));
    }
    payload.validate();
  }
}
