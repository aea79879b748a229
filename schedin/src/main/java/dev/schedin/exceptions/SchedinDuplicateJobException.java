package dev.schedin.exceptions;

import java.util.UUID;

/**
 * {@code SchedinDuplicateJobException} is thrown when a job is inserted for an owner that already
 * has a job with the same name. Job names are unique per owner; nothing from the rejected insert
 * was stored.
 */
public class SchedinDuplicateJobException extends SchedinCrudException {
  private final UUID ownerId;
  private final String jobName;

  public SchedinDuplicateJobException(UUID ownerId, String jobName, Throwable cause) {
    super(
        CrudError.INSERTION,
        "Job %s already exists for owner %s".formatted(jobName, ownerId),
        cause);
    this.ownerId = ownerId;
    this.jobName = jobName;
  }

  /** Owner for which the insert was attempted */
  public UUID ownerId() {
    return ownerId;
  }

  /** The job name that is already taken */
  public String jobName() {
    return jobName;
  }
}
