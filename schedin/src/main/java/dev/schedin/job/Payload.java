package dev.schedin.job;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;

import java.util.Base64;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/** What a job runs. Every job has exactly one payload, stored in the table of its type. */
public sealed interface Payload permits Payload.Task, Payload.Code, Payload.Bin {

  JobType type();

  /**
   * Checks the payload's fields.
   *
   * @throws SchedinCrudException with {@link CrudError#VALIDATION} if a field is missing or
   *     malformed
   */
  void validate();

  /** A reference to a named, pre-registered unit of work. */
  record Task(@JsonProperty("name") String name) implements Payload {
    @Override
    public JobType type() {
      return JobType.TASK;
    }

    @Override
    public void validate() {
      requireText(name, "task.name");
    }
  }

  /** Inline source code, base64 encoded, plus the command that runs it. */
  record Code(
      @JsonProperty("src") String source,
      @JsonProperty("lang") String language,
      @JsonProperty("cmd") String command)
      implements Payload {
    @Override
    public JobType type() {
      return JobType.CODE;
    }

    @Override
    public void validate() {
      requireText(source, "code.src");
      requireText(language, "code.lang");
      requireText(command, "code.cmd");
      try {
        Base64.getDecoder().decode(source);
      } catch (IllegalArgumentException e) {
        throw new SchedinCrudException(
            CrudError.VALIDATION, "Source Code must be base64-encoded", e);
      }
    }

    public byte[] decodedSource() {
      return Base64.getDecoder().decode(source);
    }
  }

  /** A reference to an external binary, with an optional command line. */
  record Bin(@JsonProperty("path") String path, @JsonProperty("cmd") @Nullable String command)
      implements Payload {
    @Override
    public JobType type() {
      return JobType.BIN;
    }

    @Override
    public void validate() {
      requireText(path, "bin.path");
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new SchedinCrudException(CrudError.VALIDATION, "'%s' is required".formatted(field));
    }
  }
}
