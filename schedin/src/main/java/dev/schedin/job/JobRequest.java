package dev.schedin.job;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;

import java.util.ArrayList;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Job creation request as it arrives over the wire, with one optional field per payload type.
 *
 * <pre>
 * {
 *   "name": "job-Y",
 *   "description": "description_Y",
 *   "schedule": "@every 10 min",
 *   "code": { "src": "base64-encoded-function", "lang": "python", "cmd": "python file.py" }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRequest(
    String name,
    @Nullable String description,
    @Nullable String schedule,
    Payload.@Nullable Task task,
    Payload.@Nullable Code code,
    Payload.@Nullable Bin bin) {

  private static final ObjectMapper mapper = new ObjectMapper();

  public static JobRequest fromJson(String json) {
    Objects.requireNonNull(json, "json must not be null");
    try {
      return mapper.readValue(json, JobRequest.class);
    } catch (JsonProcessingException e) {
      throw new SchedinCrudException(CrudError.VALIDATION, e.getOriginalMessage(), e);
    }
  }

  /**
   * Converts the request to a {@link JobDescription}.
   *
   * @throws SchedinCrudException with {@link CrudError#VALIDATION} unless exactly one of task,
   *     code and bin is present
   */
  public JobDescription toDescription() {
    var payloads = new ArrayList<Payload>();
    if (task != null) payloads.add(task);
    if (code != null) payloads.add(code);
    if (bin != null) payloads.add(bin);

    if (payloads.size() != 1) {
      throw new SchedinCrudException(
          CrudError.VALIDATION,
          "Job %s must have exactly one of task, code or bin, found %d"
              .formatted(name, payloads.size()));
    }
    return new JobDescription(name, description, schedule, payloads.get(0));
  }
}
