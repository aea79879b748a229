package dev.schedin.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class JobCommandTest extends PostgresTestBase {

  static final String DATABASE = "job_cmd_test";

  @BeforeAll
  static void migrate() {
    CommandResult.checkExecute(concat(new String[] {"migrate"}, dbArgs(DATABASE)));
  }

  private static CommandResult job(String... args) {
    return CommandResult.execute(concat(concat(new String[] {"job"}, args), dbArgs(DATABASE)));
  }

  @Test
  public void createListGetDelete() {
    var owner = UUID.randomUUID().toString();
    var json =
        """
        {"name": "job-X", "description": "report", "schedule": "@every 10 sec",
         "task": {"name": "report"}}
        """;

    var result = job("create", "-o", owner, json);
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().startsWith("Created job job-X"), result.stdout());

    result = job("list", "-o", owner);
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("\"name\" : \"job-X\""), result.stdout());
    assertTrue(result.stdout().contains("\"interval\" : 10"), result.stdout());

    result = job("get", "job-X", "-o", owner);
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("\"status\" : \"SCHEDULED\""), result.stdout());

    result = job("delete", "job-X", "-o", owner);
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("Deleted job job-X"));

    result = job("delete", "job-X", "-o", owner);
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("does not exist"));

    result = job("get", "job-X", "-o", owner);
    assertEquals(SchedinCommand.EXIT_FAILURE, result.exitCode());
  }

  @Test
  public void createFromFile(@TempDir Path dir) throws Exception {
    var owner = UUID.randomUUID().toString();
    var file = dir.resolve("job.json");
    Files.writeString(
        file,
        """
        {"name": "from-file", "schedule": "@daily",
         "bin": {"path": "/usr/local/bin/backup", "cmd": "--full"}}
        """);

    var result = job("create", "-o", owner, "-f", file.toString());
    assertEquals(0, result.exitCode(), result.stderr());

    result = job("get", "from-file", "-o", owner);
    assertTrue(result.stdout().contains("\"path\" : \"/usr/local/bin/backup\""), result.stdout());
  }

  @Test
  public void invalidRequestsFail() {
    var owner = UUID.randomUUID().toString();

    var result = job("create", "-o", owner, "{\"name\": \"bad\", \"schedule\": \"@daily\"}");
    assertEquals(SchedinCommand.EXIT_FAILURE, result.exitCode());
    assertTrue(result.stderr().contains("Invalid JSON Parameters"), result.stderr());

    result =
        job(
            "create",
            "-o",
            owner,
            "{\"name\": \"bad\", \"schedule\": \"@hourly\", \"task\": {\"name\": \"t\"}}");
    assertEquals(SchedinCommand.EXIT_FAILURE, result.exitCode());
    assertTrue(result.stderr().contains("Invalid 'routine'"), result.stderr());

    var json = "{\"name\": \"dup\", \"schedule\": \"@daily\", \"task\": {\"name\": \"t\"}}";
    assertEquals(0, job("create", "-o", owner, json).exitCode());
    result = job("create", "-o", owner, json);
    assertEquals(SchedinCommand.EXIT_FAILURE, result.exitCode());
    assertTrue(result.stderr().contains("already exists"), result.stderr());
  }

  @Test
  public void disableEnableAndDue() {
    var owner = UUID.randomUUID().toString();
    var json =
        "{\"name\": \"due-soon\", \"schedule\": \"@every 45 sec\", \"task\": {\"name\": \"t\"}}";
    assertEquals(0, job("create", "-o", owner, json).exitCode());

    var result = job("due", "-l", "120");
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("due-soon"), result.stdout());

    result = job("disable", "due-soon", "-o", owner);
    assertEquals(0, result.exitCode(), result.stderr());
    assertFalse(job("due", "-l", "120").stdout().contains("due-soon"));

    result = job("enable", "due-soon", "-o", owner);
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("is now scheduled"));
    assertTrue(job("due", "-l", "120").stdout().contains("due-soon"));

    result =
        CommandResult.execute(
            concat(new String[] {"poll", "--once", "-l", "120"}, dbArgs(DATABASE)));
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("due-soon"), result.stdout());

    result = job("due", "-l", "9223372036854775807");
    assertEquals(SchedinCommand.EXIT_FAILURE, result.exitCode());
    assertTrue(result.stderr().contains("lookahead must not exceed"), result.stderr());

    result = job("enable", "missing", "-o", owner);
    assertEquals(SchedinCommand.EXIT_FAILURE, result.exitCode());
  }
}
