package dev.schedin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.schedin.exceptions.SchedinScheduleException;
import dev.schedin.exceptions.ScheduleError;
import dev.schedin.job.Job;
import dev.schedin.job.JobRequest;
import dev.schedin.job.JobStatus;
import dev.schedin.schedule.Routine;
import dev.schedin.utils.DBUtils;
import dev.schedin.utils.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SchedinClientTest extends DbSetupTestBase {

  @BeforeEach
  void beforeEach() throws Exception {
    DBUtils.clearTables(dataSource);
  }

  @Test
  public void clientFromConfigRunsMigrationsIntoSchema() {
    var clock = MutableClock.now();
    var clientConfig =
        config
            .withDatabaseSchema("client_schema")
            .withLookahead(Duration.ofSeconds(20))
            .withPollInterval(Duration.ofSeconds(1));

    try (var client = new SchedinClient(clientConfig, clock)) {
      var owner = UUID.randomUUID();
      var request =
          JobRequest.fromJson(
              """
              {"name": "job-X", "schedule": "@every 10 sec", "task": {"name": "report"}}
              """);
      client.insert(request.toDescription(), owner);

      assertEquals(1, client.selectDue().size());
      assertTrue(client.selectDue(Duration.ofSeconds(5)).isEmpty());

      var received = new ArrayList<List<Job>>();
      var poller = client.newPoller(received::add);
      assertEquals(List.of("job-X"), poller.poll().stream().map(Job::name).toList());
      assertEquals(1, received.size());

      assertTrue(client.setStatus(owner, "job-X", JobStatus.DISABLED));
      assertEquals(JobStatus.DISABLED, client.getJob(owner, "job-X").orElseThrow().status());
      assertTrue(client.delete(owner, "job-X"));
      assertTrue(client.listJobs(owner).isEmpty());
    }
  }

  @Test
  public void clientFromCredentials() {
    try (var client = getSchedinClient()) {
      var owner = UUID.randomUUID();
      client.insert(
          JobRequest.fromJson(
                  "{\"name\":\"nightly\",\"schedule\":\"@daily\",\"task\":{\"name\":\"t\"}}")
              .toDescription(),
          owner);
      assertEquals(1, client.listJobs(owner).size());
      assertTrue(client.selectDue(Duration.ofHours(1)).isEmpty());
      assertEquals(1, client.selectDue(Duration.ofDays(1)).size());
    }
  }

  @Test
  public void parseScheduleDoesNotTouchTheDatabase() throws Exception {
    try (var client = getSchedinClient()) {
      assertEquals(Routine.EVERY, client.parseSchedule("@every 10 min").routine());
      var e =
          assertThrows(SchedinScheduleException.class, () -> client.parseSchedule("@hourly"));
      assertEquals(ScheduleError.INVALID_ROUTINE, e.error());
    }
    assertEquals(0, DBUtils.countRows(dataSource, "jobs"));
  }
}
