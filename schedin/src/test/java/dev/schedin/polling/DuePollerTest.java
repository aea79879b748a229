package dev.schedin.polling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;
import dev.schedin.job.Job;
import dev.schedin.job.JobStatus;
import dev.schedin.job.JobType;
import dev.schedin.job.Payload;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class DuePollerTest {

  private static Job job(String name) {
    return new Job(
        UUID.randomUUID(),
        UUID.randomUUID(),
        name,
        null,
        JobType.TASK,
        "@every 10 sec",
        10L,
        Instant.now().plusSeconds(10),
        Instant.now(),
        0,
        0,
        JobStatus.SCHEDULED,
        new Payload.Task("t"));
  }

  @Test
  public void pollPassesLookaheadAndHandsJobsToListener() {
    var seen = new ArrayList<Duration>();
    var jobs = List.of(job("a"), job("b"));
    var received = new ArrayList<Job>();

    var poller =
        new DuePoller(
            lookahead -> {
              seen.add(lookahead);
              return jobs;
            },
            Duration.ofSeconds(1),
            Duration.ofSeconds(45),
            received::addAll);

    assertSame(jobs, poller.poll());
    assertEquals(List.of(Duration.ofSeconds(45)), seen);
    assertEquals(jobs, received);
  }

  @Test
  public void failedTicksAreLoggedAndPollingContinues() throws Exception {
    var calls = new AtomicInteger();
    var latch = new CountDownLatch(3);
    var delivered = Collections.synchronizedList(new ArrayList<List<Job>>());

    DueJobSource source =
        lookahead -> {
          int call = calls.incrementAndGet();
          if (call == 1) {
            throw new SchedinCrudException(CrudError.READ, "database unavailable");
          }
          return List.of(job("j" + call));
        };

    try (var poller =
        new DuePoller(
            source,
            Duration.ofMillis(20),
            Duration.ofSeconds(60),
            j -> {
              delivered.add(j);
              latch.countDown();
            })) {
      poller.start();
      assertTrue(poller.isRunning());
      assertTrue(latch.await(5, TimeUnit.SECONDS));
      assertEquals(1, poller.failureCount());
    }

    assertTrue(delivered.size() >= 3);
  }

  @Test
  public void stopHaltsPolling() throws Exception {
    var calls = new AtomicInteger();
    var started = new CountDownLatch(1);
    var poller =
        new DuePoller(
            lookahead -> {
              calls.incrementAndGet();
              started.countDown();
              return List.of();
            },
            Duration.ofMillis(10),
            Duration.ZERO,
            jobs -> {});

    poller.start();
    poller.start();
    assertTrue(started.await(5, TimeUnit.SECONDS));
    poller.stop();
    assertFalse(poller.isRunning());

    Thread.sleep(50);
    int after = calls.get();
    Thread.sleep(100);
    assertEquals(after, calls.get());
  }

  @Test
  public void invalidArgumentsAreRejected() {
    DueJobSource source = lookahead -> List.of();
    assertThrows(
        IllegalArgumentException.class,
        () -> new DuePoller(source, Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DuePoller(source, Duration.ofSeconds(1), Duration.ofSeconds(-1)));
    assertThrows(NullPointerException.class, () -> new DuePoller(null));
  }

  @Test
  public void loggingListenerAcceptsJobs() {
    DueJobListener.logging().onDueJobs(List.of(job("logged")));
    DueJobListener.logging().onDueJobs(List.of());
  }
}
