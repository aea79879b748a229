package dev.schedin.polling;

import dev.schedin.Constants;
import dev.schedin.job.Job;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically selects due jobs and hands them to a {@link DueJobListener}. The poller does not run
 * jobs and does not retry: a failed selection is logged and the next tick proceeds as usual.
 */
public class DuePoller implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(DuePoller.class);

  private final DueJobSource source;
  private final Duration interval;
  private final Duration lookahead;
  private final DueJobListener listener;
  private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();
  private final AtomicLong failures = new AtomicLong();

  public DuePoller(DueJobSource source) {
    this(source, Constants.DEFAULT_POLL_INTERVAL, Constants.DEFAULT_LOOKAHEAD);
  }

  public DuePoller(DueJobSource source, Duration interval, Duration lookahead) {
    this(source, interval, lookahead, DueJobListener.logging());
  }

  public DuePoller(
      DueJobSource source, Duration interval, Duration lookahead, DueJobListener listener) {
    this.source = Objects.requireNonNull(source, "source must not be null");
    this.interval = Objects.requireNonNull(interval, "interval must not be null");
    this.lookahead = Objects.requireNonNull(lookahead, "lookahead must not be null");
    this.listener = Objects.requireNonNull(listener, "listener must not be null");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
    if (lookahead.isNegative()) {
      throw new IllegalArgumentException("lookahead must not be negative: " + lookahead);
    }
  }

  public void start() {
    if (this.scheduler.get() == null) {
      var scheduler =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                var thread = new Thread(r, "schedin-due-poller");
                thread.setDaemon(true);
                return thread;
              });
      if (this.scheduler.compareAndSet(null, scheduler)) {
        logger.debug("Starting due poller, interval {} lookahead {}", interval, lookahead);
        scheduler.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
      } else {
        scheduler.shutdown();
      }
    }
  }

  public void stop() {
    var scheduler = this.scheduler.getAndSet(null);
    if (scheduler != null) {
      List<Runnable> notRun = scheduler.shutdownNow();
      logger.debug("Shutting down due poller. Tasks not run {}", notRun.size());
    }
  }

  public boolean isRunning() {
    return scheduler.get() != null;
  }

  @Override
  public void close() {
    stop();
  }

  /** Runs one selection and passes the result to the listener. */
  public List<Job> poll() {
    var jobs = source.selectDue(lookahead);
    listener.onDueJobs(jobs);
    return jobs;
  }

  /** Number of ticks whose selection or listener failed. */
  public long failureCount() {
    return failures.get();
  }

  private void tick() {
    if (scheduler.get() == null) {
      return;
    }
    try {
      poll();
    } catch (Exception e) {
      failures.incrementAndGet();
      logger.error("Due job poll failed", e);
    }
  }
}
