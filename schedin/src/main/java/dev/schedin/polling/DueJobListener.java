package dev.schedin.polling;

import dev.schedin.job.Job;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives the result of each successful poll. */
@FunctionalInterface
public interface DueJobListener {

  void onDueJobs(List<Job> jobs);

  /** Listener that logs each due job and does nothing else. */
  static DueJobListener logging() {
    return LoggingListener.INSTANCE;
  }

  final class LoggingListener implements DueJobListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingListener.class);
    private static final LoggingListener INSTANCE = new LoggingListener();

    private LoggingListener() {}

    @Override
    public void onDueJobs(List<Job> jobs) {
      logger.info("{} job(s) due", jobs.size());
      for (var job : jobs) {
        logger.info(
            "Due: {} ({}) owner {} at {}", job.name(), job.type(), job.userId(), job.nextRunAt());
      }
    }
  }
}
