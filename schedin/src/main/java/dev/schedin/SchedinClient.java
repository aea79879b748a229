package dev.schedin;

import dev.schedin.config.SchedinConfig;
import dev.schedin.database.JobDatabase;
import dev.schedin.job.Job;
import dev.schedin.job.JobDescription;
import dev.schedin.job.JobStatus;
import dev.schedin.migrations.MigrationManager;
import dev.schedin.polling.DueJobListener;
import dev.schedin.polling.DuePoller;
import dev.schedin.schedule.ParsedSchedule;
import dev.schedin.schedule.ScheduleParser;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for applications that store and select scheduled jobs. A client owns a connection
 * pool and must be closed.
 */
public class SchedinClient implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(SchedinClient.class);

  private final JobDatabase jobDatabase;
  private final ScheduleParser parser;
  private final Duration pollInterval;
  private final Duration lookahead;

  /**
   * Construct a SchedinClient, by providing database access credentials
   *
   * @param url JDBC URL
   * @param user Database user
   * @param password Database password
   */
  public SchedinClient(String url, String user, String password) {
    this(url, user, password, null);
  }

  /**
   * Construct a SchedinClient, by providing database access credentials
   *
   * @param url JDBC URL
   * @param user Database user
   * @param password Database password
   * @param schema Database schema holding the job tables
   */
  public SchedinClient(String url, String user, String password, String schema) {
    this(JobDatabase.createDataSource(url, user, password, 0, 0), schema);
  }

  /**
   * Construct a SchedinClient, by providing a configured data source
   *
   * @param dataSource Data source; closed when the client is closed
   */
  public SchedinClient(HikariDataSource dataSource) {
    this(dataSource, null);
  }

  public SchedinClient(HikariDataSource dataSource, String schema) {
    this(dataSource, schema, Clock.systemUTC());
  }

  public SchedinClient(HikariDataSource dataSource, String schema, Clock clock) {
    this(
        new JobDatabase(dataSource, schema, clock),
        new ScheduleParser(clock),
        Constants.DEFAULT_POLL_INTERVAL,
        Constants.DEFAULT_LOOKAHEAD);
  }

  /**
   * Construct a SchedinClient from a configuration. Schema migrations run first when {@link
   * SchedinConfig#migrate()} is set.
   */
  public SchedinClient(SchedinConfig config) {
    this(config, Clock.systemUTC());
  }

  public SchedinClient(SchedinConfig config, Clock clock) {
    this(
        openDatabase(Objects.requireNonNull(config, "config must not be null"), clock),
        new ScheduleParser(clock),
        config.pollInterval(),
        config.lookahead());
  }

  private SchedinClient(
      JobDatabase jobDatabase, ScheduleParser parser, Duration pollInterval, Duration lookahead) {
    this.jobDatabase = jobDatabase;
    this.parser = parser;
    this.pollInterval = pollInterval;
    this.lookahead = lookahead;
  }

  private static JobDatabase openDatabase(SchedinConfig config, Clock clock) {
    if (config.migrate()) {
      logger.debug("Running migrations for {}", config);
      MigrationManager.runMigrations(config);
    }
    return new JobDatabase(JobDatabase.createDataSource(config), config.databaseSchema(), clock);
  }

  @Override
  public void close() {
    jobDatabase.close();
  }

  /**
   * Parse a scheduling expression without storing anything.
   *
   * @throws dev.schedin.exceptions.SchedinScheduleException if the expression is invalid
   */
  public ParsedSchedule parseSchedule(String expression) {
    return parser.parse(expression);
  }

  public UUID insert(JobDescription job, UUID ownerId) {
    return jobDatabase.insert(job, ownerId);
  }

  public boolean delete(UUID ownerId, String jobName) {
    return jobDatabase.delete(ownerId, jobName);
  }

  public List<Job> selectDue(Duration lookahead) {
    return jobDatabase.selectDue(lookahead);
  }

  /** Jobs due within the configured lookahead */
  public List<Job> selectDue() {
    return jobDatabase.selectDue(lookahead);
  }

  public List<Job> listJobs(UUID ownerId) {
    return jobDatabase.listJobs(ownerId);
  }

  public Optional<Job> getJob(UUID ownerId, String jobName) {
    return jobDatabase.getJob(ownerId, jobName);
  }

  public boolean setStatus(UUID ownerId, String jobName, JobStatus status) {
    return jobDatabase.setStatus(ownerId, jobName, status);
  }

  /** A poller over this client's jobs using the configured interval and lookahead. Not started. */
  public DuePoller newPoller(DueJobListener listener) {
    return new DuePoller(jobDatabase, pollInterval, lookahead, listener);
  }

  public DuePoller newPoller() {
    return newPoller(DueJobListener.logging());
  }
}
