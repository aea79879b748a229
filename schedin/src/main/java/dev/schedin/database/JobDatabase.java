package dev.schedin.database;

import dev.schedin.Constants;
import dev.schedin.config.SchedinConfig;
import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;
import dev.schedin.job.Job;
import dev.schedin.job.JobDescription;
import dev.schedin.job.JobStatus;
import dev.schedin.polling.DueJobSource;
import dev.schedin.schedule.NextRunCalculator;
import dev.schedin.schedule.ScheduleParser;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Job store backed by a Postgres schema and a Hikari connection pool. */
public class JobDatabase implements DueJobSource, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(JobDatabase.class);

  public static String sanitizeSchema(String schema) {
    schema =
        Objects.requireNonNullElse(schema, Constants.DB_SCHEMA)
            .replace("\0", "")
            .replace("\"", "\"\"");
    return "\"%s\"".formatted(schema);
  }

  private final HikariDataSource dataSource;
  private final String schema;

  private final JobsDAO jobsDAO;
  private final DueJobsDAO dueJobsDAO;

  public JobDatabase(SchedinConfig config) {
    this(
        JobDatabase.createDataSource(config),
        Objects.requireNonNull(config).databaseSchema(),
        Clock.systemUTC());
  }

  public JobDatabase(HikariDataSource dataSource, String schema) {
    this(dataSource, schema, Clock.systemUTC());
  }

  public JobDatabase(HikariDataSource dataSource, String schema, Clock clock) {
    this.schema = sanitizeSchema(schema);
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    var calculator = new NextRunCalculator(clock);
    jobsDAO = new JobsDAO(dataSource, this.schema, new ScheduleParser(clock), calculator);
    dueJobsDAO = new DueJobsDAO(dataSource, this.schema, calculator);
  }

  String schema() {
    return schema;
  }

  @Override
  public void close() {
    dataSource.close();
  }

  /**
   * Insert a job and its payload atomically.
   *
   * @param job the job to store
   * @param ownerId the owning user
   * @return id of the new job
   * @throws SchedinCrudException {@link CrudError#VALIDATION} if the job or its schedule is
   *     invalid, {@link CrudError#POOLING} if no connection could be obtained, {@link
   *     CrudError#INSERTION} if a row could not be written, {@link CrudError#TRANSACTION} if the
   *     transaction could not be started or committed
   * @throws dev.schedin.exceptions.SchedinDuplicateJobException if the owner already has a job with
   *     that name
   */
  public UUID insert(JobDescription job, UUID ownerId) {
    return jobsDAO.insert(job, ownerId);
  }

  /**
   * Delete a job and its payload. Deleting a job that does not exist is not an error.
   *
   * @return true if a job was deleted
   */
  public boolean delete(UUID ownerId, String jobName) {
    return jobsDAO.delete(ownerId, jobName);
  }

  public boolean setStatus(UUID ownerId, String jobName, JobStatus status) {
    return jobsDAO.setStatus(ownerId, jobName, status);
  }

  public List<Job> listJobs(UUID ownerId) {
    return jobsDAO.listJobs(ownerId);
  }

  public Optional<Job> getJob(UUID ownerId, String jobName) {
    return jobsDAO.getJob(ownerId, jobName);
  }

  @Override
  public List<Job> selectDue(Duration lookahead) {
    return dueJobsDAO.selectDue(lookahead);
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }

    try {
      return new HikariDataSource(hikariConfig);
    } catch (HikariPool.PoolInitializationException e) {
      logger.error("Unable to create connection pool for {}", url, e);
      throw new SchedinCrudException(CrudError.POOLING, url, e);
    }
  }

  public static HikariDataSource createDataSource(SchedinConfig config) {
    if (config.dataSource() != null) {
      return config.dataSource();
    }

    var dburl = config.databaseUrl();
    var dbUser = config.dbUser();
    var dbPassword = config.dbPassword();
    var maximumPoolSize = config.maximumPoolSize();
    var connectionTimeout = config.connectionTimeout();

    return createDataSource(dburl, dbUser, dbPassword, maximumPoolSize, connectionTimeout);
  }
}
