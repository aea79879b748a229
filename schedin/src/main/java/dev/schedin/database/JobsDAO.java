package dev.schedin.database;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;
import dev.schedin.exceptions.SchedinDuplicateJobException;
import dev.schedin.exceptions.SchedinScheduleException;
import dev.schedin.internal.DebugTriggers;
import dev.schedin.job.Job;
import dev.schedin.job.JobDescription;
import dev.schedin.job.JobStatus;
import dev.schedin.job.Payload;
import dev.schedin.schedule.NextRunCalculator;
import dev.schedin.schedule.ParsedSchedule;
import dev.schedin.schedule.ScheduleParser;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JobsDAO {

  private static final Logger logger = LoggerFactory.getLogger(JobsDAO.class);

  static final String UNIQUE_VIOLATION = "23505";

  private final DataSource dataSource;
  private final String schema;
  private final ScheduleParser parser;
  private final NextRunCalculator calculator;

  JobsDAO(
      DataSource dataSource, String schema, ScheduleParser parser, NextRunCalculator calculator) {
    this.dataSource = dataSource;
    this.schema = Objects.requireNonNull(schema);
    this.parser = Objects.requireNonNull(parser);
    this.calculator = Objects.requireNonNull(calculator);
  }

  /**
   * Validates and stores a job together with its payload row in one transaction. Either both rows
   * are visible afterwards or neither is.
   *
   * @return the id of the new job
   */
  UUID insert(JobDescription job, UUID ownerId) {
    if (job == null) {
      throw new SchedinCrudException(CrudError.VALIDATION, "job must not be null");
    }
    if (ownerId == null) {
      throw new SchedinCrudException(CrudError.VALIDATION, "owner id must not be null");
    }
    job.validate();

    ParsedSchedule schedule = job.schedule() == null ? null : parseStored(job.schedule());
    Instant nextRunAt = schedule == null ? null : calculator.nextRun(schedule);
    JobStatus status = schedule == null ? JobStatus.DISABLED : JobStatus.SCHEDULED;
    UUID jobId = UUID.randomUUID();
    logger.debug(
        "insert job {} ({}) for owner {} next run {}", job.name(), jobId, ownerId, nextRunAt);

    try (Connection connection = Transactions.open(dataSource)) {
      Transactions.begin(connection);

      try {
        insertJobRow(connection, jobId, ownerId, job, schedule, nextRunAt, status);
      } catch (SQLException e) {
        Transactions.rollback(connection, e);
        if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
          logger.info("Job {} already exists for owner {}", job.name(), ownerId);
          throw new SchedinDuplicateJobException(ownerId, job.name(), e);
        }
        logger.error("Failed to insert job {}", job.name(), e);
        throw new SchedinCrudException(CrudError.INSERTION, "job " + job.name(), e);
      }

      try {
        DebugTriggers.debugTriggerPoint(DebugTriggers.DEBUG_TRIGGER_PAYLOAD_INSERT);
        insertPayloadRow(connection, jobId, job.payload());
      } catch (SQLException e) {
        logger.error("Failed to insert {} payload of job {}", job.payload().type(), job.name(), e);
        Transactions.rollback(connection, e);
        throw new SchedinCrudException(
            CrudError.INSERTION,
            "%s payload of job %s".formatted(job.payload().type(), job.name()),
            e);
      }

      Transactions.commit(
          connection, DebugTriggers.DEBUG_TRIGGER_JOB_COMMIT, "insert job " + job.name());
    } catch (SQLException e) {
      logger.warn("Failed to release connection after inserting job {}", jobId, e);
    }
    return jobId;
  }

  private void insertJobRow(
      Connection connection,
      UUID jobId,
      UUID ownerId,
      JobDescription job,
      ParsedSchedule schedule,
      Instant nextRunAt,
      JobStatus status)
      throws SQLException {
    final String sql =
        """
        INSERT INTO %s.jobs (
          job_id, user_id, job_name, job_description, job_type,
          schedule, job_interval, next_run_at, job_status
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """
            .formatted(this.schema);

    try (PreparedStatement stmt = connection.prepareStatement(sql)) {
      stmt.setObject(1, jobId);
      stmt.setObject(2, ownerId);
      stmt.setString(3, job.name());
      stmt.setString(4, job.description());
      stmt.setString(5, job.payload().type().dbValue());
      stmt.setString(6, job.schedule());
      Optional<Long> interval = schedule == null ? Optional.empty() : schedule.intervalSeconds();
      if (interval.isPresent()) {
        stmt.setLong(7, interval.get());
      } else {
        stmt.setNull(7, Types.BIGINT);
      }
      JobRows.setInstant(stmt, 8, nextRunAt);
      stmt.setString(9, status.dbValue());
      stmt.executeUpdate();
    }
  }

  private void insertPayloadRow(Connection connection, UUID jobId, Payload payload)
      throws SQLException {
    switch (payload.type()) {
      case TASK -> {
        var task = (Payload.Task) payload;
        var sql = "INSERT INTO %s.tasks (job_id, task_name) VALUES (?, ?)".formatted(schema);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
          stmt.setObject(1, jobId);
          stmt.setString(2, task.name());
          stmt.executeUpdate();
        }
      }
      case CODE -> {
        var code = (Payload.Code) payload;
        var sql =
            "INSERT INTO %s.codes (job_id, src, lang, cmd) VALUES (?, ?, ?, ?)".formatted(schema);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
          stmt.setObject(1, jobId);
          stmt.setString(2, code.source());
          stmt.setString(3, code.language());
          stmt.setString(4, code.command());
          stmt.executeUpdate();
        }
      }
      case BIN -> {
        var bin = (Payload.Bin) payload;
        var sql = "INSERT INTO %s.bins (job_id, path, cmd) VALUES (?, ?, ?)".formatted(schema);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
          stmt.setObject(1, jobId);
          stmt.setString(2, bin.path());
          stmt.setString(3, bin.command());
          stmt.executeUpdate();
        }
      }
    }
  }

  /**
   * Deletes the owner's job with the given name and its payload row.
   *
   * @return false if no such job existed
   */
  boolean delete(UUID ownerId, String jobName) {
    Objects.requireNonNull(ownerId, "ownerId must not be null");
    Objects.requireNonNull(jobName, "jobName must not be null");

    final String sql = "DELETE FROM %s.jobs WHERE user_id = ? AND job_name = ?".formatted(schema);

    boolean deleted = false;
    try (Connection connection = Transactions.open(dataSource)) {
      Transactions.begin(connection);

      int rows;
      try (PreparedStatement stmt = connection.prepareStatement(sql)) {
        stmt.setObject(1, ownerId);
        stmt.setString(2, jobName);
        rows = stmt.executeUpdate();
      } catch (SQLException e) {
        logger.error("Failed to delete job {}", jobName, e);
        Transactions.rollback(connection, e);
        throw new SchedinCrudException(CrudError.TRANSACTION, "delete job " + jobName, e);
      }

      Transactions.commit(
          connection, DebugTriggers.DEBUG_TRIGGER_DELETE_COMMIT, "delete job " + jobName);
      deleted = rows > 0;
    } catch (SQLException e) {
      logger.warn("Failed to release connection after deleting job {}", jobName, e);
    }
    logger.debug("delete job {} for owner {}: {}", jobName, ownerId, deleted);
    return deleted;
  }

  /**
   * Changes the status of a job. Moving a job to {@link JobStatus#SCHEDULED} parses its stored
   * schedule again and recomputes the next run.
   *
   * @return false if no such job exists
   */
  boolean setStatus(UUID ownerId, String jobName, JobStatus status) {
    Objects.requireNonNull(ownerId, "ownerId must not be null");
    Objects.requireNonNull(jobName, "jobName must not be null");
    Objects.requireNonNull(status, "status must not be null");

    final String selectSql =
        "SELECT schedule FROM %s.jobs WHERE user_id = ? AND job_name = ? FOR UPDATE"
            .formatted(schema);
    final String updateSql =
        """
        UPDATE %s.jobs
        SET job_status = ?, next_run_at = COALESCE(?, next_run_at)
        WHERE user_id = ? AND job_name = ?
        """
            .formatted(schema);

    boolean updated = false;
    try (Connection connection = Transactions.open(dataSource)) {
      Transactions.begin(connection);

      try {
        boolean found = false;
        String schedule = null;
        try (PreparedStatement stmt = connection.prepareStatement(selectSql)) {
          stmt.setObject(1, ownerId);
          stmt.setString(2, jobName);
          try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
              found = true;
              schedule = rs.getString("schedule");
            }
          }
        }

        if (!found) {
          connection.rollback();
          return false;
        }

        Instant nextRunAt = null;
        if (status == JobStatus.SCHEDULED) {
          if (schedule == null) {
            connection.rollback();
            throw new SchedinCrudException(
                CrudError.VALIDATION, "Job %s has no schedule".formatted(jobName));
          }
          try {
            nextRunAt = calculator.nextRun(parseStored(schedule));
          } catch (SchedinCrudException e) {
            connection.rollback();
            throw e;
          }
        }

        try (PreparedStatement stmt = connection.prepareStatement(updateSql)) {
          stmt.setString(1, status.dbValue());
          JobRows.setInstant(stmt, 2, nextRunAt);
          stmt.setObject(3, ownerId);
          stmt.setString(4, jobName);
          stmt.executeUpdate();
        }
      } catch (SQLException e) {
        logger.error("Failed to set status of job {} to {}", jobName, status, e);
        Transactions.rollback(connection, e);
        throw new SchedinCrudException(
            CrudError.TRANSACTION, "set status of job %s".formatted(jobName), e);
      }

      Transactions.commit(
          connection, DebugTriggers.DEBUG_TRIGGER_STATUS_COMMIT, "set status of job " + jobName);
      updated = true;
    } catch (SQLException e) {
      logger.warn("Failed to release connection after updating job {}", jobName, e);
    }
    logger.debug("set status of job {} for owner {} to {}: {}", jobName, ownerId, status, updated);
    return updated;
  }

  List<Job> listJobs(UUID ownerId) {
    Objects.requireNonNull(ownerId, "ownerId must not be null");
    var sql = JobRows.selectJobs(schema) + " WHERE j.user_id = ? ORDER BY j.job_name";

    try (Connection connection = Transactions.open(dataSource);
        PreparedStatement stmt = connection.prepareStatement(sql)) {
      stmt.setObject(1, ownerId);
      List<Job> jobs = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          jobs.add(JobRows.mapJob(rs));
        }
      }
      return jobs;
    } catch (SQLException e) {
      logger.error("Failed to list jobs of owner {}", ownerId, e);
      throw new SchedinCrudException(CrudError.READ, "list jobs of owner " + ownerId, e);
    }
  }

  Optional<Job> getJob(UUID ownerId, String jobName) {
    Objects.requireNonNull(ownerId, "ownerId must not be null");
    Objects.requireNonNull(jobName, "jobName must not be null");
    var sql = JobRows.selectJobs(schema) + " WHERE j.user_id = ? AND j.job_name = ?";

    try (Connection connection = Transactions.open(dataSource);
        PreparedStatement stmt = connection.prepareStatement(sql)) {
      stmt.setObject(1, ownerId);
      stmt.setString(2, jobName);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? Optional.of(JobRows.mapJob(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      logger.error("Failed to read job {}", jobName, e);
      throw new SchedinCrudException(CrudError.READ, "job " + jobName, e);
    }
  }

  private ParsedSchedule parseStored(String schedule) {
    try {
      return parser.parse(schedule);
    } catch (SchedinScheduleException e) {
      throw new SchedinCrudException(CrudError.VALIDATION, e.getMessage(), e);
    }
  }
}
