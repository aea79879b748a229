package dev.schedin.database;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;
import dev.schedin.job.Job;
import dev.schedin.job.JobStatus;
import dev.schedin.schedule.NextRunCalculator;
import dev.schedin.schedule.ScheduleParser;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DueJobsDAO {

  private static final Logger logger = LoggerFactory.getLogger(DueJobsDAO.class);

  private final DataSource dataSource;
  private final String schema;
  private final NextRunCalculator calculator;

  DueJobsDAO(DataSource dataSource, String schema, NextRunCalculator calculator) {
    this.dataSource = dataSource;
    this.schema = Objects.requireNonNull(schema);
    this.calculator = Objects.requireNonNull(calculator);
  }

  /**
   * Scheduled jobs whose next run falls within {@code [now, now + lookahead]}, earliest first.
   * Jobs whose next run is already in the past are not returned.
   */
  List<Job> selectDue(Duration lookahead) {
    Objects.requireNonNull(lookahead, "lookahead must not be null");
    if (lookahead.isNegative()) {
      throw new IllegalArgumentException("lookahead must not be negative: " + lookahead);
    }
    if (lookahead.compareTo(ScheduleParser.MAX_INTERVAL) > 0) {
      throw new IllegalArgumentException(
          "lookahead must not exceed %d days: %s"
              .formatted(ScheduleParser.MAX_INTERVAL.toDays(), lookahead));
    }

    var now = calculator.now();
    var until = now.plus(lookahead);
    var sql =
        JobRows.selectJobs(schema)
            + """
            WHERE j.job_status = ?
              AND j.next_run_at BETWEEN ? AND ?
            ORDER BY j.next_run_at, j.job_id
            """;

    try (Connection connection = Transactions.open(dataSource);
        PreparedStatement stmt = connection.prepareStatement(sql)) {
      stmt.setString(1, JobStatus.SCHEDULED.dbValue());
      JobRows.setInstant(stmt, 2, now);
      JobRows.setInstant(stmt, 3, until);

      List<Job> jobs = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          jobs.add(JobRows.mapJob(rs));
        }
      }
      logger.debug("{} jobs due between {} and {}", jobs.size(), now, until);
      return jobs;
    } catch (SQLException e) {
      logger.error("Failed to select due jobs", e);
      throw new SchedinCrudException(CrudError.READ, "due jobs", e);
    }
  }
}
