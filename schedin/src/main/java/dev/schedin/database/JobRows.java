package dev.schedin.database;

import dev.schedin.job.Job;
import dev.schedin.job.JobStatus;
import dev.schedin.job.JobType;
import dev.schedin.job.Payload;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/** Reads jobs joined with their payload rows. */
final class JobRows {

  private JobRows() {}

  static String selectJobs(String schema) {
    return """
        SELECT j.user_id, j.job_id, j.job_name, j.job_description, j.job_type,
               j.schedule, j.job_interval, j.next_run_at, j.created_at,
               j.runs, j.error_count, j.job_status,
               t.task_name, c.src, c.lang, c.cmd AS code_cmd, b.path, b.cmd AS bin_cmd
        FROM %1$s.jobs j
        LEFT JOIN %1$s.tasks t ON t.job_id = j.job_id
        LEFT JOIN %1$s.codes c ON c.job_id = j.job_id
        LEFT JOIN %1$s.bins b ON b.job_id = j.job_id
        """
        .formatted(schema);
  }

  static Job mapJob(ResultSet rs) throws SQLException {
    var type = JobType.fromDbValue(rs.getString("job_type"));
    long interval = rs.getLong("job_interval");
    Long jobInterval = rs.wasNull() ? null : interval;

    Payload payload =
        switch (type) {
          case TASK -> new Payload.Task(rs.getString("task_name"));
          case CODE -> new Payload.Code(
              rs.getString("src"), rs.getString("lang"), rs.getString("code_cmd"));
          case BIN -> new Payload.Bin(rs.getString("path"), rs.getString("bin_cmd"));
        };

    return new Job(
        rs.getObject("user_id", UUID.class),
        rs.getObject("job_id", UUID.class),
        rs.getString("job_name"),
        rs.getString("job_description"),
        type,
        rs.getString("schedule"),
        jobInterval,
        getInstant(rs, "next_run_at"),
        getInstant(rs, "created_at"),
        rs.getInt("runs"),
        rs.getInt("error_count"),
        JobStatus.fromDbValue(rs.getString("job_status")),
        payload);
  }

  static Instant getInstant(ResultSet rs, String column) throws SQLException {
    var odt = rs.getObject(column, OffsetDateTime.class);
    return odt == null ? null : odt.toInstant();
  }

  static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
    if (instant == null) {
      stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
    } else {
      stmt.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
    }
  }
}
