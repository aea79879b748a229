package dev.schedin.migrations;

import dev.schedin.Constants;
import dev.schedin.config.SchedinConfig;
import dev.schedin.database.JobDatabase;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the database, the schema and the job tables. Migrations are numbered from 1 and the
 * highest applied number is kept in {@code schedin_migrations}; running the manager again only
 * applies what is missing.
 */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of(
          // Relation / object already exists
          "42P07", // duplicate_table
          "42710", // duplicate_object (e.g., index)
          "42701", // duplicate_column
          "42P06", // duplicate_schema
          "23505" // unique_violation
          );

  public static void runMigrations(SchedinConfig config) {
    Objects.requireNonNull(config, "SchedinConfig must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.databaseSchema());
    } else {
      createDatabaseIfNotExists(config);
      try (var ds = JobDatabase.createDataSource(config)) {
        runMigrations(ds, config.databaseSchema());
      }
    }
  }

  public static void runMigrations(String url, String user, String password, String schema) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");

    createDatabaseIfNotExists(url, user, password);
    try (var ds = JobDatabase.createDataSource(url, user, password, 0, 0)) {
      runMigrations(ds, schema);
    }
  }

  public static void runMigrations(HikariDataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    var schemaName = Objects.requireNonNullElse(schema, Constants.DB_SCHEMA);
    var quoted = JobDatabase.sanitizeSchema(schemaName);

    try (var conn = ds.getConnection()) {
      ensureSchema(conn, schemaName, quoted);
      ensureMigrationTable(conn, schemaName, quoted);
      runSchedinMigrations(conn, quoted, getMigrations(quoted));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to run migrations", e);
    }
  }

  public static void createDatabaseIfNotExists(SchedinConfig config) {
    Objects.requireNonNull(config, "SchedinConfig must not be null");
    if (config.dataSource() != null) {
      logger.debug("SchedinConfig specifies data source, skipping createDatabaseIfNotExists");
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");

    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = JobDatabase.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      } catch (SQLException e) {
        logger.warn("SQLException thrown looking for {} database", pair.database(), e);
      }

      logger.info("Creating '{}' database", pair.database());
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE DATABASE \"" + pair.database().replace("\"", "\"\"") + "\"");
      } catch (SQLException e) {
        logger.warn("SQLException thrown creating {} database", pair.database(), e);
      }
    } catch (SQLException | RuntimeException e) {
      logger.warn("Failed to connect to database {}", pair.url(), e);
    }
  }

  public record UrlPair(String url, String database) {}

  /** Splits a JDBC url into the url of the {@code postgres} maintenance database and the name. */
  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length() || slash == base.length() - 1) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }

    var newUrl = base.substring(0, slash + 1) + "postgres" + params;
    var databaseName = base.substring(slash + 1);
    return new UrlPair(newUrl, databaseName);
  }

  static void ensureSchema(Connection conn, String schemaName, String quoted) {
    var sql = "SELECT schema_name FROM information_schema.schemata WHERE schema_name = ?";
    try (var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    } catch (SQLException e) {
      logger.warn("SQLException thrown looking for {} schema", schemaName, e);
    }

    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(quoted));
    } catch (SQLException e) {
      logger.warn("SQLException thrown creating the {} schema", schemaName, e);
    }
  }

  static void ensureMigrationTable(Connection conn, String schemaName, String quoted) {
    var sql =
        "SELECT table_name FROM information_schema.tables WHERE table_schema = ? AND table_name = 'schedin_migrations'";
    try (var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    } catch (SQLException e) {
      logger.warn("SQLException thrown looking for schedin_migrations table", e);
    }

    try (var stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS %s.schedin_migrations (version BIGINT NOT NULL PRIMARY KEY)"
              .formatted(quoted));
    } catch (SQLException e) {
      logger.warn("SQLException thrown creating the schedin_migrations table", e);
    }
  }

  public static int getCurrentVersion(Connection conn, String quotedSchema) {
    var sql =
        "SELECT version FROM %s.schedin_migrations ORDER BY version DESC limit 1"
            .formatted(quotedSchema);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      if (rs.next()) {
        return rs.getInt("version");
      }
    } catch (SQLException e) {
      logger.warn("SQLException thrown querying schedin_migrations table", e);
    }

    return 0;
  }

  static void runSchedinMigrations(Connection conn, String quotedSchema, List<String> migrations) {
    var lastApplied = getCurrentVersion(conn, quotedSchema);

    for (var i = 0; i < migrations.size(); i++) {
      var migrationIndex = i + 1;
      if (migrationIndex <= lastApplied) {
        continue;
      }

      logger.info("Applying schedin schema migration {}", migrationIndex);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          logger.warn(
              "Ignoring migration {} error; Migration was likely already applied. Occurred while executing {}",
              migrationIndex,
              migrations.get(i));
        } else {
          throw new RuntimeException("Failed to run migration %d".formatted(migrationIndex), e);
        }
      }

      try {
        int rowCount = 0;
        var updateSQL = "UPDATE %s.schedin_migrations SET version = ?".formatted(quotedSchema);
        try (var stmt = conn.prepareStatement(updateSQL)) {
          stmt.setLong(1, migrationIndex);
          rowCount = stmt.executeUpdate();
        }

        if (rowCount == 0) {
          var insertSql =
              "INSERT INTO %s.schedin_migrations (version) VALUES (?)".formatted(quotedSchema);
          try (var stmt = conn.prepareStatement(insertSql)) {
            stmt.setLong(1, migrationIndex);
            stmt.executeUpdate();
          }
        }
      } catch (SQLException e) {
        throw new RuntimeException("Failed to update schedin migration version", e);
      }

      lastApplied = migrationIndex;
    }
  }

  public static List<String> getMigrations(String quotedSchema) {
    Objects.requireNonNull(quotedSchema);
    var migrations = List.of(migration1, migration2);
    return migrations.stream().map(m -> m.formatted(quotedSchema)).toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.jobs (
          job_id UUID PRIMARY KEY,
          user_id UUID NOT NULL,
          job_name TEXT NOT NULL,
          job_description TEXT,
          job_type TEXT NOT NULL CHECK (job_type IN ('task', 'code', 'bin')),
          schedule TEXT,
          job_interval BIGINT,
          next_run_at TIMESTAMPTZ,
          created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
          runs INTEGER NOT NULL DEFAULT 0,
          error_count INTEGER NOT NULL DEFAULT 0,
          job_status TEXT NOT NULL DEFAULT 'scheduled'
              CHECK (job_status IN ('scheduled', 'running', 'disabled')),
          CONSTRAINT uq_jobs_user_name UNIQUE (user_id, job_name),
          CONSTRAINT ck_jobs_scheduled_next_run
              CHECK (job_status <> 'scheduled' OR next_run_at IS NOT NULL)
      );

      CREATE TABLE %1$s.tasks (
          job_id UUID PRIMARY KEY REFERENCES %1$s.jobs(job_id) ON DELETE CASCADE,
          task_name TEXT NOT NULL
      );

      CREATE TABLE %1$s.codes (
          job_id UUID PRIMARY KEY REFERENCES %1$s.jobs(job_id) ON DELETE CASCADE,
          src TEXT NOT NULL,
          lang TEXT NOT NULL,
          cmd TEXT NOT NULL
      );

      CREATE TABLE %1$s.bins (
          job_id UUID PRIMARY KEY REFERENCES %1$s.jobs(job_id) ON DELETE CASCADE,
          path TEXT NOT NULL,
          cmd TEXT
      );
      """;

  static final String migration2 =
      """
      CREATE INDEX idx_jobs_status_next_run ON %1$s.jobs (job_status, next_run_at);
      """;
}
