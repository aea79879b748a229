package dev.schedin.migrations;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.schedin.DbSetupTestBase;
import dev.schedin.database.JobDatabase;
import dev.schedin.job.JobDescription;
import dev.schedin.job.Payload;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.UUID;

import org.junit.jupiter.api.Test;

@org.junit.jupiter.api.Timeout(value = 2, unit = java.util.concurrent.TimeUnit.MINUTES)
class MigrationManagerTest extends DbSetupTestBase {

  @Test
  void runMigrationsCreatesTables() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData metaData = conn.getMetaData();

      assertTableExists(metaData, "schedin", "jobs");
      assertTableExists(metaData, "schedin", "tasks");
      assertTableExists(metaData, "schedin", "codes");
      assertTableExists(metaData, "schedin", "bins");
      assertTableExists(metaData, "schedin", "schedin_migrations");

      assertEquals(
          MigrationManager.getMigrations("\"schedin\"").size(),
          MigrationManager.getCurrentVersion(conn, "\"schedin\""));
    }
  }

  @Test
  void runMigrationsIsIdempotent() throws Exception {
    assertDoesNotThrow(() -> MigrationManager.runMigrations(config));
    assertDoesNotThrow(() -> MigrationManager.runMigrations(config));

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(2, MigrationManager.getCurrentVersion(conn, "\"schedin\""));
    }
  }

  @Test
  void customSchema() throws Exception {
    var schema = "jobs \"custom\"";
    MigrationManager.runMigrations(config.withDatabaseSchema(schema));

    try (Connection conn = dataSource.getConnection()) {
      assertTableExists(conn.getMetaData(), schema, "jobs");
    }

    try (var db = new JobDatabase(JobDatabase.createDataSource(config), schema)) {
      var owner = UUID.randomUUID();
      db.insert(new JobDescription("custom", "@every 1 min", new Payload.Task("t")), owner);
      assertEquals(1, db.listJobs(owner).size());
      assertTrue(db.getJob(owner, "custom").isPresent());
    }
  }

  @Test
  void createsMissingDatabase() throws Exception {
    var url = postgres.getJdbcUrl().replace("/" + postgres.getDatabaseName(), "/schedin_created");
    MigrationManager.runMigrations(url, postgres.getUsername(), postgres.getPassword(), null);

    try (var ds = JobDatabase.createDataSource(url, postgres.getUsername(), postgres.getPassword());
        Connection conn = ds.getConnection()) {
      assertTableExists(conn.getMetaData(), "schedin", "jobs");
    }
  }

  @Test
  void extractDbAndPostgresUrl() {
    var pair =
        MigrationManager.extractDbAndPostgresUrl(
            "jdbc:postgresql://localhost:5432/schedin_db?sslmode=disable");
    assertEquals("jdbc:postgresql://localhost:5432/postgres?sslmode=disable", pair.url());
    assertEquals("schedin_db", pair.database());

    assertThrows(
        IllegalArgumentException.class,
        () -> MigrationManager.extractDbAndPostgresUrl("jdbc:postgresql://localhost:5432/"));
    assertThrows(
        IllegalArgumentException.class,
        () -> MigrationManager.extractDbAndPostgresUrl("jdbc:postgresql://localhost"));
  }

  private static void assertTableExists(DatabaseMetaData metaData, String schema, String table)
      throws Exception {
    try (ResultSet rs = metaData.getTables(null, schema, table, new String[] {"TABLE"})) {
      assertTrue(rs.next(), "Table %s.%s should exist".formatted(schema, table));
    }
  }
}
