package dev.schedin.cli;

import dev.schedin.database.JobDatabase;
import dev.schedin.migrations.MigrationManager;

import java.io.PrintWriter;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "migrate",
    description = "Create the schedin database, schema and job tables",
    mixinStandardHelpOptions = true)
public class MigrateCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-r", "--app-role"},
      description = "The role with which your application will read and write jobs")
  String appRole;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    out.println("Starting schedin migrations");
    out.format("  Database: %s%n", dbOptions.url());
    out.format("  Database User: %s%n", dbOptions.user());

    MigrationManager.runMigrations(
        dbOptions.url(), dbOptions.user(), dbOptions.password(), dbOptions.schema());
    grantSchemaPermissions(out);
    out.println("Migrations complete");
    return 0;
  }

  void grantSchemaPermissions(PrintWriter out) throws SQLException {
    if (appRole == null || appRole.isEmpty()) {
      return;
    }

    final var schema = JobDatabase.sanitizeSchema(dbOptions.schema());
    final var role = "\"%s\"".formatted(appRole.replace("\"", "\"\""));
    out.format(
        "Granting permissions for the %s schema to %s in database %s%n",
        schema, appRole, dbOptions.url());

    String[] queries = {
      "GRANT USAGE ON SCHEMA %s TO %s",
      "GRANT ALL PRIVILEGES ON ALL TABLES IN SCHEMA %s TO %s",
      "ALTER DEFAULT PRIVILEGES IN SCHEMA %s GRANT ALL ON TABLES TO %s"
    };
    try (var conn =
            DriverManager.getConnection(dbOptions.url(), dbOptions.user(), dbOptions.password());
        var stmt = conn.createStatement()) {
      for (var query : queries) {
        stmt.execute(query.formatted(schema, role));
      }
    }
  }
}
