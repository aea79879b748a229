package dev.schedin.cli;

import dev.schedin.migrations.MigrationManager;

import java.sql.DriverManager;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(name = "reset", description = "Drop and recreate the schedin database")
public class ResetCommand implements Callable<Integer> {

  @Option(
      names = {"-y", "--yes"},
      description = "Skip confirmation prompt")
  boolean skipConfirmation;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();

    if (!skipConfirmation) {
      String prompt =
          "This command resets your schedin database, deleting every stored job. Are you sure you want to proceed?";
      if (!SchedinCommand.confirm(prompt)) {
        out.println("Database reset cancelled");
        return 0;
      }
    }

    var pair = MigrationManager.extractDbAndPostgresUrl(dbOptions.url());
    var database = "\"%s\"".formatted(pair.database().replace("\"", "\"\""));
    var dropDbSql = String.format("DROP DATABASE IF EXISTS %s WITH (FORCE)", database);
    var createDbSql = String.format("CREATE DATABASE %s", database);
    try (var conn =
            DriverManager.getConnection(pair.url(), dbOptions.user(), dbOptions.password());
        var stmt = conn.createStatement()) {
      stmt.execute(dropDbSql);
      stmt.execute(createDbSql);
      out.format("Database %s has been reset successfully%n", pair.database());
      return 0;
    }
  }
}
