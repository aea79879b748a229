package dev.schedin.cli;

import dev.schedin.Constants;
import dev.schedin.SchedinClient;

import java.util.Objects;

import picocli.CommandLine.Option;

public class DatabaseOptions {
  @Option(
      names = {"-D", "--db-url"},
      description = "Your schedin database URL (defaults to SCHEDIN_JDBC_URL env var)")
  String url;

  @Option(
      names = {"-U", "--db-user"},
      description = "user name for your schedin database (defaults to PGUSER env var)")
  String user;

  @Option(
      names = {"-P", "--db-password"},
      description = "password for your schedin database (defaults to PGPASSWORD env var)",
      arity = "0..1",
      interactive = true)
  String password;

  @Option(
      names = {"--schema"},
      description = "database schema holding the job tables (defaults to schedin)")
  String schema;

  public String url() {
    var url =
        Objects.requireNonNullElseGet(this.url, () -> System.getenv(Constants.JDBC_URL_ENV_VAR));
    if (url == null || url.isEmpty()) {
      throw new IllegalArgumentException(
          "No database URL; pass -D or set %s".formatted(Constants.JDBC_URL_ENV_VAR));
    }
    return url;
  }

  public String user() {
    var user =
        Objects.requireNonNullElseGet(
            this.user, () -> System.getenv(Constants.POSTGRES_USER_ENV_VAR));
    return user == null || user.isEmpty() ? Constants.DEFAULT_POSTGRES_USER : user;
  }

  public String password() {
    return Objects.requireNonNullElseGet(
        this.password, () -> System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR));
  }

  public String schema() {
    return schema;
  }

  public SchedinClient createClient() {
    return new SchedinClient(url(), user(), password(), schema());
  }
}
