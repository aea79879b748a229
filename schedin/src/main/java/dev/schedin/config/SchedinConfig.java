package dev.schedin.config;

import dev.schedin.Constants;

import java.time.Duration;

import com.zaxxer.hikari.HikariDataSource;

public record SchedinConfig(
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    HikariDataSource dataSource,
    String databaseSchema,
    boolean migrate,
    Duration pollInterval,
    Duration lookahead) {

  public SchedinConfig {
    if (dataSource == null && (databaseUrl == null || databaseUrl.isEmpty())) {
      throw new IllegalArgumentException(
          "SchedinConfig requires either databaseUrl or dataSource to be specified");
    }
    if (databaseSchema != null && databaseSchema.isEmpty()) {
      throw new IllegalArgumentException(
          "SchedinConfig.databaseSchema must not be empty if specified");
    }
    if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("SchedinConfig.pollInterval must be positive");
    }
    if (lookahead == null || lookahead.isNegative()) {
      throw new IllegalArgumentException("SchedinConfig.lookahead must not be negative");
    }
  }

  public static SchedinConfig defaults(String databaseUrl) {
    return new SchedinConfig(
        databaseUrl,
        Constants.DEFAULT_POSTGRES_USER,
        null,
        3, // maximumPoolSize default
        30000, // connectionTimeout default
        null,
        null,
        true, // migrate
        Constants.DEFAULT_POLL_INTERVAL,
        Constants.DEFAULT_LOOKAHEAD);
  }

  public static SchedinConfig defaults(HikariDataSource dataSource) {
    return new SchedinConfig(
        null,
        null,
        null,
        0,
        0,
        dataSource,
        null,
        true, // migrate
        Constants.DEFAULT_POLL_INTERVAL,
        Constants.DEFAULT_LOOKAHEAD);
  }

  public static SchedinConfig defaultsFromEnv() {
    String databaseUrl = System.getenv(Constants.JDBC_URL_ENV_VAR);
    if (databaseUrl == null || databaseUrl.isEmpty()) {
      throw new IllegalStateException(
          "%s environment variable must be set".formatted(Constants.JDBC_URL_ENV_VAR));
    }
    String dbUser = System.getenv(Constants.POSTGRES_USER_ENV_VAR);
    if (dbUser == null || dbUser.isEmpty()) dbUser = Constants.DEFAULT_POSTGRES_USER;
    String dbPassword = System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR);
    return defaults(databaseUrl).withDbUser(dbUser).withDbPassword(dbPassword);
  }

  public SchedinConfig withDatabaseUrl(String v) {
    return new SchedinConfig(
        v,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withDbUser(String v) {
    return new SchedinConfig(
        databaseUrl,
        v,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withDbPassword(String v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        v,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withMaximumPoolSize(int v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        v,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withConnectionTimeout(int v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        v,
        dataSource,
        databaseSchema,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withDataSource(HikariDataSource v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        v,
        databaseSchema,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withDatabaseSchema(String v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        v,
        migrate,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withMigrate(boolean v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        v,
        pollInterval,
        lookahead);
  }

  public SchedinConfig withPollInterval(Duration v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        v,
        lookahead);
  }

  public SchedinConfig withLookahead(Duration v) {
    return new SchedinConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        pollInterval,
        v);
  }

  @Override
  public String toString() {
    return "SchedinConfig[databaseUrl=%s, dbUser=%s, maximumPoolSize=%d, connectionTimeout=%d, databaseSchema=%s, migrate=%s, pollInterval=%s, lookahead=%s]"
        .formatted(
            databaseUrl,
            dbUser,
            maximumPoolSize,
            connectionTimeout,
            databaseSchema,
            migrate,
            pollInterval,
            lookahead);
  }
}
