package dev.schedin;

import java.time.Duration;

public class Constants {

  public static final String DB_SCHEMA = "schedin";

  public static final String POSTGRES_PASSWORD_ENV_VAR = "PGPASSWORD";
  public static final String POSTGRES_USER_ENV_VAR = "PGUSER";
  public static final String DEFAULT_POSTGRES_USER = "postgres";

  public static final String JDBC_URL_ENV_VAR = "SCHEDIN_JDBC_URL";

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_LOOKAHEAD = Duration.ofSeconds(600);
}
