package dev.schedin.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class MigrateCommandTest extends PostgresTestBase {

  static final String DATABASE = "migrate_cmd_test";

  @BeforeEach
  public void setup() throws Exception {
    execute(
        postgres.getDatabaseName(), "DROP DATABASE IF EXISTS %s WITH (FORCE)".formatted(DATABASE));
  }

  @Test
  public void migrate() throws Exception {
    assertFalse(checkConnection(DATABASE));

    var result = CommandResult.execute(concat(new String[] {"migrate"}, dbArgs(DATABASE)));
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("Migrations complete"));

    assertTrue(checkConnection(DATABASE));
    assertTrue(checkTable(DATABASE, "schedin", "jobs"));
    assertTrue(checkTable(DATABASE, "schedin", "tasks"));
    assertTrue(checkTable(DATABASE, "schedin", "codes"));
    assertTrue(checkTable(DATABASE, "schedin", "bins"));
  }

  @Test
  public void migrateTwice() throws Exception {
    migrate();

    var result = CommandResult.execute(concat(new String[] {"migrate"}, dbArgs(DATABASE)));
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(checkTable(DATABASE, "schedin", "jobs"));
  }

  @Test
  public void migrateCustomSchema() throws Exception {
    assertFalse(checkConnection(DATABASE));

    var schema = "C\"$+0m'";
    var result =
        CommandResult.execute(
            concat(new String[] {"migrate"}, concat(dbArgs(DATABASE), "--schema=" + schema)));
    assertEquals(0, result.exitCode(), result.stderr());

    assertTrue(checkTable(DATABASE, schema, "jobs"));
    assertFalse(checkTable(DATABASE, "schedin", "jobs"));
  }

  @Test
  public void migrateGrantsAppRole() throws Exception {
    execute(postgres.getDatabaseName(), "DROP ROLE IF EXISTS schedin_app", "CREATE ROLE schedin_app");

    var result =
        CommandResult.execute(
            concat(new String[] {"migrate"}, concat(dbArgs(DATABASE), "-r", "schedin_app")));
    assertEquals(0, result.exitCode(), result.stderr());
    assertTrue(result.stdout().contains("Granting permissions"));
  }
}
