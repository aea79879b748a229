package dev.schedin.database;

import dev.schedin.exceptions.CrudError;
import dev.schedin.exceptions.SchedinCrudException;
import dev.schedin.internal.DebugTriggers;

import java.sql.Connection;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Connection and transaction steps shared by the DAOs, mapped onto {@link CrudError}. */
final class Transactions {

  private static final Logger logger = LoggerFactory.getLogger(Transactions.class);

  private Transactions() {}

  static Connection open(DataSource dataSource) {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      logger.error("Unable to obtain a connection from the pool", e);
      throw new SchedinCrudException(CrudError.POOLING, "no connection available", e);
    }
  }

  static void begin(Connection connection) {
    try {
      connection.setAutoCommit(false);
      connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
    } catch (SQLException e) {
      logger.error("Unable to begin transaction", e);
      throw new SchedinCrudException(CrudError.TRANSACTION, "begin", e);
    }
  }

  /**
   * Commits the transaction. On failure the transaction is rolled back and the caller must treat
   * the operation as not having happened.
   */
  static void commit(Connection connection, String triggerPoint, String operation) {
    try {
      DebugTriggers.debugTriggerPoint(triggerPoint);
      connection.commit();
    } catch (SQLException e) {
      logger.error("Failed to commit transaction for {}", operation, e);
      rollback(connection, e);
      throw new SchedinCrudException(CrudError.TRANSACTION, "commit " + operation, e);
    }
  }

  /** Rolls back after {@code cause}; a rollback failure is attached to it as suppressed. */
  static void rollback(Connection connection, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      logger.error("Failed to rollback transaction", e);
      cause.addSuppressed(e);
    }
  }
}
