package bridgestore.spi;

import bridgestore.model.DatabaseConfig;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens short-lived JDBC connections for a {@link DatabaseConfig}, used by
 * probes and schema reconciliation. Long-lived access goes through a
 * {@link StorageHandle} instead.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see bridgestore.jdbc.DriverManagerConnectionFactory
 */
@FunctionalInterface
public interface ConnectionFactory {

  /**
   * Opens a new connection.
   *
   * @param config target backend
   * @return an open connection; the caller must close it
   * @throws SQLException if the connection cannot be opened
   */
  Connection open(DatabaseConfig config) throws SQLException;
}
