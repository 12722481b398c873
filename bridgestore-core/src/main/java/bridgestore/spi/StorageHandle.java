package bridgestore.spi;

import bridgestore.model.DatabaseConfig;

import javax.sql.DataSource;
import java.util.List;

/**
 * The storage the rest of the process depends on once initialization is done.
 *
 * <p>Safe for concurrent use; concurrency control is left to the engine and its
 * connection pool. {@link #dataSource()} is what the wrapped messaging library
 * persists its session and device state through.
 */
public interface StorageHandle extends AutoCloseable {

  /**
   * Runs a query and maps every row.
   *
   * @throws bridgestore.StorageException on any JDBC error
   */
  <T> List<T> query(String sql, RowMapper<T> mapper, Object... params);

  /**
   * Runs an INSERT, UPDATE, DELETE or DDL statement.
   *
   * @return rows affected
   * @throws bridgestore.StorageException on any JDBC error
   */
  int execute(String sql, Object... params);

  /** Pooled data source backing this handle. */
  DataSource dataSource();

  /** The config this handle was created for. */
  DatabaseConfig config();

  /** Releases the pool. Idempotent. */
  @Override
  void close();
}
