package bridgestore.jdbc;

import bridgestore.StorageException;
import bridgestore.model.DatabaseConfig;
import bridgestore.spi.RowMapper;
import bridgestore.spi.StorageHandle;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StorageHandle} over a HikariCP pool. Each call borrows one pooled
 * connection in auto-commit mode.
 */
public final class JdbcStorageHandle implements StorageHandle {
  private static final Logger logger = Logger.getLogger(JdbcStorageHandle.class.getName());

  private final HikariDataSource dataSource;
  private final DatabaseConfig config;
  private final AtomicBoolean closed = new AtomicBoolean();

  JdbcStorageHandle(HikariDataSource dataSource, DatabaseConfig config) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
    ensureOpen();
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.query(conn, sql, mapper, params);
    } catch (SQLException e) {
      throw new StorageException("Failed to obtain connection", e);
    }
  }

  @Override
  public int execute(String sql, Object... params) {
    ensureOpen();
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.update(conn, sql, params);
    } catch (SQLException e) {
      throw new StorageException("Failed to obtain connection", e);
    }
  }

  @Override
  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public DatabaseConfig config() {
    return config;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      logger.log(Level.INFO, "Closing {0} store pool {1}",
          new Object[]{config.driverKind().type(), dataSource.getPoolName()});
      dataSource.close();
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Storage handle is closed");
    }
  }
}
