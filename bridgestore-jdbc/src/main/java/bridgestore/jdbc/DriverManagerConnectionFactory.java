package bridgestore.jdbc;

import bridgestore.jdbc.dialect.Dialects;
import bridgestore.model.DatabaseConfig;
import bridgestore.spi.ConnectionFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;

/**
 * Opens unpooled connections through {@link DriverManager}, for probes and the
 * one-off reconciliation connection. The dialect for the config's backend kind
 * supplies the URL and driver properties.
 */
public final class DriverManagerConnectionFactory implements ConnectionFactory {
  private final Duration connectTimeout;

  public DriverManagerConnectionFactory(Duration connectTimeout) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
  }

  @Override
  public Connection open(DatabaseConfig config) throws SQLException {
    JdbcTarget target = Dialects.forKind(config.driverKind()).target(config, connectTimeout);
    return DriverManager.getConnection(target.url(), target.properties());
  }
}
