package bridgestore.jdbc.dialect;

import bridgestore.jdbc.JdbcTarget;
import bridgestore.model.DatabaseConfig;
import bridgestore.model.DriverKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * H2 embedded file dialect for the local backend. The config address is the
 * database path without H2's {@code .mv.db} suffix.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public DriverKind driverKind() {
    return DriverKind.LOCAL;
  }

  @Override
  public String driverClassName() {
    return "org.h2.Driver";
  }

  @Override
  public JdbcTarget target(DatabaseConfig config, Duration connectTimeout) {
    checkKind(config);
    String path = Path.of(config.connectionAddress()).toAbsolutePath().toString();
    return new JdbcTarget("jdbc:h2:file:" + path, new Properties());
  }
}
