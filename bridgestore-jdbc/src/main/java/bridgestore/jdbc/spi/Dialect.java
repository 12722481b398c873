package bridgestore.jdbc.spi;

import bridgestore.jdbc.JdbcTarget;
import bridgestore.model.DatabaseConfig;
import bridgestore.model.DriverKind;
import bridgestore.model.SchemaColumnRequirement;

import java.time.Duration;

/**
 * SPI for backend-specific JDBC wiring.
 *
 * <p>Implementations translate a {@link DatabaseConfig} into a JDBC URL plus driver
 * properties and supply the DDL the schema reconciler runs.
 * Register custom dialects via {@code META-INF/services/bridgestore.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL (remote), H2 (local).
 *
 * @see bridgestore.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * Backend kind this dialect serves.
   */
  DriverKind driverKind();

  /**
   * JDBC driver class, registered explicitly with the connection pool.
   */
  String driverClassName();

  /**
   * Builds the JDBC URL and driver properties for a config.
   *
   * @param config         config of this dialect's {@linkplain #driverKind() kind}
   * @param connectTimeout bound applied to establishing a connection, where the driver supports one
   * @throws bridgestore.ConfigurationException if the config's address cannot be translated
   */
  JdbcTarget target(DatabaseConfig config, Duration connectTimeout);

  /**
   * DDL adding one column.
   */
  String addColumnSql(SchemaColumnRequirement requirement);
}
