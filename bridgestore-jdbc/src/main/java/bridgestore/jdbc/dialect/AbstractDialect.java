package bridgestore.jdbc.dialect;

import bridgestore.jdbc.spi.Dialect;
import bridgestore.model.DatabaseConfig;
import bridgestore.model.SchemaColumnRequirement;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String addColumnSql(SchemaColumnRequirement requirement) {
    StringBuilder sql = new StringBuilder("ALTER TABLE ")
        .append(requirement.table())
        .append(" ADD COLUMN ")
        .append(requirement.column())
        .append(' ')
        .append(requirement.sqlType());
    requirement.defaultValue().ifPresent(def -> sql.append(" DEFAULT ").append(def));
    return sql.toString();
  }

  protected void checkKind(DatabaseConfig config) {
    if (config.driverKind() != driverKind()) {
      throw new IllegalArgumentException("Dialect " + name() + " cannot handle a "
          + config.driverKind() + " config");
    }
  }
}
