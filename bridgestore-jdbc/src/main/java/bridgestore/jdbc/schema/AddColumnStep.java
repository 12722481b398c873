package bridgestore.jdbc.schema;

import bridgestore.jdbc.spi.Dialect;
import bridgestore.model.SchemaColumnRequirement;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Adds a column when the catalog says it is missing.
 */
public final class AddColumnStep implements MigrationStep {
  private final SchemaColumnRequirement requirement;
  private final Dialect dialect;

  public AddColumnStep(SchemaColumnRequirement requirement, Dialect dialect) {
    this.requirement = Objects.requireNonNull(requirement, "requirement");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public SchemaColumnRequirement requirement() {
    return requirement;
  }

  @Override
  public String target() {
    return requirement.qualifiedName();
  }

  @Override
  public boolean isApplied(Connection conn) throws SQLException {
    return CatalogInspector.columnExists(conn, requirement.table(), requirement.column());
  }

  @Override
  public void apply(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute(dialect.addColumnSql(requirement));
    }
  }

  @Override
  public String toString() {
    return "AddColumnStep[" + target() + " " + requirement.sqlType() + "]";
  }
}
