package bridgestore.jdbc.schema;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Catalog lookups through {@link DatabaseMetaData}, independent of the engine's
 * information schema dialect.
 *
 * <p>Unquoted identifiers are folded the way the engine stores them (upper case
 * for H2, lower case for PostgreSQL) and LIKE wildcards in names are escaped.
 */
public final class CatalogInspector {

  private CatalogInspector() {}

  /** Returns whether a table of any type with this name exists in any schema. */
  public static boolean tableExists(Connection conn, String table) throws SQLException {
    DatabaseMetaData md = conn.getMetaData();
    String name = fold(md, table);
    try (ResultSet rs = md.getTables(null, null, escape(md, name), null)) {
      while (rs.next()) {
        if (name.equals(rs.getString("TABLE_NAME"))) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns whether {@code table} has a column named {@code column}. */
  public static boolean columnExists(Connection conn, String table, String column) throws SQLException {
    DatabaseMetaData md = conn.getMetaData();
    String tableName = fold(md, table);
    String columnName = fold(md, column);
    try (ResultSet rs = md.getColumns(null, null, escape(md, tableName), escape(md, columnName))) {
      while (rs.next()) {
        if (tableName.equals(rs.getString("TABLE_NAME"))
            && columnName.equals(rs.getString("COLUMN_NAME"))) {
          return true;
        }
      }
    }
    return false;
  }

  static String fold(DatabaseMetaData md, String identifier) throws SQLException {
    if (md.storesUpperCaseIdentifiers()) {
      return identifier.toUpperCase(Locale.ROOT);
    }
    if (md.storesLowerCaseIdentifiers()) {
      return identifier.toLowerCase(Locale.ROOT);
    }
    return identifier;
  }

  private static String escape(DatabaseMetaData md, String name) throws SQLException {
    String escape = md.getSearchStringEscape();
    if (escape == null || escape.isEmpty()) {
      return name;
    }
    return name.replace(escape, escape + escape)
        .replace("_", escape + "_")
        .replace("%", escape + "%");
  }
}
