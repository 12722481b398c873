package bridgestore.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One additive column correction: {@code ALTER TABLE table ADD COLUMN column sqlType [DEFAULT ...]}.
 *
 * <p>Requirements are fixed data known at build time (see
 * {@link bridgestore.config.SchemaRequirements}), never user input, but the
 * identifiers are still validated since they are spliced into DDL.
 *
 * @param table             target table
 * @param column            column to add when absent
 * @param sqlType           declared SQL type, e.g. {@code BIGINT}
 * @param defaultExpression SQL default expression, or {@code null} for none
 */
public record SchemaColumnRequirement(
    String table,
    String column,
    String sqlType,
    String defaultExpression
) {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public SchemaColumnRequirement {
    validateIdentifier(table, "table");
    validateIdentifier(column, "column");
    Objects.requireNonNull(sqlType, "sqlType");
    if (sqlType.isBlank()) {
      throw new IllegalArgumentException("sqlType cannot be blank");
    }
  }

  public Optional<String> defaultValue() {
    return Optional.ofNullable(defaultExpression);
  }

  /** {@code table.column}, used in logs and reports. */
  public String qualifiedName() {
    return table + "." + column;
  }

  private static void validateIdentifier(String value, String what) {
    Objects.requireNonNull(value, what);
    if (!value.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid " + what + " name: " + value);
    }
  }
}
