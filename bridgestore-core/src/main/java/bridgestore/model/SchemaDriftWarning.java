package bridgestore.model;

/**
 * Non-fatal record of a schema correction that could not be applied.
 *
 * @param target    {@code table.column} the correction was meant for
 * @param detail    driver error message, password-scrubbed
 */
public record SchemaDriftWarning(String target, String detail) {}
