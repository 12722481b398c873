/**
 * Built-in dialects and the {@link bridgestore.jdbc.dialect.Dialects} registry.
 */
package bridgestore.jdbc.dialect;
