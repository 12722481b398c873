/**
 * JDBC implementation of the adapter's collaborators.
 *
 * <p>{@link bridgestore.jdbc.JdbcDatabaseAdapters} wires everything together.
 * Probing uses unpooled {@link java.sql.DriverManager} connections; the store
 * handed to the application is a HikariCP pool.
 */
package bridgestore.jdbc;
