/**
 * Spring Boot auto-configuration for bridgestore.
 *
 * <p>Adding the starter is enough: the adapter resolves {@code DATABASE_URL}
 * (from the environment, application properties or a {@code .env} file), falls
 * back to local storage if the remote database is unusable, and publishes the
 * {@link bridgestore.spi.StorageHandle}, the {@link bridgestore.DatabaseAdapter}
 * for status reporting, and a {@link javax.sql.DataSource}.
 *
 * <pre>
 * bridgestore.local-storage-path=/var/lib/bridge/store/bridgestore
 * bridgestore.probe-timeout=5s
 * bridgestore.pool.max-size=10
 * </pre>
 */
package bridgestore.spring.boot;
