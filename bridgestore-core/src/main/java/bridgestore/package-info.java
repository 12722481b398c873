/**
 * Startup database selection for the bridge: use the remote PostgreSQL named by
 * {@code DATABASE_URL} if it is reachable and migrated, otherwise fall back to an
 * embedded H2 file, and hand back one pooled {@linkplain bridgestore.spi.StorageHandle
 * storage handle} for the rest of the process.
 *
 * <h2>Core Design</h2>
 * <p>{@link bridgestore.DatabaseAdapter} owns the whole decision. It resolves a
 * {@linkplain bridgestore.model.DatabaseConfig config} from the environment, probes it
 * with a bounded {@linkplain bridgestore.spi.ConnectionTester tester}, reconciles the
 * remote schema additively, and asks a {@linkplain bridgestore.spi.StoreFactory store
 * factory} for the handle. A remote probe failure triggers exactly one local attempt;
 * remote is never retried. Configuration errors fail before any connection is opened.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>bridgestore-core</b>: model, URL parsing, config resolution, reporting, SPIs,
 *       the adapter state machine (zero external deps)</li>
 *   <li><b>bridgestore-jdbc</b>: PostgreSQL and H2 dialects, JDBC probe, schema
 *       reconciler, HikariCP-backed storage handles</li>
 *   <li><b>bridgestore-micrometer</b>: metrics exporter</li>
 *   <li><b>bridgestore-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * DatabaseAdapter adapter = JdbcDatabaseAdapters.create(AdapterSettings.defaults());
 * InitializationResult result = adapter.initialize();
 *
 * StorageHandle store = result.handle();
 * store.query("SELECT jid FROM whatsmeow_device", rs -> rs.getString(1));
 *
 * // later, from a status endpoint
 * Map<String, Object> status = adapter.status();
 * }</pre>
 *
 * @see bridgestore.DatabaseAdapter
 * @see bridgestore.config.ConfigResolver
 * @see bridgestore.report.ConnectionInfoReporter
 */
package bridgestore;
