package bridgestore;

import bridgestore.config.AdapterSettings;
import bridgestore.config.ConfigResolver;
import bridgestore.config.Environment;
import bridgestore.model.AdapterState;
import bridgestore.model.ConnectionInfo;
import bridgestore.model.ConnectionProbeResult;
import bridgestore.model.DatabaseConfig;
import bridgestore.model.DriverKind;
import bridgestore.model.ReconciliationReport;
import bridgestore.model.SchemaDriftWarning;
import bridgestore.report.ConnectionInfoReporter;
import bridgestore.spi.ConnectionFactory;
import bridgestore.spi.ConnectionTester;
import bridgestore.spi.MetricsExporter;
import bridgestore.spi.SchemaReconciler;
import bridgestore.spi.StorageHandle;
import bridgestore.spi.StoreFactory;
import bridgestore.url.ConnectionUrl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses, verifies and opens the process's database, once, at startup.
 *
 * <p>{@link #initialize()} runs the state machine described on
 * {@link AdapterState}:
 * <ol>
 *   <li>Resolve config. A malformed {@code DATABASE_URL} fails here, before any
 *       connection is attempted.</li>
 *   <li>Remote requested: probe it once. Usable means reachable and the
 *       required table exists; then reconcile schema and create the store.</li>
 *   <li>Remote unusable (including timeout): do not retry it. Resolve the local
 *       config and probe that once. A local failure is fatal and reports both
 *       causes.</li>
 *   <li>No remote requested: probe local; failure is fatal.</li>
 * </ol>
 *
 * <p>All state lives in this instance; nothing is global. Reporting methods
 * ({@link #state()}, {@link #connectionInfo()}, {@link #status()}) are safe to
 * call from any thread at any time, including before initialization.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DatabaseAdapter adapter = JdbcDatabaseAdapters.create(AdapterSettings.defaults());
 * InitializationResult result = adapter.initialize();
 * StorageHandle store = result.handle();
 * }</pre>
 *
 * @see ConfigResolver
 * @see ConnectionTester
 * @see SchemaReconciler
 * @see StoreFactory
 */
public final class DatabaseAdapter {
  private static final Logger logger = Logger.getLogger(DatabaseAdapter.class.getName());

  private final ConfigResolver resolver;
  private final ConnectionTester connectionTester;
  private final ConnectionFactory connectionFactory;
  private final SchemaReconciler schemaReconciler;
  private final StoreFactory storeFactory;
  private final ConnectionInfoReporter reporter;
  private final MetricsExporter metrics;
  private final AdapterStatus status = new AdapterStatus();

  private DatabaseAdapter(Builder builder) {
    this.connectionTester = Objects.requireNonNull(builder.connectionTester, "connectionTester");
    this.connectionFactory = Objects.requireNonNull(builder.connectionFactory, "connectionFactory");
    this.schemaReconciler = Objects.requireNonNull(builder.schemaReconciler, "schemaReconciler");
    this.storeFactory = Objects.requireNonNull(builder.storeFactory, "storeFactory");
    AdapterSettings settings = builder.settings != null ? builder.settings : AdapterSettings.defaults();
    Environment environment = builder.environment != null ? builder.environment : Environment.system();
    this.resolver = new ConfigResolver(environment, settings);
    this.reporter = new ConnectionInfoReporter(settings.stripCredentials());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs initialization to {@link AdapterState#READY} or {@link AdapterState#FATAL}.
   *
   * @return the storage handle and diagnostics
   * @throws ConfigurationException  malformed URL or unusable local storage directory
   * @throws ConnectivityException   the last candidate backend could not be probed successfully,
   *     or the local fallback failed in any way after a remote failure
   * @throws StoreCreationException  the probed backend could not allocate its handle
   * @throws IllegalStateException   if called more than once
   */
  public synchronized InitializationResult initialize() {
    if (status.state() != AdapterState.UNCONFIGURED) {
      throw new IllegalStateException("DatabaseAdapter already initialized (state " + status.state() + ")");
    }
    long startNanos = System.nanoTime();
    try {
      return run(startNanos);
    } catch (RuntimeException e) {
      status.fail();
      logger.log(Level.SEVERE, "Database initialization failed: " + e.getMessage(), e);
      throw e;
    } finally {
      metrics.recordInitializationMs(Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
    }
  }

  public AdapterState state() {
    return status.state();
  }

  /**
   * Redacted summary of the config currently in play. Reflects a fallback as
   * soon as it starts; {@link ConnectionInfo#notInitialized()} before any config
   * has been resolved.
   */
  public ConnectionInfo connectionInfo() {
    return reporter.report(status.activeConfig().orElse(null));
  }

  /** Diagnostics of the completed initialization, if it succeeded. */
  public Optional<InitializationReport> report() {
    return status.report();
  }

  /**
   * Status-surface mapping for HTTP layers: the {@link ConnectionInfo#toStatusMap()}
   * keys plus {@code state}, {@code remote_error} when a fallback happened and
   * {@code schema_warnings} when reconciliation left drift behind. Never
   * contains the raw connection string.
   */
  public Map<String, Object> status() {
    Map<String, Object> map = new LinkedHashMap<>(connectionInfo().toStatusMap());
    map.put("state", status.state().name().toLowerCase(Locale.ROOT));
    status.remoteFailure().ifPresent(detail -> map.put("remote_error", detail));
    status.report()
        .map(r -> r.schema().warnings())
        .filter(w -> !w.isEmpty())
        .ifPresent(w -> map.put("schema_warnings",
            w.stream().map(d -> d.target() + ": " + d.detail()).toList()));
    return Collections.unmodifiableMap(map);
  }

  private InitializationResult run(long startNanos) {
    DatabaseConfig preferred = resolver.resolve();
    if (!preferred.isRemote()) {
      logger.log(Level.INFO, "No remote database configured, using local storage at {0}",
          preferred.connectionAddress());
      return probeLocal(preferred, null, startNanos);
    }

    status.transition(AdapterState.PROBING_REMOTE);
    status.activate(preferred);
    logger.log(Level.INFO, "Probing remote database {0}", ConnectionUrl.parse(preferred.connectionAddress()));
    ConnectionProbeResult remote = probe(preferred);
    if (remote.isUsable()) {
      status.transition(AdapterState.SCHEMA_RECONCILING);
      ReconciliationReport schema = reconcile(preferred);
      return ready(preferred, null, schema, startNanos);
    }

    String remoteFailure = remote.errorDetail().orElse("remote database unusable");
    status.recordRemoteFailure(remoteFailure);
    metrics.incrementFallback();
    logger.log(Level.WARNING, "Remote database unavailable ({0}), falling back to local storage",
        remoteFailure);
    try {
      return probeLocal(resolver.resolveLocal(), remoteFailure, startNanos);
    } catch (ConnectivityException e) {
      throw e;
    } catch (BridgeStoreException e) {
      throw new ConnectivityException(remoteFailure, e.getMessage(), e);
    }
  }

  private InitializationResult probeLocal(DatabaseConfig local, String remoteFailure, long startNanos) {
    status.transition(AdapterState.PROBING_LOCAL);
    status.activate(local);
    ConnectionProbeResult result = probe(local);
    if (!result.isUsable()) {
      throw new ConnectivityException(remoteFailure,
          result.errorDetail().orElse("local storage unusable"));
    }
    return ready(local, remoteFailure, ReconciliationReport.skipped(), startNanos);
  }

  private ConnectionProbeResult probe(DatabaseConfig config) {
    DriverKind kind = config.driverKind();
    metrics.incrementProbeAttempt(kind);
    ConnectionProbeResult result = connectionTester.test(config);
    if (!result.isUsable()) {
      metrics.incrementProbeFailure(kind);
    }
    return result;
  }

  private ReconciliationReport reconcile(DatabaseConfig config) {
    ReconciliationReport report;
    try (Connection conn = connectionFactory.open(config)) {
      report = schemaReconciler.reconcile(conn);
    } catch (SQLException | RuntimeException e) {
      String detail = ConnectionUrl.parse(config.connectionAddress()).scrub(e.getMessage());
      logger.log(Level.WARNING, "Schema reconciliation could not run: {0}", detail);
      report = new ReconciliationReport(List.of(), List.of(),
          List.of(new SchemaDriftWarning("*", String.valueOf(detail))));
    }
    metrics.recordSchemaCorrections(report.applied().size(), report.warnings().size());
    return report;
  }

  private InitializationResult ready(DatabaseConfig config, String remoteFailure,
      ReconciliationReport schema, long startNanos) {
    StorageHandle handle = createStore(config);
    status.transition(AdapterState.READY);
    InitializationReport report = new InitializationReport(config.driverKind(),
        Optional.ofNullable(remoteFailure), schema,
        Duration.ofNanos(System.nanoTime() - startNanos));
    status.complete(report);
    metrics.recordActiveBackend(config.driverKind());
    logger.log(Level.INFO, "Database ready: {0}", reporter.report(config));
    return new InitializationResult(handle, config, report);
  }

  private StorageHandle createStore(DatabaseConfig config) {
    try {
      return storeFactory.create(config);
    } catch (StoreCreationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreCreationException("Failed to create " + config.driverKind().type() + " store", e);
    }
  }

  /** Builder for {@link DatabaseAdapter}. */
  public static final class Builder {
    private Environment environment;
    private AdapterSettings settings;
    private ConnectionTester connectionTester;
    private ConnectionFactory connectionFactory;
    private SchemaReconciler schemaReconciler;
    private StoreFactory storeFactory;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets where {@code DATABASE_URL} is read from.
     *
     * <p>Optional. Defaults to {@link Environment#system()}.
     */
    public Builder environment(Environment environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Sets the URL variable, local path, probe timeout and schema requirements.
     *
     * <p>Optional. Defaults to {@link AdapterSettings#defaults()}.
     */
    public Builder settings(AdapterSettings settings) {
      this.settings = settings;
      return this;
    }

    /** <b>Required.</b> */
    public Builder connectionTester(ConnectionTester connectionTester) {
      this.connectionTester = connectionTester;
      return this;
    }

    /**
     * Sets the factory used to open the reconciliation connection.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionFactory(ConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder schemaReconciler(SchemaReconciler schemaReconciler) {
      this.schemaReconciler = schemaReconciler;
      return this;
    }

    /** <b>Required.</b> */
    public Builder storeFactory(StoreFactory storeFactory) {
      this.storeFactory = storeFactory;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     */
    public DatabaseAdapter build() {
      return new DatabaseAdapter(this);
    }
  }
}
