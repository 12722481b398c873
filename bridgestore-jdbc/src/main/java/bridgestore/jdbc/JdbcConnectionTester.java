package bridgestore.jdbc;

import bridgestore.ConfigurationException;
import bridgestore.config.AdapterSettings;
import bridgestore.config.SchemaRequirements;
import bridgestore.jdbc.schema.CatalogInspector;
import bridgestore.model.ConnectionProbeResult;
import bridgestore.model.DatabaseConfig;
import bridgestore.spi.ConnectionFactory;
import bridgestore.spi.ConnectionTester;
import bridgestore.url.ConnectionUrl;
import bridgestore.util.ProbeThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probes a backend by opening a connection, validating it and, for remote
 * backends, checking the catalog for the required table.
 *
 * <p>The whole probe runs on a daemon thread bounded by {@link Builder#timeout}.
 * A probe that exceeds it is reported as unreachable; the abandoned attempt
 * still closes its connection when the driver returns. Failures are always
 * returned as a {@link ConnectionProbeResult}, never thrown, and error details
 * have the URL's password masked.
 */
public final class JdbcConnectionTester implements ConnectionTester {
  private static final Logger logger = Logger.getLogger(JdbcConnectionTester.class.getName());

  private final ConnectionFactory connectionFactory;
  private final Duration timeout;
  private final String requiredTable;

  private JdbcConnectionTester(Builder builder) {
    this.connectionFactory = Objects.requireNonNull(builder.connectionFactory, "connectionFactory");
    this.timeout = builder.timeout != null ? builder.timeout : AdapterSettings.DEFAULT_PROBE_TIMEOUT;
    if (timeout.isZero() || timeout.isNegative()) {
      throw new ConfigurationException("timeout must be > 0");
    }
    this.requiredTable = builder.requiredTable != null ? builder.requiredTable : SchemaRequirements.DEVICE_TABLE;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ConnectionProbeResult test(DatabaseConfig config) {
    Objects.requireNonNull(config, "config");
    ExecutorService executor = Executors.newSingleThreadExecutor(new ProbeThreadFactory(config.driverKind()));
    Future<ConnectionProbeResult> future = executor.submit(() -> probe(config));
    try {
      ConnectionProbeResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      logger.log(Level.FINE, "Probe of {0} backend: {1}", new Object[]{config.driverKind().type(), result});
      return result;
    } catch (TimeoutException e) {
      future.cancel(true);
      return ConnectionProbeResult.unreachable("probe timed out after " + timeout.toMillis() + " ms");
    } catch (ExecutionException e) {
      return ConnectionProbeResult.unreachable(describe(config, e.getCause()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return ConnectionProbeResult.unreachable("probe interrupted");
    } finally {
      executor.shutdownNow();
    }
  }

  private ConnectionProbeResult probe(DatabaseConfig config) {
    try (Connection conn = connectionFactory.open(config)) {
      int validSeconds = (int) Math.max(1L, timeout.toSeconds());
      if (!conn.isValid(validSeconds)) {
        return ConnectionProbeResult.unreachable("connection failed validation");
      }
      if (config.isRemote() && !CatalogInspector.tableExists(conn, requiredTable)) {
        return ConnectionProbeResult.schemaMissing("required table " + requiredTable
            + " not found; apply the migrations first");
      }
      return ConnectionProbeResult.healthy();
    } catch (SQLException e) {
      return ConnectionProbeResult.unreachable(describe(config, e));
    }
  }

  static String describe(DatabaseConfig config, Throwable error) {
    StringBuilder detail = new StringBuilder(error.getClass().getSimpleName());
    if (error instanceof SQLException sql && sql.getSQLState() != null) {
      detail.append(" [").append(sql.getSQLState()).append(']');
    }
    if (error.getMessage() != null) {
      detail.append(": ").append(error.getMessage());
    }
    return scrub(config, detail.toString());
  }

  private static String scrub(DatabaseConfig config, String text) {
    if (!config.isRemote()) {
      return text;
    }
    try {
      return ConnectionUrl.parse(config.connectionAddress()).scrub(text);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Cannot parse URL to scrub error detail", e);
      return text;
    }
  }

  /** Builder for {@link JdbcConnectionTester}. */
  public static final class Builder {
    private ConnectionFactory connectionFactory;
    private Duration timeout;
    private String requiredTable;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionFactory(ConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /**
     * Sets the bound on the whole probe, connect included.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets the table whose presence makes a remote backend usable.
     *
     * <p>Optional. Defaults to {@value SchemaRequirements#DEVICE_TABLE}.
     */
    public Builder requiredTable(String requiredTable) {
      this.requiredTable = requiredTable;
      return this;
    }

    public JdbcConnectionTester build() {
      return new JdbcConnectionTester(this);
    }
  }
}
