package bridgestore.jdbc;

import bridgestore.ConfigurationException;
import bridgestore.StoreCreationException;
import bridgestore.jdbc.dialect.Dialects;
import bridgestore.jdbc.spi.Dialect;
import bridgestore.model.DatabaseConfig;
import bridgestore.model.DriverKind;
import bridgestore.spi.StorageHandle;
import bridgestore.spi.StoreFactory;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates pooled {@link JdbcStorageHandle}s.
 *
 * <p>The pool is started eagerly and fails fast, so a backend that passed its
 * probe but cannot serve pooled connections surfaces as a
 * {@link StoreCreationException} here rather than on first use. Local stores
 * additionally get the embedded schema applied.
 *
 * <pre>{@code
 * StoreFactory factory = HikariStoreFactory.builder()
 *     .maxPoolSize(20)
 *     .build();
 * }</pre>
 */
public final class HikariStoreFactory implements StoreFactory {
  private static final Logger logger = Logger.getLogger(HikariStoreFactory.class.getName());

  public static final int DEFAULT_MAX_POOL_SIZE = 10;
  public static final int DEFAULT_MIN_IDLE = 5;
  public static final Duration DEFAULT_MAX_LIFETIME = Duration.ofHours(1);
  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);

  private final int maxPoolSize;
  private final int minIdle;
  private final Duration maxLifetime;
  private final Duration connectionTimeout;
  private final LocalSchemaInitializer localSchema;

  private HikariStoreFactory(Builder builder) {
    this.maxPoolSize = builder.maxPoolSize;
    this.minIdle = builder.minIdle;
    this.maxLifetime = builder.maxLifetime;
    this.connectionTimeout = builder.connectionTimeout;
    this.localSchema = builder.localSchema;
    if (maxPoolSize < 1) {
      throw new ConfigurationException("maxPoolSize must be >= 1");
    }
    if (minIdle < 0 || minIdle > maxPoolSize) {
      throw new ConfigurationException("minIdle must be between 0 and maxPoolSize");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public StorageHandle create(DatabaseConfig config) {
    Dialect dialect = Dialects.forKind(config.driverKind());
    HikariDataSource dataSource = open(config, dialect);
    if (config.driverKind() == DriverKind.LOCAL) {
      try {
        localSchema.apply(dataSource);
      } catch (RuntimeException e) {
        dataSource.close();
        throw new StoreCreationException("Failed to initialize local schema", e);
      }
    }
    logger.log(Level.INFO, "Created {0} store pool {1} (max {2})",
        new Object[]{config.driverKind().type(), dataSource.getPoolName(), maxPoolSize});
    return new JdbcStorageHandle(dataSource, config);
  }

  private HikariDataSource open(DatabaseConfig config, Dialect dialect) {
    try {
      JdbcTarget target = dialect.target(config, connectionTimeout);
      HikariConfig hikari = new HikariConfig();
      hikari.setPoolName("bridgestore-" + config.driverKind().type());
      hikari.setDriverClassName(dialect.driverClassName());
      hikari.setJdbcUrl(target.url());
      hikari.setDataSourceProperties(target.properties());
      hikari.setMaximumPoolSize(maxPoolSize);
      hikari.setMinimumIdle(minIdle);
      hikari.setMaxLifetime(maxLifetime.toMillis());
      hikari.setConnectionTimeout(connectionTimeout.toMillis());
      hikari.setInitializationFailTimeout(1);
      return new HikariDataSource(hikari);
    } catch (RuntimeException e) {
      throw new StoreCreationException("Failed to create " + config.driverKind().type()
          + " connection pool: " + e.getMessage(), e);
    }
  }

  /** Builder for {@link HikariStoreFactory}. */
  public static final class Builder {
    private int maxPoolSize = DEFAULT_MAX_POOL_SIZE;
    private int minIdle = DEFAULT_MIN_IDLE;
    private Duration maxLifetime = DEFAULT_MAX_LIFETIME;
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private LocalSchemaInitializer localSchema = new LocalSchemaInitializer();

    private Builder() {}

    /**
     * Optional. Defaults to {@value HikariStoreFactory#DEFAULT_MAX_POOL_SIZE}.
     */
    public Builder maxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
      return this;
    }

    /**
     * Optional. Defaults to {@value HikariStoreFactory#DEFAULT_MIN_IDLE}.
     */
    public Builder minIdle(int minIdle) {
      this.minIdle = minIdle;
      return this;
    }

    /**
     * Sets how long a pooled connection may live before it is retired.
     *
     * <p>Optional. Defaults to 1 hour. HikariCP enforces a 30 second minimum.
     */
    public Builder maxLifetime(Duration maxLifetime) {
      this.maxLifetime = Objects.requireNonNull(maxLifetime, "maxLifetime");
      return this;
    }

    /**
     * Sets how long a caller waits for a pooled connection.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
      return this;
    }

    /**
     * Sets the schema script applied to local stores.
     *
     * <p>Optional. Defaults to {@value LocalSchemaInitializer#DEFAULT_RESOURCE}.
     */
    public Builder localSchema(LocalSchemaInitializer localSchema) {
      this.localSchema = Objects.requireNonNull(localSchema, "localSchema");
      return this;
    }

    public HikariStoreFactory build() {
      return new HikariStoreFactory(this);
    }
  }
}
