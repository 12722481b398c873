package bridgestore.spring.boot;

import bridgestore.config.AdapterSettings;
import bridgestore.config.DotEnvEnvironment;
import bridgestore.config.SchemaRequirements;
import bridgestore.jdbc.HikariStoreFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the database adapter.
 *
 * @see BridgeStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "bridgestore")
public class BridgeStoreProperties {

  /**
   * Variable holding the remote connection URL. Resolved through the Spring
   * environment, so OS environment variables and application properties both work.
   */
  private String databaseUrlVariable = AdapterSettings.DEFAULT_URL_VARIABLE;

  /**
   * Embedded database path used when no remote URL is set or the remote is unusable.
   */
  private String localStoragePath = AdapterSettings.DEFAULT_LOCAL_STORAGE_PATH.toString();

  /**
   * Upper bound for each connection probe.
   */
  private Duration probeTimeout = AdapterSettings.DEFAULT_PROBE_TIMEOUT;

  /**
   * Table whose presence marks a remote database as migrated.
   */
  private String requiredTable = SchemaRequirements.DEVICE_TABLE;

  /**
   * Drop the username as well as the password from status reports.
   */
  private boolean stripCredentials;

  private final DotEnv dotenv = new DotEnv();
  private final Pool pool = new Pool();
  private final Metrics metrics = new Metrics();

  public String getDatabaseUrlVariable() {
    return databaseUrlVariable;
  }

  public void setDatabaseUrlVariable(String databaseUrlVariable) {
    this.databaseUrlVariable = databaseUrlVariable;
  }

  public String getLocalStoragePath() {
    return localStoragePath;
  }

  public void setLocalStoragePath(String localStoragePath) {
    this.localStoragePath = localStoragePath;
  }

  public Duration getProbeTimeout() {
    return probeTimeout;
  }

  public void setProbeTimeout(Duration probeTimeout) {
    this.probeTimeout = probeTimeout;
  }

  public String getRequiredTable() {
    return requiredTable;
  }

  public void setRequiredTable(String requiredTable) {
    this.requiredTable = requiredTable;
  }

  public boolean isStripCredentials() {
    return stripCredentials;
  }

  public void setStripCredentials(boolean stripCredentials) {
    this.stripCredentials = stripCredentials;
  }

  public DotEnv getDotenv() {
    return dotenv;
  }

  public Pool getPool() {
    return pool;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  AdapterSettings toSettings() {
    return AdapterSettings.builder()
        .databaseUrlVariable(databaseUrlVariable)
        .localStoragePath(Path.of(localStoragePath))
        .probeTimeout(probeTimeout)
        .requiredTable(requiredTable)
        .stripCredentials(stripCredentials)
        .build();
  }

  HikariStoreFactory toStoreFactory() {
    return HikariStoreFactory.builder()
        .maxPoolSize(pool.getMaxSize())
        .minIdle(pool.getMinIdle())
        .maxLifetime(pool.getMaxLifetime())
        .build();
  }

  public static class DotEnv {
    private boolean enabled = true;
    private String path = DotEnvEnvironment.DEFAULT_PATH.toString();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }
  }

  public static class Pool {
    private int maxSize = HikariStoreFactory.DEFAULT_MAX_POOL_SIZE;
    private int minIdle = HikariStoreFactory.DEFAULT_MIN_IDLE;
    private Duration maxLifetime = HikariStoreFactory.DEFAULT_MAX_LIFETIME;

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    public int getMinIdle() {
      return minIdle;
    }

    public void setMinIdle(int minIdle) {
      this.minIdle = minIdle;
    }

    public Duration getMaxLifetime() {
      return maxLifetime;
    }

    public void setMaxLifetime(Duration maxLifetime) {
      this.maxLifetime = maxLifetime;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "bridgestore";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
