package bridgestore.config;

import bridgestore.ConfigurationException;
import bridgestore.model.SchemaColumnRequirement;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings shared by the adapter and its collaborators.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} matches the
 * stock deployment (reads {@code DATABASE_URL}, falls back to
 * {@code store/bridgestore}, 5 second probes).
 */
public final class AdapterSettings {
  public static final String DEFAULT_URL_VARIABLE = "DATABASE_URL";
  public static final Path DEFAULT_LOCAL_STORAGE_PATH = Path.of("store", "bridgestore");
  public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);
  public static final String DEFAULT_REMOTE_MIGRATIONS = "supabase/migrations";
  public static final String DEFAULT_LOCAL_MIGRATIONS = "embedded:bridgestore/schema/h2.sql";

  private final String databaseUrlVariable;
  private final Path localStoragePath;
  private final Duration probeTimeout;
  private final String requiredTable;
  private final List<SchemaColumnRequirement> schemaRequirements;
  private final String remoteMigrationsLocation;
  private final String localMigrationsLocation;
  private final boolean stripCredentials;

  private AdapterSettings(Builder builder) {
    this.databaseUrlVariable = Objects.requireNonNull(builder.databaseUrlVariable, "databaseUrlVariable");
    this.localStoragePath = Objects.requireNonNull(builder.localStoragePath, "localStoragePath");
    this.probeTimeout = Objects.requireNonNull(builder.probeTimeout, "probeTimeout");
    this.requiredTable = Objects.requireNonNull(builder.requiredTable, "requiredTable");
    this.schemaRequirements = List.copyOf(Objects.requireNonNull(builder.schemaRequirements, "schemaRequirements"));
    this.remoteMigrationsLocation = Objects.requireNonNull(builder.remoteMigrationsLocation, "remoteMigrationsLocation");
    this.localMigrationsLocation = Objects.requireNonNull(builder.localMigrationsLocation, "localMigrationsLocation");
    this.stripCredentials = builder.stripCredentials;

    if (databaseUrlVariable.isBlank()) {
      throw new ConfigurationException("databaseUrlVariable cannot be blank");
    }
    if (localStoragePath.getFileName() == null) {
      throw new ConfigurationException("localStoragePath must name a file");
    }
    if (probeTimeout.isZero() || probeTimeout.isNegative()) {
      throw new ConfigurationException("probeTimeout must be > 0");
    }
    if (!requiredTable.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new ConfigurationException("Invalid required table name: " + requiredTable);
    }
  }

  public static AdapterSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String databaseUrlVariable() {
    return databaseUrlVariable;
  }

  public Path localStoragePath() {
    return localStoragePath;
  }

  public Duration probeTimeout() {
    return probeTimeout;
  }

  public String requiredTable() {
    return requiredTable;
  }

  public List<SchemaColumnRequirement> schemaRequirements() {
    return schemaRequirements;
  }

  public String remoteMigrationsLocation() {
    return remoteMigrationsLocation;
  }

  public String localMigrationsLocation() {
    return localMigrationsLocation;
  }

  public boolean stripCredentials() {
    return stripCredentials;
  }

  /** Builder for {@link AdapterSettings}. */
  public static final class Builder {
    private String databaseUrlVariable = DEFAULT_URL_VARIABLE;
    private Path localStoragePath = DEFAULT_LOCAL_STORAGE_PATH;
    private Duration probeTimeout = DEFAULT_PROBE_TIMEOUT;
    private String requiredTable = SchemaRequirements.DEVICE_TABLE;
    private List<SchemaColumnRequirement> schemaRequirements = SchemaRequirements.LATEST;
    private String remoteMigrationsLocation = DEFAULT_REMOTE_MIGRATIONS;
    private String localMigrationsLocation = DEFAULT_LOCAL_MIGRATIONS;
    private boolean stripCredentials;

    private Builder() {}

    /**
     * Sets the environment variable holding the remote connection URL.
     *
     * <p>Optional. Defaults to {@code DATABASE_URL}.
     */
    public Builder databaseUrlVariable(String databaseUrlVariable) {
      this.databaseUrlVariable = databaseUrlVariable;
      return this;
    }

    /**
     * Sets the embedded database file path, without the engine's file suffix.
     * The parent directory is created on demand.
     *
     * <p>Optional. Defaults to {@code store/bridgestore}.
     */
    public Builder localStoragePath(Path localStoragePath) {
      this.localStoragePath = localStoragePath;
      return this;
    }

    /**
     * Sets the upper bound for each connection probe. A probe that exceeds it
     * counts as unreachable.
     *
     * <p>Optional. Defaults to 5 seconds. Must be &gt; 0.
     */
    public Builder probeTimeout(Duration probeTimeout) {
      this.probeTimeout = probeTimeout;
      return this;
    }

    /**
     * Sets the table whose presence marks a remote database as migrated.
     *
     * <p>Optional. Defaults to {@value SchemaRequirements#DEVICE_TABLE}.
     */
    public Builder requiredTable(String requiredTable) {
      this.requiredTable = requiredTable;
      return this;
    }

    /**
     * Sets the additive column corrections applied to a remote database.
     *
     * <p>Optional. Defaults to {@link SchemaRequirements#LATEST}.
     */
    public Builder schemaRequirements(List<SchemaColumnRequirement> schemaRequirements) {
      this.schemaRequirements = schemaRequirements;
      return this;
    }

    public Builder remoteMigrationsLocation(String remoteMigrationsLocation) {
      this.remoteMigrationsLocation = remoteMigrationsLocation;
      return this;
    }

    public Builder localMigrationsLocation(String localMigrationsLocation) {
      this.localMigrationsLocation = localMigrationsLocation;
      return this;
    }

    /**
     * When true, reports drop the username as well as the password.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder stripCredentials(boolean stripCredentials) {
      this.stripCredentials = stripCredentials;
      return this;
    }

    /**
     * @throws NullPointerException     if a required value was set to null
     * @throws ConfigurationException   if a value is out of range
     */
    public AdapterSettings build() {
      return new AdapterSettings(this);
    }
  }
}
