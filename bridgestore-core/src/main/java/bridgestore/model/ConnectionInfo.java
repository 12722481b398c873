package bridgestore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Redacted, human-safe summary of the active connection, for status endpoints.
 *
 * <p>Never holds the raw connection string. Instances are derived on demand
 * by {@link bridgestore.report.ConnectionInfoReporter}; use
 * {@link #notInitialized()} when no config has been established yet.
 */
public final class ConnectionInfo {
  private static final ConnectionInfo NOT_INITIALIZED = new ConnectionInfo(
      null, null, null, null, null, null, null, null);

  private final DriverKind backendKind;
  private final String hostRedacted;
  private final String host;
  private final Integer port;
  private final String user;
  private final String database;
  private final String storagePath;
  private final String migrationsPath;

  private ConnectionInfo(DriverKind backendKind, String hostRedacted, String host, Integer port,
      String user, String database, String storagePath, String migrationsPath) {
    this.backendKind = backendKind;
    this.hostRedacted = hostRedacted;
    this.host = host;
    this.port = port;
    this.user = user;
    this.database = database;
    this.storagePath = storagePath;
    this.migrationsPath = migrationsPath;
  }

  /**
   * Summary of a remote connection.
   *
   * @param hostRedacted full URL with the secret masked (or credentials stripped)
   * @param user         username, or {@code null} when credentials are stripped
   */
  public static ConnectionInfo remote(String hostRedacted, String host, int port,
      String user, String database, String migrationsPath) {
    return new ConnectionInfo(DriverKind.REMOTE,
        Objects.requireNonNull(hostRedacted, "hostRedacted"),
        Objects.requireNonNull(host, "host"), port, user,
        Objects.requireNonNull(database, "database"), null,
        Objects.requireNonNull(migrationsPath, "migrationsPath"));
  }

  public static ConnectionInfo local(String storagePath, String migrationsPath) {
    return new ConnectionInfo(DriverKind.LOCAL, null, null, null, null, null,
        Objects.requireNonNull(storagePath, "storagePath"),
        Objects.requireNonNull(migrationsPath, "migrationsPath"));
  }

  /** Distinguished state returned before initialization has produced a config. */
  public static ConnectionInfo notInitialized() {
    return NOT_INITIALIZED;
  }

  public boolean isInitialized() {
    return backendKind != null;
  }

  public Optional<DriverKind> backendKind() {
    return Optional.ofNullable(backendKind);
  }

  public boolean isRemote() {
    return backendKind == DriverKind.REMOTE;
  }

  public Optional<String> hostRedacted() {
    return Optional.ofNullable(hostRedacted);
  }

  public Optional<String> storagePath() {
    return Optional.ofNullable(storagePath);
  }

  public Optional<String> user() {
    return Optional.ofNullable(user);
  }

  /**
   * Flattens to the status-surface mapping: {@code type}, {@code is_remote},
   * {@code driver}, {@code migrations_path}, then {@code path} for local or
   * {@code url}/{@code host}/{@code port}/{@code user}/{@code database} for remote.
   */
  public Map<String, Object> toStatusMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (backendKind == null) {
      map.put("type", "uninitialized");
      map.put("is_remote", false);
      return Collections.unmodifiableMap(map);
    }
    map.put("type", backendKind.type());
    map.put("is_remote", isRemote());
    map.put("driver", backendKind.driver());
    map.put("migrations_path", migrationsPath);
    if (backendKind == DriverKind.LOCAL) {
      map.put("path", storagePath);
    } else {
      map.put("url", hostRedacted);
      map.put("host", host);
      map.put("port", port);
      if (user != null) {
        map.put("user", user);
      }
      map.put("database", database);
    }
    return Collections.unmodifiableMap(map);
  }

  @Override
  public String toString() {
    return "ConnectionInfo" + toStatusMap();
  }
}
