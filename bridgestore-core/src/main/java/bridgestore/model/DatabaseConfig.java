package bridgestore.model;

import java.util.Objects;

/**
 * Immutable description of one connection attempt.
 *
 * <p>For {@link DriverKind#REMOTE} the {@code connectionAddress} is the raw
 * {@code postgres://} URL and may carry credentials; it must never be logged or
 * reported as-is. For {@link DriverKind#LOCAL} it is a filesystem path and is
 * rejected if it looks like it carries credentials.
 *
 * @param driverKind         backend this config targets
 * @param connectionAddress  URL (remote) or storage path (local)
 * @param migrationsLocation descriptive only; never executed by the adapter
 */
public record DatabaseConfig(
    DriverKind driverKind,
    String connectionAddress,
    String migrationsLocation
) {

  public DatabaseConfig {
    Objects.requireNonNull(driverKind, "driverKind");
    Objects.requireNonNull(connectionAddress, "connectionAddress");
    Objects.requireNonNull(migrationsLocation, "migrationsLocation");
    if (connectionAddress.isEmpty()) {
      throw new IllegalArgumentException("connectionAddress cannot be empty");
    }
    if (driverKind == DriverKind.LOCAL
        && (connectionAddress.contains("@") || connectionAddress.contains("://"))) {
      throw new IllegalArgumentException("Local storage path must not carry credentials");
    }
  }

  public static DatabaseConfig remote(String url, String migrationsLocation) {
    return new DatabaseConfig(DriverKind.REMOTE, url, migrationsLocation);
  }

  public static DatabaseConfig local(String path, String migrationsLocation) {
    return new DatabaseConfig(DriverKind.LOCAL, path, migrationsLocation);
  }

  public boolean isRemote() {
    return driverKind == DriverKind.REMOTE;
  }

  /** Keeps the raw address out of accidental log output. */
  @Override
  public String toString() {
    return "DatabaseConfig[driverKind=" + driverKind
        + ", connectionAddress=" + (isRemote() ? "<redacted>" : connectionAddress)
        + ", migrationsLocation=" + migrationsLocation + "]";
  }
}
