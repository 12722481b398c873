package bridgestore.report;

import bridgestore.BridgeStoreException;
import bridgestore.model.ConnectionInfo;
import bridgestore.model.DatabaseConfig;
import bridgestore.url.ConnectionUrl;

/**
 * Turns a {@link DatabaseConfig} into a {@link ConnectionInfo} that is safe to
 * show on a status page. Side-effect free.
 *
 * <p>The password is always masked. With {@code stripCredentials} the username
 * is dropped too.
 */
public final class ConnectionInfoReporter {
  private final boolean stripCredentials;

  public ConnectionInfoReporter() {
    this(false);
  }

  public ConnectionInfoReporter(boolean stripCredentials) {
    this.stripCredentials = stripCredentials;
  }

  /**
   * @param config the active config, or {@code null} if none has been established
   * @return the redacted summary, or {@link ConnectionInfo#notInitialized()} for {@code null}
   */
  public ConnectionInfo report(DatabaseConfig config) {
    if (config == null) {
      return ConnectionInfo.notInitialized();
    }
    return switch (config.driverKind()) {
      case LOCAL -> ConnectionInfo.local(config.connectionAddress(), config.migrationsLocation());
      case REMOTE -> reportRemote(config);
    };
  }

  private ConnectionInfo reportRemote(DatabaseConfig config) {
    ConnectionUrl url;
    try {
      url = ConnectionUrl.parse(config.connectionAddress());
    } catch (BridgeStoreException e) {
      // configs are validated on resolution; never fall back to the raw string
      return ConnectionInfo.remote(ConnectionUrl.MASK, ConnectionUrl.MASK, ConnectionUrl.DEFAULT_PORT,
          null, ConnectionUrl.MASK, config.migrationsLocation());
    }
    String shown = stripCredentials ? url.withoutCredentials() : url.redacted();
    String user = stripCredentials ? null : url.user().orElse(null);
    return ConnectionInfo.remote(shown, url.host(), url.port(), user, url.database(),
        config.migrationsLocation());
  }
}
