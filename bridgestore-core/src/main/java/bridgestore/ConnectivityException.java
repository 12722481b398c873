package bridgestore;

import java.util.Objects;
import java.util.Optional;

/**
 * The last available backend could not be reached.
 *
 * <p>When the adapter already fell back from remote, the remote failure is kept
 * alongside the local one so operators can see why the fallback happened.
 */
public final class ConnectivityException extends BridgeStoreException {
  private final String remoteFailure;
  private final String localFailure;

  public ConnectivityException(String remoteFailure, String localFailure) {
    super(message(remoteFailure, Objects.requireNonNull(localFailure, "localFailure")));
    this.remoteFailure = remoteFailure;
    this.localFailure = localFailure;
  }

  public ConnectivityException(String remoteFailure, String localFailure, Throwable cause) {
    super(message(remoteFailure, Objects.requireNonNull(localFailure, "localFailure")), cause);
    this.remoteFailure = remoteFailure;
    this.localFailure = localFailure;
  }

  /** Remote probe failure, present only if remote was tried first. */
  public Optional<String> remoteFailure() {
    return Optional.ofNullable(remoteFailure);
  }

  public String localFailure() {
    return localFailure;
  }

  private static String message(String remoteFailure, String localFailure) {
    if (remoteFailure == null) {
      return "Local storage unavailable: " + localFailure;
    }
    return "Remote database unavailable (" + remoteFailure
        + ") and local fallback failed: " + localFailure;
  }
}
