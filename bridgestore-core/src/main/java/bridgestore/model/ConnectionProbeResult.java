package bridgestore.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single liveness and shape probe. Produced fresh per attempt,
 * never persisted.
 */
public final class ConnectionProbeResult {
  private static final ConnectionProbeResult HEALTHY = new ConnectionProbeResult(true, true, null);

  private final boolean reachable;
  private final boolean expectedSchemaPresent;
  private final String errorDetail;

  private ConnectionProbeResult(boolean reachable, boolean expectedSchemaPresent, String errorDetail) {
    this.reachable = reachable;
    this.expectedSchemaPresent = expectedSchemaPresent;
    this.errorDetail = errorDetail;
  }

  /** Backend answered the ping and (for remote) the required table exists. */
  public static ConnectionProbeResult healthy() {
    return HEALTHY;
  }

  /** Connection could not be opened, the ping failed, or the probe timed out. */
  public static ConnectionProbeResult unreachable(String errorDetail) {
    return new ConnectionProbeResult(false, false,
        Objects.requireNonNull(errorDetail, "errorDetail"));
  }

  /** Backend is live but the table the storage layer needs is absent. */
  public static ConnectionProbeResult schemaMissing(String errorDetail) {
    return new ConnectionProbeResult(true, false,
        Objects.requireNonNull(errorDetail, "errorDetail"));
  }

  public boolean reachable() {
    return reachable;
  }

  public boolean expectedSchemaPresent() {
    return expectedSchemaPresent;
  }

  public Optional<String> errorDetail() {
    return Optional.ofNullable(errorDetail);
  }

  /** True only when the backend is both reachable and correctly shaped. */
  public boolean isUsable() {
    return reachable && expectedSchemaPresent;
  }

  @Override
  public String toString() {
    return "ConnectionProbeResult[reachable=" + reachable
        + ", expectedSchemaPresent=" + expectedSchemaPresent
        + (errorDetail != null ? ", errorDetail=" + errorDetail : "") + "]";
  }
}
