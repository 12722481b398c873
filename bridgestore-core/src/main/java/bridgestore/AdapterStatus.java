package bridgestore;

import bridgestore.model.AdapterState;
import bridgestore.model.DatabaseConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state owned by one {@link DatabaseAdapter}: the lifecycle state, the
 * config currently in play, and the remote failure that caused a fallback.
 *
 * <p>Transitions are checked against {@link AdapterState#canTransitionTo}.
 * Reads may happen from any thread (status endpoints), writes only from the
 * initializing thread.
 */
final class AdapterStatus {
  private AdapterState state = AdapterState.UNCONFIGURED;
  private DatabaseConfig activeConfig;
  private String remoteFailure;
  private InitializationReport report;

  synchronized AdapterState state() {
    return state;
  }

  synchronized Optional<DatabaseConfig> activeConfig() {
    return Optional.ofNullable(activeConfig);
  }

  synchronized Optional<String> remoteFailure() {
    return Optional.ofNullable(remoteFailure);
  }

  synchronized Optional<InitializationReport> report() {
    return Optional.ofNullable(report);
  }

  synchronized void transition(AdapterState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal adapter transition " + state + " -> " + next);
    }
    state = next;
  }

  /** Switches the reported config; called on entering each probing state. */
  synchronized void activate(DatabaseConfig config) {
    this.activeConfig = Objects.requireNonNull(config, "config");
  }

  synchronized void recordRemoteFailure(String detail) {
    this.remoteFailure = Objects.requireNonNull(detail, "detail");
  }

  synchronized void complete(InitializationReport report) {
    this.report = Objects.requireNonNull(report, "report");
  }

  /** Moves to FATAL unless already terminal. */
  synchronized void fail() {
    if (!state.isTerminal()) {
      state = AdapterState.FATAL;
    }
  }
}
