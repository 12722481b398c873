package bridgestore;

import bridgestore.model.DriverKind;
import bridgestore.model.ReconciliationReport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnostics of a successful initialization.
 *
 * @param backend       backend the handle points at
 * @param remoteFailure why remote was abandoned, if the adapter fell back
 * @param schema        reconciliation outcome ({@link ReconciliationReport#skipped()} for local)
 * @param elapsed       wall time from start of resolution to ready
 */
public record InitializationReport(
    DriverKind backend,
    Optional<String> remoteFailure,
    ReconciliationReport schema,
    Duration elapsed
) {
  public InitializationReport {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(remoteFailure, "remoteFailure");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(elapsed, "elapsed");
  }

  /** True when remote was requested but local is in use. */
  public boolean fellBack() {
    return remoteFailure.isPresent();
  }
}
