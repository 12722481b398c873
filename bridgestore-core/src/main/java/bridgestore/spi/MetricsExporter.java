package bridgestore.spi;

import bridgestore.model.DriverKind;

/**
 * Observability hook for exporting initialization counters and gauges to a
 * metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of probes started against a backend.
   */
  void incrementProbeAttempt(DriverKind kind);

  /**
   * Increments the count of probes that came back unusable (unreachable,
   * timed out, or missing the expected schema).
   */
  void incrementProbeFailure(DriverKind kind);

  /**
   * Increments the count of remote-to-local fallbacks.
   */
  void incrementFallback();

  /**
   * Records the outcome of a schema reconciliation run.
   *
   * @param applied number of columns added
   * @param failed  number of corrections that raised a drift warning
   */
  void recordSchemaCorrections(int applied, int failed);

  /**
   * Records the backend in use once the adapter is ready.
   */
  void recordActiveBackend(DriverKind kind);

  /**
   * Records how long initialization took, successful or not.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordInitializationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementProbeAttempt(DriverKind kind) {
    }

    @Override
    public void incrementProbeFailure(DriverKind kind) {
    }

    @Override
    public void incrementFallback() {
    }

    @Override
    public void recordSchemaCorrections(int applied, int failed) {
    }

    @Override
    public void recordActiveBackend(DriverKind kind) {
    }
  }
}
