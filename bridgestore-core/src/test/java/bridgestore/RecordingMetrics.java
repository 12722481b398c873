package bridgestore;

import bridgestore.model.DriverKind;
import bridgestore.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;

class RecordingMetrics implements MetricsExporter {
  final List<DriverKind> attempts = new ArrayList<>();
  final List<DriverKind> failures = new ArrayList<>();
  int fallbacks;
  int applied;
  int failed;
  DriverKind active;
  long initializationMs = -1;

  @Override
  public void incrementProbeAttempt(DriverKind kind) {
    attempts.add(kind);
  }

  @Override
  public void incrementProbeFailure(DriverKind kind) {
    failures.add(kind);
  }

  @Override
  public void incrementFallback() {
    fallbacks++;
  }

  @Override
  public void recordSchemaCorrections(int applied, int failed) {
    this.applied += applied;
    this.failed += failed;
  }

  @Override
  public void recordActiveBackend(DriverKind kind) {
    active = kind;
  }

  @Override
  public void recordInitializationMs(long durationMs) {
    initializationMs = durationMs;
  }
}
