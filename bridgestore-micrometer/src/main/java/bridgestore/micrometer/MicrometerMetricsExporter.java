package bridgestore.micrometer;

import bridgestore.model.DriverKind;
import bridgestore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code bridgestore.probe.attempts} (tag {@code backend}): probes started</li>
 *   <li>{@code bridgestore.probe.failures} (tag {@code backend}): probes that came back unusable</li>
 *   <li>{@code bridgestore.fallback}: remote-to-local fallbacks</li>
 *   <li>{@code bridgestore.schema.corrections.applied}: columns added by reconciliation</li>
 *   <li>{@code bridgestore.schema.corrections.failed}: corrections left as drift warnings</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code bridgestore.backend.remote}: 1 when the active backend is remote, 0 otherwise</li>
 *   <li>{@code bridgestore.initialization.ms}: duration of the last initialization</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Map<DriverKind, Counter> probeAttempts = new EnumMap<>(DriverKind.class);
  private final Map<DriverKind, Counter> probeFailures = new EnumMap<>(DriverKind.class);
  private final Counter fallback;
  private final Counter correctionsApplied;
  private final Counter correctionsFailed;
  private final Gauge remoteGauge;
  private final Gauge initializationGauge;

  private final AtomicInteger remote = new AtomicInteger();
  private final AtomicLong initializationMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "bridgestore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "bridgestore");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "bridge.db"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (DriverKind kind : DriverKind.values()) {
      probeAttempts.put(kind, Counter.builder(namePrefix + ".probe.attempts")
          .description("Connection probes started")
          .tag("backend", kind.type())
          .register(registry));
      probeFailures.put(kind, Counter.builder(namePrefix + ".probe.failures")
          .description("Connection probes that found the backend unusable")
          .tag("backend", kind.type())
          .register(registry));
    }
    this.fallback = Counter.builder(namePrefix + ".fallback")
        .description("Fallbacks from the remote database to local storage")
        .register(registry);
    this.correctionsApplied = Counter.builder(namePrefix + ".schema.corrections.applied")
        .description("Columns added by schema reconciliation")
        .register(registry);
    this.correctionsFailed = Counter.builder(namePrefix + ".schema.corrections.failed")
        .description("Schema corrections that could not be applied")
        .register(registry);

    this.remoteGauge = Gauge.builder(namePrefix + ".backend.remote", remote, AtomicInteger::get)
        .description("1 when the active backend is the remote database")
        .register(registry);
    this.initializationGauge = Gauge.builder(namePrefix + ".initialization.ms", initializationMs, AtomicLong::get)
        .description("Duration of the last initialization in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementProbeAttempt(DriverKind kind) {
    if (closed) return;
    probeAttempts.get(kind).increment();
  }

  @Override
  public void incrementProbeFailure(DriverKind kind) {
    if (closed) return;
    probeFailures.get(kind).increment();
  }

  @Override
  public void incrementFallback() {
    if (closed) return;
    fallback.increment();
  }

  @Override
  public void recordSchemaCorrections(int applied, int failed) {
    if (closed) return;
    correctionsApplied.increment(applied);
    correctionsFailed.increment(failed);
  }

  @Override
  public void recordActiveBackend(DriverKind kind) {
    if (closed) return;
    remote.set(kind == DriverKind.REMOTE ? 1 : 0);
  }

  @Override
  public void recordInitializationMs(long durationMs) {
    if (closed) return;
    initializationMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the storage handle is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(probeAttempts.values());
    meters.addAll(probeFailures.values());
    meters.addAll(List.of(fallback, correctionsApplied, correctionsFailed, remoteGauge, initializationGauge));
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
