/**
 * Micrometer metrics integration for bridgestore.
 *
 * <p>Provides {@link bridgestore.micrometer.MicrometerMetricsExporter}, an implementation
 * of {@link bridgestore.spi.MetricsExporter} that registers counters and gauges with a
 * Micrometer {@link io.micrometer.core.instrument.MeterRegistry}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MeterRegistry registry = ...; // e.g. PrometheusMeterRegistry
 * MicrometerMetricsExporter metrics = new MicrometerMetricsExporter(registry);
 *
 * DatabaseAdapter adapter = JdbcDatabaseAdapters.create(settings, Environment.system(), metrics);
 * }</pre>
 */
package bridgestore.micrometer;
