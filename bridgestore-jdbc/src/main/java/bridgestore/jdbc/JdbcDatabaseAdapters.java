package bridgestore.jdbc;

import bridgestore.DatabaseAdapter;
import bridgestore.config.AdapterSettings;
import bridgestore.config.Environment;
import bridgestore.jdbc.dialect.Dialects;
import bridgestore.jdbc.schema.JdbcSchemaReconciler;
import bridgestore.model.DriverKind;
import bridgestore.spi.MetricsExporter;

import java.util.Objects;

/**
 * Wires a {@link DatabaseAdapter} with the JDBC collaborators: a
 * {@link DriverManagerConnectionFactory}, a {@link JdbcConnectionTester}, a
 * {@link JdbcSchemaReconciler} for the settings' column requirements and a
 * {@link HikariStoreFactory}.
 *
 * <pre>{@code
 * DatabaseAdapter adapter = JdbcDatabaseAdapters.create(AdapterSettings.defaults());
 *
 * // Override one collaborator
 * DatabaseAdapter adapter = JdbcDatabaseAdapters.builder(settings)
 *     .storeFactory(HikariStoreFactory.builder().maxPoolSize(20).build())
 *     .build();
 * }</pre>
 */
public final class JdbcDatabaseAdapters {

  private JdbcDatabaseAdapters() {
  }

  public static DatabaseAdapter create(AdapterSettings settings) {
    return builder(settings).build();
  }

  public static DatabaseAdapter create(AdapterSettings settings, Environment environment,
      MetricsExporter metrics) {
    return builder(settings)
        .environment(environment)
        .metrics(metrics)
        .build();
  }

  /**
   * A builder pre-populated with the JDBC collaborators for {@code settings};
   * any of them can still be replaced before {@code build()}.
   */
  public static DatabaseAdapter.Builder builder(AdapterSettings settings) {
    Objects.requireNonNull(settings, "settings");
    DriverManagerConnectionFactory connectionFactory =
        new DriverManagerConnectionFactory(settings.probeTimeout());
    return DatabaseAdapter.builder()
        .settings(settings)
        .connectionFactory(connectionFactory)
        .connectionTester(JdbcConnectionTester.builder()
            .connectionFactory(connectionFactory)
            .timeout(settings.probeTimeout())
            .requiredTable(settings.requiredTable())
            .build())
        .schemaReconciler(JdbcSchemaReconciler.forRequirements(
            settings.schemaRequirements(), Dialects.forKind(DriverKind.REMOTE)))
        .storeFactory(HikariStoreFactory.builder().build());
  }
}
