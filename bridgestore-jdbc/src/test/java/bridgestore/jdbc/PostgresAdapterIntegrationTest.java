package bridgestore.jdbc;

import bridgestore.DatabaseAdapter;
import bridgestore.InitializationResult;
import bridgestore.config.AdapterSettings;
import bridgestore.config.Environment;
import bridgestore.model.DriverKind;
import bridgestore.model.ReconciliationReport;
import bridgestore.jdbc.dialect.Dialects;
import bridgestore.jdbc.schema.CatalogInspector;
import bridgestore.jdbc.schema.JdbcSchemaReconciler;
import bridgestore.spi.MetricsExporter;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresAdapterIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("bridge")
      .withUsername("bridge")
      .withPassword("s3cretpw");

  @TempDir
  Path tempDir;

  @BeforeAll
  static void initSchema() throws Exception {
    try (Connection conn = DriverManager.getConnection(postgres.getJdbcUrl(),
        postgres.getUsername(), postgres.getPassword())) {
      conn.createStatement().execute("CREATE TABLE whatsmeow_device ("
          + "jid TEXT PRIMARY KEY, registration_id BIGINT NOT NULL DEFAULT 0)");
      conn.createStatement().execute("INSERT INTO whatsmeow_device (jid) VALUES ('1@s.whatsapp.net')");
      conn.createStatement().execute("CREATE DATABASE unmigrated");
    }
  }

  private static String url(String database) {
    return "postgres://" + postgres.getUsername() + ":" + postgres.getPassword() + "@"
        + postgres.getHost() + ":" + postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT)
        + "/" + database + "?application_name=bridgestore-test";
  }

  private DatabaseAdapter adapter(String database) {
    AdapterSettings settings = AdapterSettings.builder()
        .localStoragePath(tempDir.resolve("bridgestore"))
        .probeTimeout(Duration.ofSeconds(5))
        .build();
    return JdbcDatabaseAdapters.create(settings,
        Environment.of(Map.of("DATABASE_URL", url(database))), MetricsExporter.NOOP);
  }

  @Test
  void migratedDatabaseIsReconciledAndUsed() throws Exception {
    DatabaseAdapter adapter = adapter("bridge");

    InitializationResult result = adapter.initialize();
    try {
      assertEquals(DriverKind.REMOTE, result.report().backend());
      assertFalse(result.report().schema().hasWarnings());
      assertEquals(List.of(0L), result.handle().query(
          "SELECT lid_migration_ts FROM whatsmeow_device", rs -> rs.getLong(1)));

      Map<String, Object> status = adapter.status();
      assertEquals("remote", status.get("type"));
      assertEquals("bridge", status.get("database"));
      assertFalse(status.toString().contains("s3cretpw"));
    } finally {
      result.handle().close();
    }

    try (Connection conn = DriverManager.getConnection(postgres.getJdbcUrl(),
        postgres.getUsername(), postgres.getPassword())) {
      assertTrue(CatalogInspector.columnExists(conn, "whatsmeow_device", "facebook_uuid"));
      ReconciliationReport second = JdbcSchemaReconciler.forRequirements(
          AdapterSettings.defaults().schemaRequirements(), Dialects.forKind(DriverKind.REMOTE))
          .reconcile(conn);
      assertFalse(second.changedSchema());
    }
  }

  @Test
  void unmigratedDatabaseFallsBackToLocal() {
    DatabaseAdapter adapter = adapter("unmigrated");

    InitializationResult result = adapter.initialize();
    try {
      assertEquals(DriverKind.LOCAL, result.report().backend());
      assertTrue(result.report().remoteFailure().orElseThrow().contains("whatsmeow_device"));
    } finally {
      result.handle().close();
    }
  }
}
