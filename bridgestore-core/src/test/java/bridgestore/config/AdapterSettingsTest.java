package bridgestore.config;

import bridgestore.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdapterSettingsTest {

  @Test
  void defaults() {
    AdapterSettings settings = AdapterSettings.defaults();

    assertEquals("DATABASE_URL", settings.databaseUrlVariable());
    assertEquals(Path.of("store", "bridgestore"), settings.localStoragePath());
    assertEquals(Duration.ofSeconds(5), settings.probeTimeout());
    assertEquals(SchemaRequirements.DEVICE_TABLE, settings.requiredTable());
    assertEquals(SchemaRequirements.LATEST, settings.schemaRequirements());
    assertFalse(settings.stripCredentials());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(ConfigurationException.class,
        () -> AdapterSettings.builder().probeTimeout(Duration.ZERO).build());
  }

  @Test
  void rejectsUnsafeTableName() {
    assertThrows(ConfigurationException.class,
        () -> AdapterSettings.builder().requiredTable("device; DROP TABLE x").build());
  }
}
