package bridgestore.config;

import bridgestore.model.SchemaColumnRequirement;

import java.util.List;

/**
 * Versioned column requirements of the messaging session store.
 *
 * <p>New requirements are appended as a new version; existing entries are
 * never edited or removed.
 */
public final class SchemaRequirements {

  /** Table whose presence the remote probe checks. */
  public static final String DEVICE_TABLE = "whatsmeow_device";

  public static final List<SchemaColumnRequirement> V1 = List.of(
      new SchemaColumnRequirement(DEVICE_TABLE, "facebook_uuid", "TEXT", null),
      new SchemaColumnRequirement(DEVICE_TABLE, "lid_migration_ts", "BIGINT", "0"));

  public static final List<SchemaColumnRequirement> LATEST = V1;

  private SchemaRequirements() {}
}
