package bridgestore.jdbc.schema;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One additive schema correction. Steps check before they act, so running a step
 * against a database that already has the change is a no-op.
 */
public interface MigrationStep {

  /** What the step touches, e.g. {@code whatsmeow_device.facebook_uuid}. */
  String target();

  boolean isApplied(Connection conn) throws SQLException;

  void apply(Connection conn) throws SQLException;
}
