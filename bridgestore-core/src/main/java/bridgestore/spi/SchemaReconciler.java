package bridgestore.spi;

import bridgestore.model.ReconciliationReport;

import java.sql.Connection;

/**
 * Applies additive, idempotent schema corrections to a live remote database.
 *
 * <p>Best-effort: a correction that fails is recorded as a
 * {@link bridgestore.model.SchemaDriftWarning} in the returned report rather
 * than thrown.
 */
@FunctionalInterface
public interface SchemaReconciler {

  /**
   * @param conn open connection to the remote database; not closed by this method
   * @return what was applied, what was already present, and what failed
   */
  ReconciliationReport reconcile(Connection conn);
}
