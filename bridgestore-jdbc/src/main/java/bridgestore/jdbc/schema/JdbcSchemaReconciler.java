package bridgestore.jdbc.schema;

import bridgestore.jdbc.spi.Dialect;
import bridgestore.model.ReconciliationReport;
import bridgestore.model.SchemaColumnRequirement;
import bridgestore.model.SchemaDriftWarning;
import bridgestore.spi.SchemaReconciler;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a fixed list of {@link MigrationStep}s, each at most once per call.
 *
 * <p>Best effort: a failing step is logged, reported as a {@link SchemaDriftWarning}
 * and the remaining steps still run. Nothing is ever dropped or narrowed.
 * Connections are used in auto-commit mode so one failed statement does not
 * abort the others on PostgreSQL.
 */
public final class JdbcSchemaReconciler implements SchemaReconciler {
  private static final Logger logger = Logger.getLogger(JdbcSchemaReconciler.class.getName());

  private final List<MigrationStep> steps;

  public JdbcSchemaReconciler(List<MigrationStep> steps) {
    this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
  }

  /**
   * One {@link AddColumnStep} per requirement, in order.
   */
  public static JdbcSchemaReconciler forRequirements(List<SchemaColumnRequirement> requirements,
      Dialect dialect) {
    List<MigrationStep> steps = new ArrayList<>(requirements.size());
    for (SchemaColumnRequirement requirement : requirements) {
      steps.add(new AddColumnStep(requirement, dialect));
    }
    return new JdbcSchemaReconciler(steps);
  }

  public List<MigrationStep> steps() {
    return steps;
  }

  @Override
  public ReconciliationReport reconcile(Connection conn) {
    List<String> applied = new ArrayList<>();
    List<String> present = new ArrayList<>();
    List<SchemaDriftWarning> warnings = new ArrayList<>();

    ensureAutoCommit(conn, warnings);
    for (MigrationStep step : steps) {
      String target = step.target();
      try {
        if (step.isApplied(conn)) {
          present.add(target);
          continue;
        }
        logger.log(Level.INFO, "Adding missing column {0}", target);
        step.apply(conn);
        applied.add(target);
      } catch (SQLException e) {
        if (appliedConcurrently(step, conn)) {
          present.add(target);
          continue;
        }
        logger.log(Level.WARNING, "Schema drift on {0}: {1}", new Object[]{target, e.getMessage()});
        warnings.add(new SchemaDriftWarning(target, String.valueOf(e.getMessage())));
      }
    }

    if (!applied.isEmpty()) {
      logger.log(Level.INFO, "Schema reconciled, added {0}", applied);
    }
    return new ReconciliationReport(applied, present, warnings);
  }

  // Another instance may have added the column between our check and the ALTER.
  private static boolean appliedConcurrently(MigrationStep step, Connection conn) {
    try {
      return step.isApplied(conn);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Re-check of " + step.target() + " failed", e);
      return false;
    }
  }

  private static void ensureAutoCommit(Connection conn, List<SchemaDriftWarning> warnings) {
    try {
      if (!conn.getAutoCommit()) {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Could not enable auto-commit for schema reconciliation", e);
      warnings.add(new SchemaDriftWarning("*", "auto-commit unavailable: " + e.getMessage()));
    }
  }
}
