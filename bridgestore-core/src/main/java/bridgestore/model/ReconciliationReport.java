package bridgestore.model;

import java.util.List;

/**
 * What a schema reconciliation run did.
 *
 * @param applied        columns added by this run
 * @param alreadyPresent columns that were already in place
 * @param warnings       corrections that failed; initialization continued anyway
 */
public record ReconciliationReport(
    List<String> applied,
    List<String> alreadyPresent,
    List<SchemaDriftWarning> warnings
) {
  private static final ReconciliationReport SKIPPED = new ReconciliationReport(List.of(), List.of(), List.of());

  public ReconciliationReport {
    applied = List.copyOf(applied);
    alreadyPresent = List.copyOf(alreadyPresent);
    warnings = List.copyOf(warnings);
  }

  /** Report for backends where reconciliation does not run. */
  public static ReconciliationReport skipped() {
    return SKIPPED;
  }

  public boolean changedSchema() {
    return !applied.isEmpty();
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
