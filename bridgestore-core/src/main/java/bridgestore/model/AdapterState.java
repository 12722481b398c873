package bridgestore.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link bridgestore.DatabaseAdapter}.
 *
 * <pre>
 * UNCONFIGURED -> PROBING_REMOTE -> SCHEMA_RECONCILING -> READY
 *                      |
 *                      v
 * UNCONFIGURED -> PROBING_LOCAL -> READY | FATAL
 * </pre>
 *
 * Any state may move to {@link #FATAL} (configuration or store creation
 * errors). {@link #READY} and {@link #FATAL} are terminal.
 */
public enum AdapterState {
  UNCONFIGURED,
  PROBING_REMOTE,
  SCHEMA_RECONCILING,
  PROBING_LOCAL,
  READY,
  FATAL;

  public boolean isTerminal() {
    return this == READY || this == FATAL;
  }

  /** Whether {@code next} is a legal successor of this state. */
  public boolean canTransitionTo(AdapterState next) {
    if (next == FATAL) {
      return !isTerminal();
    }
    return successors().contains(next);
  }

  private Set<AdapterState> successors() {
    return switch (this) {
      case UNCONFIGURED -> EnumSet.of(PROBING_REMOTE, PROBING_LOCAL);
      case PROBING_REMOTE -> EnumSet.of(SCHEMA_RECONCILING, PROBING_LOCAL);
      case SCHEMA_RECONCILING, PROBING_LOCAL -> EnumSet.of(READY);
      case READY, FATAL -> EnumSet.noneOf(AdapterState.class);
    };
  }
}
