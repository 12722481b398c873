package bridgestore.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of process configuration variables.
 *
 * <p>{@link ConfigResolver} reads the database URL through this interface so
 * that resolution stays a pure function of its input.
 */
@FunctionalInterface
public interface Environment {

  /**
   * Looks up a variable.
   *
   * @param name variable name
   * @return the value, or empty if unset
   */
  Optional<String> get(String name);

  /** The process environment ({@link System#getenv(String)}). */
  static Environment system() {
    return name -> Optional.ofNullable(System.getenv(name));
  }

  /** A fixed set of variables. */
  static Environment of(Map<String, String> variables) {
    Map<String, String> copy = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    return name -> Optional.ofNullable(copy.get(name));
  }

  /** No variables at all. */
  static Environment empty() {
    return name -> Optional.empty();
  }
}
