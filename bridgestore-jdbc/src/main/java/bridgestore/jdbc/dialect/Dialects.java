package bridgestore.jdbc.dialect;

import bridgestore.jdbc.spi.Dialect;
import bridgestore.model.DriverKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Registry mapping each backend kind to its dialect.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/bridgestore.jdbc.spi.Dialect}. When several dialects
 * serve the same kind, the first one on the class path wins.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.forKind(config.driverKind());
 * JdbcTarget target = dialect.target(config, Duration.ofSeconds(5));
 * }</pre>
 */
public final class Dialects {

  private static final Map<DriverKind, Dialect> BY_KIND = new EnumMap<>(DriverKind.class);

  static {
    for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
      BY_KIND.putIfAbsent(dialect.driverKind(), dialect);
    }
  }

  private Dialects() {
  }

  /**
   * Gets the dialect serving a backend kind.
   *
   * @throws IllegalStateException if none is registered
   */
  public static Dialect forKind(DriverKind kind) {
    Objects.requireNonNull(kind, "kind");
    Dialect dialect = BY_KIND.get(kind);
    if (dialect == null) {
      throw new IllegalStateException("No dialect registered for " + kind);
    }
    return dialect;
  }
}
