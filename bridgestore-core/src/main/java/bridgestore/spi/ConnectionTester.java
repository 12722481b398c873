package bridgestore.spi;

import bridgestore.model.ConnectionProbeResult;
import bridgestore.model.DatabaseConfig;

/**
 * Bounded liveness and shape probe.
 *
 * <p>Implementations must never throw for a bad address, a refused connection
 * or a timeout; every failure is reported as a negative
 * {@link ConnectionProbeResult} with an error detail. The connection used for
 * probing is released on every exit path.
 */
@FunctionalInterface
public interface ConnectionTester {

  ConnectionProbeResult test(DatabaseConfig config);
}
