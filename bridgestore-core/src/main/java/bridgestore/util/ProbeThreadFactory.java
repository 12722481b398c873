package bridgestore.util;

import bridgestore.model.DriverKind;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads that connection probes run on.
 *
 * <p>Threads are named {@code bridgestore-probe-<type>-<n>}, where {@code n}
 * counts every probe thread in the process, so a probe abandoned after its
 * timeout stays identifiable in thread dumps. Whatever such a thread throws
 * once nobody waits for it is logged at {@code FINE}.
 */
public final class ProbeThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(ProbeThreadFactory.class.getName());
  private static final AtomicInteger COUNTER = new AtomicInteger(1);

  private final String prefix;

  public ProbeThreadFactory(DriverKind kind) {
    this.prefix = "bridgestore-probe-" + Objects.requireNonNull(kind, "kind").type() + "-";
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + COUNTER.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.FINE, "Probe thread " + t.getName() + " ended with an error", e));
    return thread;
  }
}
