package bridgestore.spi;

import bridgestore.model.DatabaseConfig;

/**
 * Produces the long-lived storage handle for a probed backend.
 */
@FunctionalInterface
public interface StoreFactory {

  /**
   * @param config the config that just passed its probe
   * @return a handle safe for concurrent use
   * @throws bridgestore.StoreCreationException if the engine cannot allocate the handle
   */
  StorageHandle create(DatabaseConfig config);
}
