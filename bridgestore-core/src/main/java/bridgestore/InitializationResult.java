package bridgestore;

import bridgestore.model.DatabaseConfig;
import bridgestore.spi.StorageHandle;

/**
 * What {@link DatabaseAdapter#initialize()} hands back: the storage handle the
 * process uses from now on, the config it was built from (kept for reporting
 * only), and the diagnostics of how it got there.
 */
public record InitializationResult(
    StorageHandle handle,
    DatabaseConfig config,
    InitializationReport report
) {}
