package bridgestore;

/**
 * Unchecked exception wrapping JDBC errors raised through a
 * {@link bridgestore.spi.StorageHandle}.
 */
public final class StorageException extends BridgeStoreException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
