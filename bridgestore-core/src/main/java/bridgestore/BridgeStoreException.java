package bridgestore;

/**
 * Root of the unchecked exceptions thrown while selecting and opening a backend.
 */
public class BridgeStoreException extends RuntimeException {
  public BridgeStoreException(String message) {
    super(message);
  }

  public BridgeStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
