package bridgestore;

/**
 * The storage engine could not allocate its handle even though the probe
 * succeeded, e.g. an invalid driver registration or a corrupt local file.
 */
public final class StoreCreationException extends BridgeStoreException {
  public StoreCreationException(String message, Throwable cause) {
    super(message, cause);
  }
}
