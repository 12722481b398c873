package bridgestore;

/**
 * Fatal configuration error: malformed or unsupported connection string, or
 * the local storage directory could not be created. Raised before any network
 * call is attempted.
 */
public final class ConfigurationException extends BridgeStoreException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
