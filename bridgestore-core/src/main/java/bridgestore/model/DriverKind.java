package bridgestore.model;

/**
 * The two backends the adapter can select between.
 */
public enum DriverKind {
  /** Networked PostgreSQL reached through a credential-bearing URL. */
  REMOTE("remote", "postgres"),
  /** Embedded H2 file database, no network. */
  LOCAL("local", "h2");

  private final String type;
  private final String driver;

  DriverKind(String type, String driver) {
    this.type = type;
    this.driver = driver;
  }

  /** Status-surface value of the {@code type} key. */
  public String type() {
    return type;
  }

  /** Short driver name reported under the {@code driver} key. */
  public String driver() {
    return driver;
  }
}
