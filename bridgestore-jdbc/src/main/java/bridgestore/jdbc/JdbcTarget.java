package bridgestore.jdbc;

import java.util.Objects;
import java.util.Properties;

/**
 * JDBC URL plus driver properties. Credentials travel in the properties, never
 * in the URL, so {@link #url()} is safe to log.
 */
public final class JdbcTarget {
  private final String url;
  private final Properties properties;

  public JdbcTarget(String url, Properties properties) {
    this.url = Objects.requireNonNull(url, "url");
    Properties copy = new Properties();
    copy.putAll(Objects.requireNonNull(properties, "properties"));
    this.properties = copy;
  }

  public String url() {
    return url;
  }

  /** A copy; may contain {@code user} and {@code password}. */
  public Properties properties() {
    Properties copy = new Properties();
    copy.putAll(properties);
    return copy;
  }

  @Override
  public String toString() {
    return "JdbcTarget[url=" + url + ", properties=" + properties.stringPropertyNames() + "]";
  }
}
