package bridgestore.jdbc;

import bridgestore.StorageException;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the embedded local schema script. Every statement in the script is
 * {@code CREATE ... IF NOT EXISTS}, so applying it to an existing store is a no-op.
 */
public final class LocalSchemaInitializer {
  private static final Logger logger = Logger.getLogger(LocalSchemaInitializer.class.getName());

  public static final String DEFAULT_RESOURCE = "bridgestore/schema/h2.sql";

  private final String resource;

  public LocalSchemaInitializer() {
    this(DEFAULT_RESOURCE);
  }

  public LocalSchemaInitializer(String resource) {
    this.resource = Objects.requireNonNull(resource, "resource");
  }

  public String resource() {
    return resource;
  }

  /**
   * @return number of statements executed
   * @throws StorageException if the script is missing or a statement fails
   */
  public int apply(DataSource dataSource) {
    List<String> statements = statements(load());
    try (Connection conn = dataSource.getConnection()) {
      for (String sql : statements) {
        JdbcTemplate.update(conn, sql);
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to apply local schema " + resource, e);
    }
    logger.log(Level.FINE, "Applied {0} statements from {1}", new Object[]{statements.size(), resource});
    return statements.size();
  }

  private String load() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = LocalSchemaInitializer.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new StorageException("Local schema resource not found: " + resource, null);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new StorageException("Failed to read local schema " + resource, e);
    }
  }

  static List<String> statements(String script) {
    StringBuilder body = new StringBuilder();
    for (String line : script.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      body.append(line).append('\n');
    }
    List<String> statements = new ArrayList<>();
    for (String part : body.toString().split(";")) {
      String sql = part.trim();
      if (!sql.isEmpty()) {
        statements.add(sql);
      }
    }
    return statements;
  }
}
