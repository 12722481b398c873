package bridgestore.config;

import bridgestore.ConfigurationException;
import bridgestore.model.DatabaseConfig;
import bridgestore.url.ConnectionUrl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives a {@link DatabaseConfig} from the environment. Does no network I/O.
 *
 * <p>A non-blank {@code DATABASE_URL} (or the configured variable) selects the
 * remote backend and must be a well-formed {@code postgres://} or
 * {@code postgresql://} URL; anything else is a {@link ConfigurationException},
 * never a silent downgrade to local. An absent or blank variable selects the
 * local backend.
 */
public final class ConfigResolver {
  private static final Set<PosixFilePermission> DIRECTORY_MODE = PosixFilePermissions.fromString("rwxr-xr-x");

  private final Environment environment;
  private final AdapterSettings settings;

  public ConfigResolver(Environment environment, AdapterSettings settings) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Resolves the preferred config: remote if the environment names a database
   * URL, local otherwise.
   *
   * @throws ConfigurationException if the URL is malformed or has an unsupported
   *     scheme, or the local storage directory cannot be created
   */
  public DatabaseConfig resolve() {
    Optional<String> url = remoteUrl();
    if (url.isEmpty()) {
      return resolveLocal();
    }
    ConnectionUrl.parse(url.get());
    return DatabaseConfig.remote(url.get(), settings.remoteMigrationsLocation());
  }

  /**
   * Resolves the local config regardless of the environment, creating the
   * storage directory if needed.
   *
   * @throws ConfigurationException if the storage directory cannot be created
   */
  public DatabaseConfig resolveLocal() {
    Path path = settings.localStoragePath();
    ensureDirectory(path.toAbsolutePath().getParent());
    return DatabaseConfig.local(path.toString(), settings.localMigrationsLocation());
  }

  /** Whether the environment signals a remote backend at all. */
  public boolean remoteRequested() {
    return remoteUrl().isPresent();
  }

  private Optional<String> remoteUrl() {
    return environment.get(settings.databaseUrlVariable())
        .map(String::trim)
        .filter(s -> !s.isEmpty());
  }

  private static void ensureDirectory(Path dir) {
    if (dir == null || Files.isDirectory(dir)) {
      return;
    }
    try {
      if (dir.getFileSystem().supportedFileAttributeViews().contains("posix")) {
        FileAttribute<Set<PosixFilePermission>> mode = PosixFilePermissions.asFileAttribute(DIRECTORY_MODE);
        Files.createDirectories(dir, mode);
      } else {
        Files.createDirectories(dir);
      }
    } catch (IOException | SecurityException e) {
      throw new ConfigurationException("Failed to create local storage directory " + dir, e);
    }
  }
}
