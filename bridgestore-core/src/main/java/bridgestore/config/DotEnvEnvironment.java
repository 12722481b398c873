package bridgestore.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Environment} that layers a {@code .env} file underneath another
 * environment. Variables already present in the delegate win; the file only
 * fills gaps.
 *
 * <p>A missing file is not an error. An unreadable file is logged and ignored.
 *
 * <p>Supported syntax: {@code KEY=VALUE} lines, optional {@code export } prefix,
 * {@code #} comments, and single- or double-quoted values.
 */
public final class DotEnvEnvironment implements Environment {
  private static final Logger logger = Logger.getLogger(DotEnvEnvironment.class.getName());

  public static final Path DEFAULT_PATH = Path.of(".env");

  private final Environment delegate;
  private final Map<String, String> fileVariables;

  private DotEnvEnvironment(Environment delegate, Map<String, String> fileVariables) {
    this.delegate = delegate;
    this.fileVariables = Collections.unmodifiableMap(fileVariables);
  }

  /** Loads {@code ./.env} under the process environment. */
  public static DotEnvEnvironment load() {
    return load(DEFAULT_PATH, Environment.system());
  }

  public static DotEnvEnvironment load(Path file, Environment delegate) {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(delegate, "delegate");
    if (!Files.exists(file)) {
      logger.log(Level.INFO, "No .env file found at {0}", file.toAbsolutePath());
      return new DotEnvEnvironment(delegate, Map.of());
    }
    try {
      Map<String, String> vars = parse(Files.readAllLines(file, StandardCharsets.UTF_8));
      logger.log(Level.FINE, "Loaded {0} variables from {1}", new Object[]{vars.size(), file});
      return new DotEnvEnvironment(delegate, vars);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not read .env file " + file + ", ignoring it", e);
      return new DotEnvEnvironment(delegate, Map.of());
    }
  }

  @Override
  public Optional<String> get(String name) {
    Optional<String> value = delegate.get(name);
    if (value.isPresent()) {
      return value;
    }
    return Optional.ofNullable(fileVariables.get(name));
  }

  static Map<String, String> parse(List<String> lines) {
    Map<String, String> vars = new LinkedHashMap<>();
    for (String rawLine : lines) {
      String line = rawLine.strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (line.startsWith("export ")) {
        line = line.substring("export ".length()).strip();
      }
      int eq = line.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String key = line.substring(0, eq).strip();
      String value = line.substring(eq + 1).strip();
      vars.put(key, unquote(value));
    }
    return vars;
  }

  private static String unquote(String value) {
    if (!value.isEmpty()) {
      char quote = value.charAt(0);
      if (quote == '"' || quote == '\'') {
        int close = value.indexOf(quote, 1);
        if (close > 0) {
          return value.substring(1, close);
        }
      }
    }
    int hash = value.indexOf(" #");
    return hash >= 0 ? value.substring(0, hash).strip() : value;
  }
}
