package ca.gc.cra.tide.config;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Resolves the effective {@code stream} configuration from defaults, an optional YAML file, environment variables and
 * CLI arguments.
 *
 * <p>Environment variables keep the names used by existing deployments: {@code DB_NAME}, {@code DB_USER},
 * {@code DB_HOST}, {@code DB_PASS}, {@code DB_PORT}, {@code SLOT_NAME} and {@code PUBLICATION_NAME}.</p>
 *
 * @since 0.1.0
 */
public final class StreamConfigLoader {
  /** YAML section read in addition to {@code common}. */
  public static final String SECTION = "stream";

  private static final Map<String, String> ENVIRONMENT_KEYS = Map.of(
      "DB_NAME", "database",
      "DB_USER", "user",
      "DB_HOST", "host",
      "DB_PASS", "password",
      "DB_PORT", "port",
      "SLOT_NAME", "slotName",
      "PUBLICATION_NAME", "publicationName");

  private StreamConfigLoader() {}

  /**
   * Builds the effective key/value configuration.
   *
   * @param cli CLI {@code key=value} pairs; a {@code config} entry names the YAML file and is not kept
   * @param environment process environment, usually {@link System#getenv()}
   * @param warn receives merge warnings
   * @return effective configuration covering every key of {@link StreamDefaults}
   * @throws IOException when the YAML file exists but cannot be read
   * @throws IllegalArgumentException when the YAML file is missing, malformed, or the path is invalid
   */
  public static Map<String, String> loadEffective(
      Map<String, String> cli, Map<String, String> environment, Consumer<String> warn) throws IOException {
    Map<String, String> cliCopy = new LinkedHashMap<>(Objects.requireNonNullElse(cli, Map.of()));
    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(cliCopy);
    if (configPath != null) {
      Path path;
      try {
        path = Path.of(configPath);
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("Invalid config path: " + configPath, ex);
      }
      yaml = YamlConfigLoader.load(path, SECTION);
      if (yaml.isEmpty()) {
        throw new IllegalArgumentException("Config file not found: " + configPath);
      }
    }
    return ConfigMerger.buildEffectiveConfig(
        yaml, fromEnvironment(environment), cliCopy, StreamDefaults.asFlatMap(), warn);
  }

  /**
   * Resolves and validates the stream configuration.
   *
   * @param cli CLI {@code key=value} pairs
   * @param environment process environment
   * @param warn receives merge warnings
   * @return validated configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when any source holds an invalid value
   */
  public static StreamConfig load(
      Map<String, String> cli, Map<String, String> environment, Consumer<String> warn) throws IOException {
    return StreamConfig.fromMap(loadEffective(cli, environment, warn));
  }

  /**
   * Maps recognised environment variables to configuration keys; unset and blank variables are skipped.
   *
   * @param environment process environment; {@code null} yields an empty map
   * @return configuration overrides
   */
  static Map<String, String> fromEnvironment(Map<String, String> environment) {
    Map<String, String> overrides = new LinkedHashMap<>();
    if (environment == null) {
      return overrides;
    }
    ENVIRONMENT_KEYS.forEach((variable, key) -> {
      String value = environment.get(variable);
      if (value != null && !value.isBlank()) {
        overrides.put(key, value.trim());
      }
    });
    return overrides;
  }

  private static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
