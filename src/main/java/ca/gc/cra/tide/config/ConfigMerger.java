package ca.gc.cra.tide.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration sources with precedence CLI &gt; environment &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML settings
   * @param environment settings derived from environment variables (may be empty)
   * @param cli CLI {@code key=value} overrides (may be empty)
   * @param defaults embedded defaults; their key set is the set of recognised keys
   * @param warn receives override and unknown-key warnings; may be {@code null}
   * @return immutable merged configuration
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml == null ? Map.of() : yaml.orElse(Map.of());
    Map<String, String> envCopy = environment == null ? Map.of() : environment;
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    overlay(merged, yamlCopy, defaultsCopy.keySet(), "YAML", sink);
    overlay(merged, envCopy, defaultsCopy.keySet(), "environment", sink);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) || envCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML/environment for key: " + key);
      }
    }
    overlay(merged, cliCopy, defaultsCopy.keySet(), "CLI", sink);
    return Map.copyOf(merged);
  }

  private static void overlay(
      Map<String, String> target,
      Map<String, String> source,
      Set<String> knownKeys,
      String origin,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (!knownKeys.isEmpty() && !knownKeys.contains(key)) {
        warn.accept("Ignoring unknown " + origin + " key: " + key);
        continue;
      }
      target.put(key, value);
    }
  }
}
