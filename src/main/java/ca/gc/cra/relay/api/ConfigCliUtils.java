package ca.gc.cra.relay.api;

import ca.gc.cra.relay.config.ConfigMerger;
import ca.gc.cra.relay.config.DefaultsForMode;
import ca.gc.cra.relay.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers that combine CLI arguments with the optional YAML file and built-in defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Merges defaults, the YAML file named by {@code config=}, and CLI values for {@code mode}.
   *
   * @param mode CLI mode
   * @param cli mutable CLI map; the {@code config} entry is consumed
   * @return effective configuration
   * @throws IOException when the named file is missing or unreadable
   * @throws IllegalArgumentException when the YAML or the merged values are invalid
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      yaml = YamlConfigLoader.load(path, mode);
      if (yaml.isEmpty()) {
        throw new NoSuchFileException(configPath, null, "configuration file not found");
      }
      log.debug("Loaded {} settings from {}", yaml.get().size(), path);
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, yaml, cli, DefaultsForMode.asFlatMap(mode), message -> log.warn(message));
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
