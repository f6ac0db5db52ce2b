package ca.gc.cra.relay.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults, then
 * checks cross-key rules that a single value cannot express.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"serve".equalsIgnoreCase(mode.trim())) {
      return;
    }
    if (trim(effective.get("targetHost")).isEmpty()) {
      throw new IllegalArgumentException("targetHost is required for serve");
    }
    boolean hasPrefix = !trim(effective.get("staticPrefix")).isEmpty();
    boolean hasRoot = !trim(effective.get("staticRoot")).isEmpty();
    if (hasPrefix != hasRoot) {
      throw new IllegalArgumentException("staticPrefix and staticRoot must be configured together");
    }
    if (hasPrefix && trim(effective.get("staticPrefix")).equals(trim(effective.get("proxyPrefix")))) {
      throw new IllegalArgumentException("staticPrefix must differ from proxyPrefix");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
