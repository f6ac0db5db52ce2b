package ca.gc.cra.relay.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each RELAY CLI mode.
 *
 * <p>The defaults are the lowest-precedence layer under YAML and CLI values. {@code targetHost} has no default.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code serve})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "serve" -> buildServeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("listenAddress", "0.0.0.0");
    map.put("listenPort", "8080");
    map.put("targetPort", "443");
    map.put("targetTls", "true");
    map.put("connectTimeoutMillis", "10000");
    map.put("proxyPrefix", "/");
    map.put("staticPrefix", "");
    map.put("staticRoot", "");
    map.put("maxHeaderBytes", "65536");
    map.put("readChunkBytes", "16384");
    map.put("requestStripHeaders", "");
    map.put("responseStripHeaders", "");
    return Map.copyOf(map);
  }
}
