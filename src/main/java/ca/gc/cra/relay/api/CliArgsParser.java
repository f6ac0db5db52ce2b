package ca.gc.cra.relay.api;

import ca.gc.cra.relay.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a mutable map, splitting on the first {@code '='}.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Parses arguments; a repeated key keeps its last value. An empty value ({@code key=}) is kept as empty so it can
   * clear a YAML setting.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument has no {@code '='}, an invalid key, or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!value.isEmpty()) {
        value = Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
