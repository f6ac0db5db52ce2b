package ca.gc.cra.relay.config;

import ca.gc.cra.relay.validation.Net;
import ca.gc.cra.relay.validation.Numbers;
import ca.gc.cra.relay.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed settings for {@code relay serve}.
 * <p><strong>Why:</strong> Turns the merged string map into validated values once, before any socket is bound.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Describe the listen address, the proxy target, and the optional static file mount.</li>
 *   <li>Bound header and read sizes.</li>
 *   <li>Carry the header names stripped by the built-in rewriter and the metrics exporter settings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param listenAddress address the server binds to
 * @param listenPort port the server binds to; {@code 0} picks an ephemeral port
 * @param targetHost host every proxied request is sent to
 * @param targetPort target port
 * @param targetTls whether target connections use TLS
 * @param connectTimeout TCP connect timeout towards the target; zero waits indefinitely
 * @param proxyPrefix URI prefix routed to the relay
 * @param staticPrefix URI prefix served from {@code staticRoot}, when configured
 * @param staticRoot directory served under {@code staticPrefix}, when configured
 * @param maxHeaderBytes bound on request and response heads
 * @param readChunkBytes bytes requested per socket read
 * @param requestStripHeaders header names removed from every relayed request
 * @param responseStripHeaders header names removed from every relayed response head
 * @param metricsExporter metrics backend
 * @param otelEndpoint OTLP collector endpoint; blank selects the exporter default
 * @param otelResourceAttributes extra OpenTelemetry resource attributes as {@code k=v,k2=v2}
 * @since 0.1.0
 */
public record RelayConfig(
    String listenAddress,
    int listenPort,
    String targetHost,
    int targetPort,
    boolean targetTls,
    Duration connectTimeout,
    String proxyPrefix,
    Optional<String> staticPrefix,
    Optional<Path> staticRoot,
    int maxHeaderBytes,
    int readChunkBytes,
    List<String> requestStripHeaders,
    List<String> responseStripHeaders,
    MetricsExporter metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes) {

  public static final int MIN_HEADER_BYTES = 1024;
  public static final int MAX_HEADER_BYTES = 1024 * 1024;
  public static final int MIN_CHUNK_BYTES = 512;
  public static final int MAX_CHUNK_BYTES = 1024 * 1024;
  private static final long MAX_CONNECT_TIMEOUT_MILLIS = 600_000L;

  /**
   * Validates and normalizes the settings.
   *
   * @throws IllegalArgumentException when a value is out of range or the static mount is half configured
   */
  public RelayConfig {
    listenAddress = Net.validateHost("listenAddress", listenAddress);
    Numbers.requireRange("listenPort", listenPort, 0, 65_535);
    targetHost = Net.validateHost("targetHost", targetHost);
    Numbers.requireRange("targetPort", targetPort, 1, 65_535);
    connectTimeout = Objects.requireNonNullElse(connectTimeout, Duration.ZERO);
    Numbers.requireRange("connectTimeoutMillis", connectTimeout.toMillis(), 0, MAX_CONNECT_TIMEOUT_MILLIS);
    proxyPrefix = Strings.requirePrintableAscii("proxyPrefix", proxyPrefix, 1024);
    staticPrefix = Objects.requireNonNullElse(staticPrefix, Optional.<String>empty())
        .map(p -> Strings.requirePrintableAscii("staticPrefix", p, 1024));
    staticRoot = Objects.requireNonNullElse(staticRoot, Optional.<Path>empty());
    if (staticPrefix.isPresent() != staticRoot.isPresent()) {
      throw new IllegalArgumentException("staticPrefix and staticRoot must be configured together");
    }
    Numbers.requireRange("maxHeaderBytes", maxHeaderBytes, MIN_HEADER_BYTES, MAX_HEADER_BYTES);
    Numbers.requireRange("readChunkBytes", readChunkBytes, MIN_CHUNK_BYTES, MAX_CHUNK_BYTES);
    requestStripHeaders = headerNames("requestStripHeaders", requestStripHeaders);
    responseStripHeaders = headerNames("responseStripHeaders", responseStripHeaders);
    metricsExporter = Objects.requireNonNullElse(metricsExporter, MetricsExporter.NONE);
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
    otelResourceAttributes = otelResourceAttributes == null ? "" : otelResourceAttributes.trim();
  }

  /**
   * Builds settings from a merged key/value map.
   *
   * @param options merged configuration; {@code targetHost} is required
   * @return validated settings
   * @throws IllegalArgumentException when a value is missing, malformed, or out of range
   */
  public static RelayConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String targetHost = trimToNull(options.get("targetHost"));
    if (targetHost == null) {
      throw new IllegalArgumentException("targetHost is required");
    }
    return new RelayConfig(
        valueOr(options, "listenAddress", "0.0.0.0"),
        Numbers.parseIntInRange("listenPort", valueOr(options, "listenPort", "8080"), 0, 65_535),
        targetHost,
        Net.validatePort("targetPort", valueOr(options, "targetPort", "443")),
        parseBoolean("targetTls", valueOr(options, "targetTls", "true")),
        Duration.ofMillis(Numbers.parseIntInRange(
            "connectTimeoutMillis",
            valueOr(options, "connectTimeoutMillis", "10000"),
            0,
            (int) MAX_CONNECT_TIMEOUT_MILLIS)),
        valueOr(options, "proxyPrefix", "/"),
        Optional.ofNullable(trimToNull(options.get("staticPrefix"))),
        Optional.ofNullable(trimToNull(options.get("staticRoot"))).map(RelayConfig::parsePath),
        Numbers.parseIntInRange(
            "maxHeaderBytes", valueOr(options, "maxHeaderBytes", "65536"), MIN_HEADER_BYTES, MAX_HEADER_BYTES),
        Numbers.parseIntInRange(
            "readChunkBytes", valueOr(options, "readChunkBytes", "16384"), MIN_CHUNK_BYTES, MAX_CHUNK_BYTES),
        Strings.splitList(options.get("requestStripHeaders")),
        Strings.splitList(options.get("responseStripHeaders")),
        MetricsExporter.fromString(options.get("metricsExporter")),
        options.getOrDefault("otelEndpoint", ""),
        options.getOrDefault("otelResourceAttributes", ""));
  }

  /**
   * Returns a configuration relaying to {@code targetHost} with every other value at its default.
   *
   * @param targetHost proxy target
   * @return default settings
   */
  public static RelayConfig defaults(String targetHost) {
    return fromMap(Map.of("targetHost", targetHost));
  }

  private static List<String> headerNames(String name, List<String> names) {
    if (names == null) {
      return List.of();
    }
    return names.stream().map(n -> Strings.requireHeaderName(name, n)).toList();
  }

  private static String valueOr(Map<String, String> options, String key, String fallback) {
    String value = trimToNull(options.get(key));
    return value == null ? fallback : value;
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static boolean parseBoolean(String name, String raw) {
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }

  private static Path parsePath(String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("staticRoot is not a valid path: " + raw, ex);
    }
  }
}
