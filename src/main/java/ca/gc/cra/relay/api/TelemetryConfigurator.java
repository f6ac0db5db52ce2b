package ca.gc.cra.relay.api;

import ca.gc.cra.relay.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the telemetry settings of an effective configuration before the metrics adapter is built.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Checks {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes}.
   *
   * @param config effective configuration
   * @throws IllegalArgumentException when a value is malformed
   */
  static void validate(Map<String, String> config) {
    if (config == null || config.isEmpty()) {
      return;
    }
    String exporter = trim(config.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    String endpoint = trim(config.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      if (!exporter.equals("otlp")) {
        log.warn("otelEndpoint is ignored unless metricsExporter=otlp");
      }
    }

    String resourceAttributes = trim(config.get("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    log.debug("Metrics exporter: {}", exporter.isEmpty() ? "none" : exporter);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
