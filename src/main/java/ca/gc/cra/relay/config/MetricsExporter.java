package ca.gc.cra.relay.config;

import java.util.Locale;

/**
 * Metrics backend selected by the {@code metricsExporter} key.
 */
public enum MetricsExporter {
  /** OpenTelemetry over OTLP gRPC. */
  OTLP,
  /** Metrics discarded. */
  NONE;

  /**
   * Parses a configuration value; blank selects {@link #NONE}.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static MetricsExporter fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "otlp" -> OTLP;
      case "none" -> NONE;
      default -> throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
    };
  }
}
