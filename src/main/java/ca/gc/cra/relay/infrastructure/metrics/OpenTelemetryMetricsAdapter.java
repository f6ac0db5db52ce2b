package ca.gc.cra.relay.infrastructure.metrics;

import ca.gc.cra.relay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Forwards relay counters and byte observations to OpenTelemetry.
 * <p><strong>Mapping:</strong> {@link #increment(String)} adds one to a {@link LongCounter};
 * {@link #observe(String, long)} records into a {@link LongHistogram}. Each instrument carries the original key in
 * the {@code relay.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("relay.metric.key");
  private static final String FALLBACK_METRIC_NAME = "relay.metric";

  private final OpenTelemetryBootstrap.Provider provider;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting over OTLP gRPC.
   *
   * @param endpoint collector endpoint; blank selects {@code http://localhost:4317}
   * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be blank
   */
  public OpenTelemetryMetricsAdapter(String endpoint, String resourceAttributes) {
    this(OpenTelemetryBootstrap.otlp(endpoint, resourceAttributes));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Provider provider) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.meter = provider.meter();
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Counter instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Histogram instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  void forceFlush() {
    provider.forceFlush();
  }

  /** Flushes pending data and shuts the meter provider down. */
  @Override
  public void close() {
    provider.close();
  }

  private Counter createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Relay counter for " + key)
        .build();
    log.debug("Created counter {} for key {}", name, key);
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setUnit("By")
        .setDescription("Relay observation for " + key)
        .build();
    log.debug("Created histogram {} for key {}", name, key);
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  /**
   * Lower-cases the key and replaces characters OpenTelemetry rejects in instrument names with {@code _}.
   */
  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
