package ca.gc.cra.relay.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the relay: resource attributes, OTLP reader, and meter.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.relay";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Creates a provider exporting over OTLP gRPC.
   *
   * @param endpoint collector endpoint; blank selects {@value #DEFAULT_ENDPOINT}
   * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be blank
   */
  static Provider otlp(String endpoint, String resourceAttributes) {
    String effectiveEndpoint = (endpoint == null || endpoint.isBlank()) ? DEFAULT_ENDPOINT : endpoint.trim();
    OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(effectiveEndpoint).build();
    MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
    Provider provider = build(reader, parseResourceAttributes(resourceAttributes));
    log.info("OpenTelemetry metrics exporting to {} every {}s", effectiveEndpoint, EXPORT_INTERVAL.toSeconds());
    return provider;
  }

  static Provider forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static Provider build(MetricReader reader, Attributes extras) {
    String version = detectServiceVersion();
    SdkMeterProvider sdk = SdkMeterProvider.builder()
        .setResource(buildResource(version, extras))
        .registerMetricReader(reader)
        .build();
    Meter meter = sdk.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new Provider(sdk, meter);
  }

  static Resource buildResource(String version, Attributes additional) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "relay")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(Resource.create(builder.build())).merge(extra);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      String key = idx > 0 ? trimmed.substring(0, idx).trim() : "";
      String value = idx > 0 ? trimmed.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed otelResourceAttributes entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Falling back to runtime MXBean for instance id", ex);
      String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
      return runtimeName != null ? runtimeName : "unknown";
    }
  }

  static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null && !pkg.getImplementationVersion().isBlank()) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/relay/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  /** Meter provider plus the relay's meter; closing flushes and shuts the provider down. */
  static final class Provider implements AutoCloseable {
    private final SdkMeterProvider sdk;
    private final Meter meter;

    private Provider(SdkMeterProvider sdk, Meter meter) {
      this.sdk = sdk;
      this.meter = meter;
    }

    Meter meter() {
      return meter;
    }

    void forceFlush() {
      CompletableResultCode result = sdk.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      try {
        CompletableResultCode shutdown = sdk.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
