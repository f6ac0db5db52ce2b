package ca.gc.cra.relay.infrastructure.metrics;

import ca.gc.cra.relay.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected with {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
