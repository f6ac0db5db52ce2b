package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Domain port for emitting counters and histogram observations.
 * <p><strong>Why:</strong> Keeps the relay and connection handling independent of the metrics backend.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from many connection threads.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the counter identified by {@code key}.
   *
   * @param key metric name, for example {@code relay.connection.accepted}
   */
  void increment(String key);

  /**
   * Records a value for the histogram identified by {@code key}.
   *
   * @param key metric name, for example {@code relay.bytes.clientToTarget}
   * @param value observed value
   */
  void observe(String key, long value);

  /** Metrics sink that drops everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
