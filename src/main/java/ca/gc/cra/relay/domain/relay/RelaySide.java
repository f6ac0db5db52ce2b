package ca.gc.cra.relay.domain.relay;

/**
 * One of the two peers of a relayed exchange.
 *
 * @since 0.1.0
 */
public enum RelaySide {
  /** The connection accepted from the client. */
  CLIENT("clientToTarget"),
  /** The connection opened to the proxy target. */
  TARGET("targetToClient");

  private final String forwardMetricSuffix;

  RelaySide(String forwardMetricSuffix) {
    this.forwardMetricSuffix = forwardMetricSuffix;
  }

  /**
   * Returns the {@code relay.bytes.*} suffix for bytes read from this side and forwarded to the other.
   */
  public String forwardMetricSuffix() {
    return forwardMetricSuffix;
  }
}
