package ca.gc.cra.relay.domain.relay;

/**
 * <strong>What:</strong> Outcome of one relayed exchange.
 * <p><strong>Why:</strong> Surfaces the forwarded byte counts for logging and metrics; nothing downstream branches on them.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param clientToTargetBytes bytes written to the target, including the serialized request head
 * @param targetToClientBytes bytes written to the client, including the serialized response head
 * @param responseHeadersForwarded whether a complete response head reached the client
 * @param closedBy side whose end of stream ended the relay loop
 * @since 0.1.0
 */
public record RelayResult(
    long clientToTargetBytes,
    long targetToClientBytes,
    boolean responseHeadersForwarded,
    RelaySide closedBy) {

  public RelayResult {
    if (clientToTargetBytes < 0 || targetToClientBytes < 0) {
      throw new IllegalArgumentException("byte counts must be non-negative");
    }
  }
}
