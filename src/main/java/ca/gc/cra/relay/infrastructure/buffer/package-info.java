/**
 * Byte buffers used while an HTTP head is still being received.
 * <p><strong>Concurrency:</strong> Buffers are single-owner and not thread-safe.</p>
 * <p><strong>Performance:</strong> Amortized O(1) appends with power-of-two growth and in-place compaction.</p>
 */
package ca.gc.cra.relay.infrastructure.buffer;
