/**
 * Metrics adapters that bridge the relay's {@link ca.gc.cra.relay.application.port.MetricsPort} to OpenTelemetry or
 * discard everything.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; instruments are created once per key and cached.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code relay.*} and {@code protocol.http.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counters and sizes are exported, never payload bytes.</p>
 */
package ca.gc.cra.relay.infrastructure.metrics;
