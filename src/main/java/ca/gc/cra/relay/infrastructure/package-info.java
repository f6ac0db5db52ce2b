/**
 * Infrastructure adapters for RELAY: sockets, TLS, HTTP parsing, handlers, metrics, and thread pools.
 * <p><strong>Role:</strong> Adapter layer implementing the ports declared in {@code ca.gc.cra.relay.application.port}.</p>
 * <p><strong>Concurrency:</strong> Connection-scoped objects are confined to one worker thread unless documented otherwise.</p>
 * <p><strong>Security:</strong> TLS connectors validate the target certificate against the JVM trust store.</p>
 */
package ca.gc.cra.relay.infrastructure;
