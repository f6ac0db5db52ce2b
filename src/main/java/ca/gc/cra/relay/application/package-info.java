/**
 * Application services for RELAY: request routing, connection handling, and the streaming relay engine.
 * <p><strong>Role:</strong> Orchestrates domain messages through ports; adapters live under {@code infrastructure}.</p>
 * <p><strong>Concurrency:</strong> One worker thread per accepted connection; no state is shared across connections.</p>
 */
package ca.gc.cra.relay.application;
