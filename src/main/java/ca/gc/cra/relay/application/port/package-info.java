/**
 * Ports implemented by infrastructure adapters or supplied by callers.
 * <p><strong>Role:</strong> Seams for target connections, byte streams, request handlers, rewrite strategies, and metrics.</p>
 */
package ca.gc.cra.relay.application.port;
