/**
 * Per-connection request handling: reading the request head and routing it by URI prefix.
 * <p><strong>Concurrency:</strong> One {@link ca.gc.cra.relay.application.server.ConnectionHandler#handle} call per
 * worker thread; the router is configured before the server starts and read-only afterwards.</p>
 */
package ca.gc.cra.relay.application.server;
