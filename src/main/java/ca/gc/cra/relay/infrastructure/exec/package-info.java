/**
 * Executor factories for connection workers and stream reader threads.
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return managed executors.</p>
 * <p><strong>Performance:</strong> Thread names carry a role prefix to aid thread dumps.</p>
 */
package ca.gc.cra.relay.infrastructure.exec;
