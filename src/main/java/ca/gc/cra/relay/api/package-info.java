/**
 * Command-line entry points for RELAY.
 * <p><strong>Concurrency:</strong> Runs on the main thread; the server it starts owns its own threads.</p>
 * <p><strong>Observability:</strong> Usage text goes to stdout through {@link ca.gc.cra.relay.api.CliPrinter};
 * diagnostics go through SLF4J.</p>
 */
package ca.gc.cra.relay.api;
