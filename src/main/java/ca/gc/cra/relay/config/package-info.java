/**
 * Configuration sources and wiring: YAML loading, precedence merging, typed settings, and the composition root.
 * <p><strong>Concurrency:</strong> Used on the single CLI bootstrap thread; resulting records are immutable.</p>
 * <p><strong>Security:</strong> Host names, ports, and directories are validated before anything is bound or served.</p>
 */
package ca.gc.cra.relay.config;
