/**
 * Socket adapters: the listening server and the plaintext and TLS target connectors.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.relay.infrastructure.net.RelayServer} accepts on one thread and
 * hands each connection to a worker; connectors are stateless and thread-safe.</p>
 * <p><strong>Security:</strong> TLS connections verify the target certificate and host name using the JVM trust store.</p>
 */
package ca.gc.cra.relay.infrastructure.net;
