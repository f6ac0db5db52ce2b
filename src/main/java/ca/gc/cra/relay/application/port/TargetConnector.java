package ca.gc.cra.relay.application.port;

import java.io.IOException;

/**
 * Opens connections to the proxy target.
 * <p>Implementations return only once the stream is ready for application bytes; for TLS that means the handshake
 * has completed. A connector that fails must not leak a half-open socket.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TargetConnector {
  /**
   * Connects to {@code host:port}.
   *
   * @param host target host name or address
   * @param port target port
   * @return connected stream; the caller owns and closes it
   * @throws IOException when the connection or handshake fails
   */
  StreamConnection connect(String host, int port) throws IOException;
}
