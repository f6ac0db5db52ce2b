package ca.gc.cra.relay.infrastructure.net;

import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.application.port.TargetConnector;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Opens plaintext TCP connections to the proxy target.
 * <p><strong>Why:</strong> Targets reached over a trusted network, and loopback targets in tests, need no TLS.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see TlsTargetConnector
 */
public final class PlainTargetConnector implements TargetConnector {
  private static final Logger log = LoggerFactory.getLogger(PlainTargetConnector.class);

  private final Duration connectTimeout;

  /**
   * Creates a connector.
   *
   * @param connectTimeout maximum time to wait for the TCP handshake; zero waits indefinitely
   */
  public PlainTargetConnector(Duration connectTimeout) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    if (connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must not be negative");
    }
  }

  @Override
  public StreamConnection connect(String host, int port) throws IOException {
    return new SocketStreamConnection(openSocket(host, port, connectTimeout));
  }

  static Socket openSocket(String host, int port, Duration timeout) throws IOException {
    Socket socket = new Socket();
    try {
      socket.setTcpNoDelay(true);
      socket.connect(new InetSocketAddress(host, port), (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
      log.debug("Connected to {}:{}", host, port);
      return socket;
    } catch (IOException ex) {
      closeQuietly(socket, ex);
      throw ex;
    }
  }

  static void closeQuietly(Socket socket, IOException primary) {
    try {
      socket.close();
    } catch (IOException closeEx) {
      primary.addSuppressed(closeEx);
    }
  }
}
