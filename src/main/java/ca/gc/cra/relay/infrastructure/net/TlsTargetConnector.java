package ca.gc.cra.relay.infrastructure.net;

import ca.gc.cra.relay.application.port.StreamConnection;
import ca.gc.cra.relay.application.port.TargetConnector;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Opens TLS connections to the proxy target.
 * <p><strong>Why:</strong> The usual target is an HTTPS service, while clients talk plaintext HTTP to the relay.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Connect a TCP socket within the configured timeout.</li>
 *   <li>Layer TLS over it with SNI and HTTPS host name verification, then complete the handshake.</li>
 *   <li>Close the socket if any step fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; {@link SSLSocketFactory} instances are thread-safe.</p>
 *
 * @since 0.1.0
 * @see PlainTargetConnector
 */
public final class TlsTargetConnector implements TargetConnector {
  private static final Logger log = LoggerFactory.getLogger(TlsTargetConnector.class);

  private final SSLSocketFactory socketFactory;
  private final Duration connectTimeout;

  /**
   * Creates a connector that trusts the JVM default trust store.
   *
   * @param connectTimeout maximum time to wait for the TCP handshake; zero waits indefinitely
   */
  public TlsTargetConnector(Duration connectTimeout) {
    this((SSLSocketFactory) SSLSocketFactory.getDefault(), connectTimeout);
  }

  /**
   * Creates a connector with an explicit socket factory, e.g. one built from a custom trust store.
   */
  public TlsTargetConnector(SSLSocketFactory socketFactory, Duration connectTimeout) {
    this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    if (connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must not be negative");
    }
  }

  @Override
  public StreamConnection connect(String host, int port) throws IOException {
    Socket plain = PlainTargetConnector.openSocket(host, port, connectTimeout);
    SSLSocket tls;
    try {
      tls = (SSLSocket) socketFactory.createSocket(plain, host, port, true);
    } catch (IOException ex) {
      PlainTargetConnector.closeQuietly(plain, ex);
      throw ex;
    }
    try {
      SSLParameters params = tls.getSSLParameters();
      params.setEndpointIdentificationAlgorithm("HTTPS");
      tls.setSSLParameters(params);
      tls.startHandshake();
      log.debug("TLS session established with {}:{} using {}", host, port, tls.getSession().getProtocol());
      return new SocketStreamConnection(tls);
    } catch (IOException ex) {
      PlainTargetConnector.closeQuietly(tls, ex);
      throw ex;
    }
  }
}
