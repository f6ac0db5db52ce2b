package ca.gc.cra.relay.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.StreamConnection;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TargetConnectorsTest {

  @Test
  void plainConnectorReturnsWritableStream() throws Exception {
    try (ServerSocket server = listen()) {
      try (StreamConnection connection =
          new PlainTargetConnector(Duration.ofSeconds(5)).connect("127.0.0.1", server.getLocalPort());
          Socket accepted = server.accept()) {
        OutputStream out = connection.output();
        out.write("ping".getBytes(StandardCharsets.US_ASCII));
        out.flush();

        assertEquals("ping", new String(accepted.getInputStream().readNBytes(4), StandardCharsets.US_ASCII));
        assertTrue(connection.describe().startsWith("127.0.0.1:"), connection.describe());
      }
    }
  }

  @Test
  void refusedConnectionPropagates() throws Exception {
    int port;
    try (ServerSocket server = listen()) {
      port = server.getLocalPort();
    }

    assertThrows(IOException.class, () -> new PlainTargetConnector(Duration.ofSeconds(2)).connect("127.0.0.1", port));
  }

  @Test
  void tlsConnectorFailsWhenPeerDoesNotSpeakTls() throws Exception {
    try (ServerSocket server = listen()) {
      Thread peer = new Thread(() -> {
        try (Socket socket = server.accept()) {
          socket.getOutputStream().write("HTTP/1.1 400 Bad Request\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        } catch (IOException ignored) {
          // test peer
        }
      });
      peer.setDaemon(true);
      peer.start();

      assertThrows(IOException.class,
          () -> new TlsTargetConnector(Duration.ofSeconds(5)).connect("127.0.0.1", server.getLocalPort()));
    }
  }

  @Test
  void negativeTimeoutIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PlainTargetConnector(Duration.ofMillis(-1)));
    assertThrows(IllegalArgumentException.class, () -> new TlsTargetConnector(Duration.ofMillis(-1)));
  }

  private static ServerSocket listen() throws IOException {
    ServerSocket server = new ServerSocket();
    server.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
    return server;
  }
}
