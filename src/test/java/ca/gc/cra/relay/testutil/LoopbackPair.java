package ca.gc.cra.relay.testutil;

import ca.gc.cra.relay.infrastructure.net.SocketStreamConnection;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Two connected loopback sockets: {@link #serverSide()} plays the accepted client connection, {@link #peer()} is the
 * test's end of it.
 */
public final class LoopbackPair implements AutoCloseable {
  private final Socket peer;
  private final SocketStreamConnection serverSide;

  private LoopbackPair(Socket peer, Socket accepted) {
    this.peer = peer;
    this.serverSide = new SocketStreamConnection(accepted);
  }

  public static LoopbackPair open() throws IOException {
    try (ServerSocket listener = new ServerSocket()) {
      listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
      Socket peer = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
      Socket accepted = listener.accept();
      peer.setSoTimeout(5_000);
      return new LoopbackPair(peer, accepted);
    }
  }

  public Socket peer() {
    return peer;
  }

  public SocketStreamConnection serverSide() {
    return serverSide;
  }

  /** Reads everything the server side wrote, until it closes. */
  public String readPeerUntilClosed() throws IOException {
    InputStream in = peer.getInputStream();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[4096];
    int n;
    while ((n = in.read(buffer)) > 0) {
      out.write(buffer, 0, n);
    }
    return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
  }

  @Override
  public void close() throws IOException {
    try {
      serverSide.close();
    } finally {
      peer.close();
    }
  }
}
