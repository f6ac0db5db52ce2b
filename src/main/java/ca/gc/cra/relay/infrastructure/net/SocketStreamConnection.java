package ca.gc.cra.relay.infrastructure.net;

import ca.gc.cra.relay.application.port.StreamConnection;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link StreamConnection} backed by a connected {@link Socket}, plaintext or TLS.
 */
public final class SocketStreamConnection implements StreamConnection {
  private final Socket socket;

  public SocketStreamConnection(Socket socket) {
    this.socket = Objects.requireNonNull(socket, "socket");
  }

  @Override
  public InputStream input() throws IOException {
    return socket.getInputStream();
  }

  @Override
  public OutputStream output() throws IOException {
    return socket.getOutputStream();
  }

  @Override
  public String describe() {
    SocketAddress remote = socket.getRemoteSocketAddress();
    if (remote instanceof InetSocketAddress inet) {
      String host = inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
      return host + ":" + inet.getPort();
    }
    return String.valueOf(remote);
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }
}
