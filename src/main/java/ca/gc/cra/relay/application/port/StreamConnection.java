package ca.gc.cra.relay.application.port;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * <strong>What:</strong> Established, bidirectional byte stream to one peer.
 * <p><strong>Why:</strong> The relay treats plaintext and TLS connections alike as opaque byte channels.</p>
 * <p><strong>Thread-safety:</strong> The input may be read by one thread while another writes the output; each side
 * must only be used by a single thread at a time.</p>
 *
 * @since 0.1.0
 */
public interface StreamConnection extends Closeable {
  /**
   * Returns the stream of bytes sent by the peer.
   *
   * @throws IOException if the connection is no longer readable
   */
  InputStream input() throws IOException;

  /**
   * Returns the stream used to send bytes to the peer.
   *
   * @throws IOException if the connection is no longer writable
   */
  OutputStream output() throws IOException;

  /**
   * Returns a short description of the peer for log messages, such as {@code 10.0.0.5:51234}.
   */
  String describe();
}
