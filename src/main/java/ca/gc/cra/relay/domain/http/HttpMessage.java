package ca.gc.cra.relay.domain.http;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * <strong>What:</strong> HTTP/1.x message whose header block has been fully parsed.
 * <p><strong>Why:</strong> Gives rewrite strategies a mutable view of the start-line and headers while the body is still
 * streaming.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the start-line, the header collection, and the body bytes received so far.</li>
 *   <li>Render the canonical wire form: start-line, CRLF, headers, CRLF, buffered body.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by one connection.</p>
 *
 * @implNote Header text is kept as ISO-8859-1 so that every byte maps to one char and back unchanged.
 * @since 0.1.0
 */
public abstract class HttpMessage {
  /** Line terminator used on the wire. */
  public static final String CRLF = "\r\n";

  private final HeaderCollection headers;
  private final ByteArrayOutputStream body;
  private String startLine;

  /**
   * Creates a message from parsed parts.
   *
   * @param startLine request-line or status-line without its terminator
   * @param headers parsed headers; ownership passes to this message
   * @param bodyPrefix body bytes that arrived together with the header block; copied
   */
  protected HttpMessage(String startLine, HeaderCollection headers, byte[] bodyPrefix) {
    this.startLine = Objects.requireNonNull(startLine, "startLine");
    this.headers = Objects.requireNonNull(headers, "headers");
    byte[] prefix = bodyPrefix == null ? new byte[0] : bodyPrefix;
    this.body = new ByteArrayOutputStream(Math.max(32, prefix.length));
    this.body.write(prefix, 0, prefix.length);
  }

  public String startLine() {
    return startLine;
  }

  /**
   * Overwrites the start-line. Subclasses call this whenever one of their start-line fields changes.
   */
  protected void setStartLine(String startLine) {
    this.startLine = Objects.requireNonNull(startLine, "startLine");
  }

  public HeaderCollection headers() {
    return headers;
  }

  /**
   * Returns a copy of the body bytes buffered so far.
   */
  public byte[] body() {
    return body.toByteArray();
  }

  public int bodyLength() {
    return body.size();
  }

  /**
   * Appends body bytes received after the header block.
   *
   * @param src source array
   * @param offset start offset in {@code src}
   * @param length number of bytes to append
   */
  public void appendBody(byte[] src, int offset, int length) {
    Objects.requireNonNull(src, "src");
    if (offset < 0 || length < 0 || offset + length > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    body.write(src, offset, length);
  }

  /**
   * Renders the head (start-line, headers, blank line) as text.
   */
  public String head() {
    return startLine + CRLF + headers.serialize() + CRLF;
  }

  /**
   * Serializes the message in canonical form: head followed by the buffered body bytes. The head is encoded as
   * ISO-8859-1; characters outside that charset become {@code ?}.
   *
   * @return wire bytes; a fresh array on every call
   */
  public byte[] toWireBytes() {
    byte[] head = head().getBytes(StandardCharsets.ISO_8859_1);
    ByteArrayOutputStream out = new ByteArrayOutputStream(head.length + body.size());
    out.write(head, 0, head.length);
    byte[] buffered = body.toByteArray();
    out.write(buffered, 0, buffered.length);
    return out.toByteArray();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{startLine=" + startLine
        + ", headers=" + headers.size()
        + ", bufferedBody=" + body.size() + '}';
  }
}
