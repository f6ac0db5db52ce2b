package ca.gc.cra.relay.infrastructure.protocol.http;

import ca.gc.cra.relay.domain.http.HeaderCollection;
import ca.gc.cra.relay.domain.http.HeaderSizeExceededException;
import ca.gc.cra.relay.domain.http.HttpMessage;
import ca.gc.cra.relay.domain.http.HttpParseException;
import ca.gc.cra.relay.infrastructure.buffer.GrowableBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Incremental parser that accumulates byte chunks until an HTTP head is complete.
 * <p><strong>Why:</strong> Socket reads deliver arbitrary fragments; the head must be recognized exactly once no matter
 * how the bytes were split.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Buffer bytes while awaiting the {@code CRLF CRLF} terminator.</li>
 *   <li>Split the head into a start-line and header lines, folding continuation lines.</li>
 *   <li>Hand the bytes after the terminator to the message as its body prefix.</li>
 *   <li>Append every later chunk to the message body without re-parsing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per message.</p>
 *
 * @param <M> message type produced once the head is read
 * @implNote The pending buffer is released when the head completes; the message owns the body from then on.
 * @since 0.1.0
 */
public abstract class HttpMessageParser<M extends HttpMessage> {
  /** Default bound on the header block, terminator excluded. */
  public static final int DEFAULT_MAX_HEADER_BYTES = 64 * 1024;

  private static final byte[] TERMINATOR = "\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
  private static final Pattern HEADER_LINE =
      Pattern.compile("^([A-Za-z0-9-]+):\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CONTINUATION_LINE = Pattern.compile("^[ \\t]+(.*)$");

  private final int maxHeaderBytes;
  private GrowableBuffer pending = new GrowableBuffer();
  private int scanFrom;
  private M message;
  private boolean failed;

  protected HttpMessageParser(int maxHeaderBytes) {
    if (maxHeaderBytes <= 0) {
      throw new IllegalArgumentException("maxHeaderBytes must be positive");
    }
    this.maxHeaderBytes = maxHeaderBytes;
  }

  /**
   * Feeds a whole chunk.
   *
   * @see #feed(byte[], int, int)
   */
  public final void feed(byte[] chunk) throws HttpParseException {
    Objects.requireNonNull(chunk, "chunk");
    feed(chunk, 0, chunk.length);
  }

  /**
   * Feeds the next chunk of the message.
   *
   * <p>Before the head is complete the bytes are buffered and scanned for the terminator. The first time the
   * terminator is seen the head is parsed and {@link #headersRead()} turns {@code true} for good. After that,
   * chunks go straight to the message body.</p>
   *
   * @param src source bytes
   * @param offset start offset in {@code src}
   * @param length number of bytes to consume
   * @throws HttpParseException when the head is malformed or exceeds the configured size
   * @throws IllegalStateException when a previous call already failed
   */
  public final void feed(byte[] src, int offset, int length) throws HttpParseException {
    if (failed) {
      throw new IllegalStateException("parser failed earlier; discard it");
    }
    if (message != null) {
      message.appendBody(src, offset, length);
      return;
    }
    pending.write(src, offset, length);
    int end = pending.indexOf(TERMINATOR, scanFrom);
    if (end < 0) {
      int buffered = pending.readableBytes();
      scanFrom = Math.max(0, buffered - (TERMINATOR.length - 1));
      if (buffered - (TERMINATOR.length - 1) > maxHeaderBytes) {
        failed = true;
        throw new HeaderSizeExceededException(maxHeaderBytes, buffered);
      }
      return;
    }
    if (end > maxHeaderBytes) {
      failed = true;
      throw new HeaderSizeExceededException(maxHeaderBytes, end);
    }
    String head = new String(pending.copy(end), StandardCharsets.ISO_8859_1);
    pending.skip(TERMINATOR.length);
    byte[] bodyPrefix = pending.drain();
    pending = null;
    try {
      message = parseHead(head, bodyPrefix);
    } catch (HttpParseException ex) {
      failed = true;
      throw ex;
    }
  }

  /**
   * Indicates whether the head has been parsed. Once {@code true} it never reverts.
   */
  public final boolean headersRead() {
    return message != null;
  }

  /**
   * Returns the parsed message.
   *
   * @throws IllegalStateException when the head has not been read yet
   */
  public final M message() {
    if (message == null) {
      throw new IllegalStateException("headers not read yet");
    }
    return message;
  }

  public final int maxHeaderBytes() {
    return maxHeaderBytes;
  }

  /**
   * Builds the typed message once the start-line and headers are known.
   *
   * @param startLine first line of the head
   * @param headers parsed headers
   * @param bodyPrefix bytes received after the terminator
   * @return the message
   * @throws HttpParseException when the start-line does not match the expected grammar
   */
  protected abstract M createMessage(String startLine, HeaderCollection headers, byte[] bodyPrefix)
      throws HttpParseException;

  private M parseHead(String head, byte[] bodyPrefix) throws HttpParseException {
    String[] lines = head.split("\r\n", -1);
    HeaderCollection headers = new HeaderCollection();
    String name = null;
    StringBuilder value = null;
    for (int i = 1; i < lines.length; i++) {
      String line = lines[i];
      Matcher field = HEADER_LINE.matcher(line);
      if (field.matches()) {
        if (name != null) {
          headers.add(name, value.toString().trim());
        }
        name = field.group(1);
        value = new StringBuilder(field.group(2));
        continue;
      }
      Matcher continuation = CONTINUATION_LINE.matcher(line);
      if (continuation.matches()) {
        if (name == null) {
          throw new HttpParseException("Invalid header, unexpected continuation", line);
        }
        value.append(continuation.group(1).trim());
        continue;
      }
      throw new HttpParseException("Invalid header line", line);
    }
    if (name != null) {
      headers.add(name, value.toString().trim());
    }
    return createMessage(lines[0], headers, bodyPrefix);
  }
}
