package ca.gc.cra.relay.domain.http;

/**
 * Signals a malformed HTTP head: bad start-line, bad header line, or a continuation line with no field
 * before it. Fatal for the one message and its connection; never retried.
 *
 * @since 0.1.0
 */
public class HttpParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String offendingLine;

  public HttpParseException(String message, String offendingLine) {
    super(message);
    this.offendingLine = offendingLine;
  }

  /**
   * Returns the line that failed to parse, or {@code null} when the failure is not tied to a line.
   */
  public String offendingLine() {
    return offendingLine;
  }
}
