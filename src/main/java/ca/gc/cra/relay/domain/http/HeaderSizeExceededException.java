package ca.gc.cra.relay.domain.http;

/**
 * Raised when a header block grows past the configured limit before its terminator arrives.
 *
 * @since 0.1.0
 */
public final class HeaderSizeExceededException extends HttpParseException {
  private static final long serialVersionUID = 1L;

  private final int limit;

  public HeaderSizeExceededException(int limit, int observed) {
    super("header block exceeds " + limit + " bytes (buffered " + observed + ")", null);
    this.limit = limit;
  }

  public int limit() {
    return limit;
  }
}
