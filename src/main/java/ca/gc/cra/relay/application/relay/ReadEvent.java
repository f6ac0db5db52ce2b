package ca.gc.cra.relay.application.relay;

import ca.gc.cra.relay.domain.relay.RelaySide;
import java.io.IOException;
import java.util.Objects;

/**
 * Readiness event produced by a {@link ReadinessMultiplexer}: a chunk of data, end of stream, or a read failure.
 *
 * <p>The data array is handed over without copying; the consumer owns it.</p>
 *
 * @since 0.1.0
 */
public final class ReadEvent {
  private static final byte[] EMPTY = new byte[0];

  private final RelaySide side;
  private final byte[] data;
  private final IOException failure;

  private ReadEvent(RelaySide side, byte[] data, IOException failure) {
    this.side = Objects.requireNonNull(side, "side");
    this.data = data;
    this.failure = failure;
  }

  static ReadEvent data(RelaySide side, byte[] chunk) {
    return new ReadEvent(side, Objects.requireNonNull(chunk, "chunk"), null);
  }

  static ReadEvent endOfStream(RelaySide side) {
    return new ReadEvent(side, EMPTY, null);
  }

  static ReadEvent failure(RelaySide side, IOException failure) {
    return new ReadEvent(side, EMPTY, Objects.requireNonNull(failure, "failure"));
  }

  public RelaySide side() {
    return side;
  }

  public byte[] data() {
    return data;
  }

  public IOException failure() {
    return failure;
  }

  public boolean failed() {
    return failure != null;
  }

  /**
   * True when the peer closed its side; also true for an empty read.
   */
  public boolean endOfStream() {
    return failure == null && data.length == 0;
  }

  @Override
  public String toString() {
    if (failed()) {
      return "ReadEvent{" + side + ", failure=" + failure + '}';
    }
    return "ReadEvent{" + side + ", bytes=" + data.length + '}';
  }
}
