package ca.gc.cra.relay.application.relay;

import ca.gc.cra.relay.domain.relay.RelaySide;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Waits on several blocking byte sources at once and merges their reads into one ordered queue.
 * <p><strong>Why:</strong> TLS sockets cannot join a NIO selector, yet the relay must react to whichever peer speaks
 * first without starving the other.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run one reader task per watched source on the supplied executor.</li>
 *   <li>Publish data, end-of-stream, and failure events in the order the reads completed.</li>
 *   <li>Stop publishing once closed; readers blocked on a socket exit when that socket closes.</li>
 * </ul>
 * <p><strong>Ordering policy:</strong> first-ready-wins. There is no priority between sources; a source's events keep
 * their relative order.</p>
 * <p><strong>Thread-safety:</strong> {@link #next()} is meant for a single consumer thread.</p>
 *
 * @since 0.1.0
 */
public final class ReadinessMultiplexer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ReadinessMultiplexer.class);
  private static final int QUEUE_CAPACITY = 16;
  private static final long OFFER_POLL_MILLIS = 100L;

  private final ExecutorService executor;
  private final int chunkSize;
  private final BlockingQueue<ReadEvent> events = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
  private final List<Future<?>> readers = new ArrayList<>(2);
  private volatile boolean closed;

  /**
   * Creates a multiplexer.
   *
   * @param executor executor running the reader tasks; must accept at least one task per watched source
   * @param chunkSize maximum bytes per read
   */
  public ReadinessMultiplexer(ExecutorService executor, int chunkSize) {
    this.executor = Objects.requireNonNull(executor, "executor");
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    this.chunkSize = chunkSize;
  }

  /**
   * Starts reading {@code in} on behalf of {@code side}.
   *
   * @param side peer the stream belongs to
   * @param in stream to read until end of stream or failure
   */
  public void watch(RelaySide side, InputStream in) {
    Objects.requireNonNull(side, "side");
    Objects.requireNonNull(in, "in");
    if (closed) {
      throw new IllegalStateException("multiplexer closed");
    }
    readers.add(executor.submit(() -> pump(side, in)));
  }

  /**
   * Blocks until the next event is ready.
   *
   * @return next event in completion order
   * @throws InterruptedException if the consumer is interrupted while waiting
   */
  public ReadEvent next() throws InterruptedException {
    return events.take();
  }

  /**
   * Stops publishing and cancels the reader tasks. Events not yet consumed are dropped.
   */
  @Override
  public void close() {
    closed = true;
    events.clear();
    for (Future<?> reader : readers) {
      reader.cancel(true);
    }
  }

  private void pump(RelaySide side, InputStream in) {
    byte[] buffer = new byte[chunkSize];
    try {
      while (!closed) {
        int n = in.read(buffer);
        if (n <= 0) {
          publish(ReadEvent.endOfStream(side));
          return;
        }
        publish(ReadEvent.data(side, Arrays.copyOf(buffer, n)));
      }
    } catch (IOException ex) {
      if (closed) {
        log.debug("{} reader stopped after close: {}", side, ex.getMessage());
        return;
      }
      try {
        publish(ReadEvent.failure(side, ex));
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void publish(ReadEvent event) throws InterruptedException {
    while (!closed) {
      if (events.offer(event, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
  }
}
