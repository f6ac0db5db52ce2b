package ca.gc.cra.relay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the thread pools used by the relay server.
 */
public final class ExecutorFactories {

  private static final long IDLE_KEEP_ALIVE_SECONDS = 60L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded, cached executor: one thread per concurrently active task, idle threads retire after a minute.
   * Used for connection workers and for the reader tasks that feed the relay's readiness queue.
   *
   * @param prefix thread-name prefix used to tag threads
   * @param daemon whether threads should be daemon threads
   * @param handler uncaught exception handler installed on each thread; {@code null} installs a no-op handler
   * @return configured executor service
   */
  public static ExecutorService newConnectionPool(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "relay-conn" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(daemon);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
