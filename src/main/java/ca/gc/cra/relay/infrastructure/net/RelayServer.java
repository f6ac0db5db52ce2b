package ca.gc.cra.relay.infrastructure.net;

import ca.gc.cra.relay.application.server.ConnectionHandler;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Listens on a TCP address and hands every accepted client to a {@link ConnectionHandler}.
 * <p><strong>Why:</strong> Each connection blocks on socket I/O, so each gets its own worker thread.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} binds and runs the accept loop on a dedicated thread;
 * {@link #stop()} closes the listener and shuts the worker pool down. Active exchanges finish on their own.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} may be called from different threads.</p>
 *
 * @since 0.1.0
 */
public final class RelayServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RelayServer.class);
  private static final int BACKLOG = 50;

  private final InetSocketAddress bindAddress;
  private final ConnectionHandler handler;
  private final ExecutorService workers;
  private final List<ExecutorService> companions;
  private volatile ServerSocket listener;
  private volatile Thread acceptThread;
  private volatile boolean running;

  /**
   * Creates a server.
   *
   * @param bindAddress address to listen on; port {@code 0} picks an ephemeral port
   * @param handler per-connection logic
   * @param workers executor running one task per accepted connection
   */
  public RelayServer(InetSocketAddress bindAddress, ConnectionHandler handler, ExecutorService workers) {
    this(bindAddress, handler, workers, List.of());
  }

  /**
   * Creates a server that also shuts down {@code companions}, such as the relay reader pool, when stopped.
   */
  public RelayServer(
      InetSocketAddress bindAddress,
      ConnectionHandler handler,
      ExecutorService workers,
      List<ExecutorService> companions) {
    this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.companions = List.copyOf(Objects.requireNonNull(companions, "companions"));
  }

  /**
   * Binds the listening socket and starts accepting.
   *
   * @throws IOException if the address cannot be bound
   * @throws IllegalStateException if already started
   */
  public synchronized void start() throws IOException {
    if (running) {
      throw new IllegalStateException("server already started");
    }
    ServerSocket socket = new ServerSocket();
    try {
      socket.setReuseAddress(true);
      socket.bind(bindAddress, BACKLOG);
    } catch (IOException ex) {
      try {
        socket.close();
      } catch (IOException closeEx) {
        ex.addSuppressed(closeEx);
      }
      throw ex;
    }
    listener = socket;
    running = true;
    Thread thread = new Thread(this::acceptLoop, "relay-accept");
    thread.setDaemon(false);
    acceptThread = thread;
    thread.start();
    InetAddress address = socket.getInetAddress();
    log.info("Relay listening on {}:{}", address.getHostAddress(), socket.getLocalPort());
  }

  /**
   * Returns the bound port.
   *
   * @throws IllegalStateException if the server has not been started
   */
  public int localPort() {
    ServerSocket socket = listener;
    if (socket == null) {
      throw new IllegalStateException("server not started");
    }
    return socket.getLocalPort();
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Blocks until the accept loop exits.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    Thread thread = acceptThread;
    if (thread != null) {
      thread.join();
    }
  }

  /**
   * Stops accepting and shuts the worker pool down, waiting briefly for in-flight tasks.
   */
  public void stop() {
    synchronized (this) {
      if (!running) {
        return;
      }
      running = false;
    }
    ServerSocket socket = listener;
    if (socket != null) {
      try {
        socket.close();
      } catch (IOException ex) {
        log.warn("Failed to close listener cleanly", ex);
      }
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.info("Relay stopped with connections still active");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    companions.forEach(ExecutorService::shutdownNow);
    log.info("Relay stopped");
  }

  @Override
  public void close() {
    stop();
  }

  private void acceptLoop() {
    ServerSocket socket = listener;
    while (running) {
      Socket client;
      try {
        client = socket.accept();
      } catch (SocketException ex) {
        if (running) {
          log.error("Listener failed", ex);
          running = false;
        }
        break;
      } catch (IOException ex) {
        log.warn("Accept failed: {}", ex.getMessage());
        continue;
      }
      try {
        workers.execute(() -> handler.handle(new SocketStreamConnection(client)));
      } catch (RejectedExecutionException ex) {
        log.warn("Rejected connection from {}: worker pool unavailable", client.getRemoteSocketAddress());
        try {
          client.close();
        } catch (IOException closeEx) {
          ex.addSuppressed(closeEx);
        }
      }
    }
    log.debug("Accept loop exited");
  }
}
