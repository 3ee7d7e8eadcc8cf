package io.netguard.infrastructure.intercept;

import io.netguard.application.port.CapturedTransactionListener;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.InterceptionErrorListener;
import io.netguard.application.port.MetricsPort;
import io.netguard.application.port.TrafficInterceptor;
import io.netguard.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Local forward proxy that captures HTTP and HTTPS exchanges in dev mode.
 * <p><strong>Why:</strong> Connection metadata only yields a host name; the proxy adds URL paths, headers and
 * page text, which is where most gambling vocabulary lives.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link TrafficInterceptor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept browser connections on the configured address (default {@code 127.0.0.1:8080}).</li>
 *   <li>Serve each connection on a cached pool via {@link ProxyConnectionHandler}.</li>
 *   <li>On stop, refuse new connections and wait a bounded time for in-flight exchanges.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #stop()} synchronize on the instance.</p>
 * <p><strong>Observability:</strong> Emits {@code intercept.accepted}, {@code intercept.transactions},
 * {@code intercept.timeout}, {@code intercept.error} and {@code intercept.drain.forced}.</p>
 *
 * @since 0.1.0
 */
public final class InterceptingProxy implements TrafficInterceptor {
  private static final Logger log = LoggerFactory.getLogger(InterceptingProxy.class);

  public static final String DEFAULT_HOST = "127.0.0.1";
  public static final int DEFAULT_PORT = 8080;
  public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final InetSocketAddress bindAddress;
  private final CertificateAuthority.Source authoritySource;
  private final UpstreamConnector connector;
  private final CapturedTransactionListener transactions;
  private final InterceptionErrorListener errors;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Duration socketTimeout;
  private final Duration drainTimeout;
  private final int excerptChars;
  private final Set<Socket> openClients = ConcurrentHashMap.newKeySet();

  private CertificateAuthority authority;
  private ServerSocket serverSocket;
  private ExecutorService acceptor;
  private ExecutorService handlers;
  private volatile boolean running;

  /**
   * Creates a proxy that dials origins directly.
   *
   * @param bindAddress listen address
   * @param authoritySource certificate authority for HTTPS interception, resolved on {@link #start()}
   * @param transactions receives one transaction per completed exchange
   * @param errors receives TLS failures and timeouts
   * @param clock clock for durations and timestamps
   * @param metrics metrics sink
   * @param socketTimeout read timeout on both legs of an exchange
   * @param drainTimeout how long {@link #stop()} waits for in-flight exchanges
   */
  public InterceptingProxy(
      InetSocketAddress bindAddress,
      CertificateAuthority.Source authoritySource,
      CapturedTransactionListener transactions,
      InterceptionErrorListener errors,
      ClockPort clock,
      MetricsPort metrics,
      Duration socketTimeout,
      Duration drainTimeout) {
    this(bindAddress, authoritySource, UpstreamConnector.direct(socketTimeout), transactions, errors, clock, metrics,
        socketTimeout, drainTimeout, HttpMessageCodec.DEFAULT_EXCERPT_CHARS);
  }

  InterceptingProxy(
      InetSocketAddress bindAddress,
      CertificateAuthority.Source authoritySource,
      UpstreamConnector connector,
      CapturedTransactionListener transactions,
      InterceptionErrorListener errors,
      ClockPort clock,
      MetricsPort metrics,
      Duration socketTimeout,
      Duration drainTimeout,
      int excerptChars) {
    this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    this.authoritySource = Objects.requireNonNull(authoritySource, "authoritySource");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.socketTimeout = Objects.requireNonNull(socketTimeout, "socketTimeout");
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (excerptChars < 0) {
      throw new IllegalArgumentException("excerptChars must be >= 0");
    }
    this.excerptChars = excerptChars;
  }

  @Override
  public synchronized void start() throws IOException {
    if (running) {
      return;
    }
    try {
      authority = authoritySource.get();
    } catch (GeneralSecurityException ex) {
      throw new IOException("Unable to load the interception root CA", ex);
    }
    ServerSocket socket = new ServerSocket();
    try {
      socket.setReuseAddress(true);
      socket.bind(bindAddress);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
    serverSocket = socket;
    handlers = ExecutorFactories.newConnectionPool("netguard-proxy-conn",
        (thread, error) -> log.error("Proxy handler {} crashed", thread.getName(), error));
    acceptor = ExecutorFactories.newSingleWorker("netguard-proxy-accept");
    running = true;
    acceptor.submit(this::acceptLoop);
    log.info("Intercepting proxy listening on {}", socket.getLocalSocketAddress());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    try {
      serverSocket.close();
    } catch (IOException ex) {
      log.warn("Error closing proxy listener", ex);
    }
    acceptor.shutdownNow();
    handlers.shutdown();
    try {
      if (!handlers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        metrics.increment("intercept.drain.forced");
        log.warn("Proxy exchanges still running after {} ms; closing {} client sockets",
            drainTimeout.toMillis(), openClients.size());
        closeClients();
        handlers.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      closeClients();
      handlers.shutdownNow();
    }
    log.info("Intercepting proxy stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public synchronized InetSocketAddress address() {
    if (serverSocket != null && serverSocket.isBound()) {
      return (InetSocketAddress) serverSocket.getLocalSocketAddress();
    }
    return bindAddress;
  }

  /** @return the loaded authority, or {@code null} before the first {@link #start()} */
  public synchronized CertificateAuthority authority() {
    return authority;
  }

  private void acceptLoop() {
    MDC.put("pipeline", "intercept");
    try {
      while (running) {
        Socket client;
        try {
          client = serverSocket.accept();
        } catch (SocketException ex) {
          if (running) {
            log.warn("Proxy accept failed: {}", ex.getMessage());
            continue;
          }
          return;
        } catch (IOException ex) {
          log.warn("Proxy accept failed: {}", ex.getMessage());
          continue;
        }
        metrics.increment("intercept.accepted");
        openClients.add(client);
        ProxyConnectionHandler handler = new ProxyConnectionHandler(
            client, authority, connector, transactions, errors, clock, metrics, socketTimeout, excerptChars);
        try {
          handlers.execute(() -> {
            try {
              handler.run();
            } finally {
              openClients.remove(client);
            }
          });
        } catch (RejectedExecutionException ex) {
          openClients.remove(client);
          closeQuietly(client);
          return;
        }
      }
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void closeClients() {
    for (Socket client : openClients) {
      closeQuietly(client);
    }
    openClients.clear();
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing proxy client socket: {}", ex.getMessage());
    }
  }
}
