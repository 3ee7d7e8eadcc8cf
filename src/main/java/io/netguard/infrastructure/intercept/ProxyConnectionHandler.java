package io.netguard.infrastructure.intercept;

import io.netguard.application.error.CaptureTimeoutException;
import io.netguard.application.error.InterceptionException;
import io.netguard.application.port.CapturedTransactionListener;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.InterceptionErrorListener;
import io.netguard.application.port.MetricsPort;
import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.infrastructure.intercept.HttpMessageCodec.Body;
import io.netguard.infrastructure.intercept.HttpMessageCodec.RequestHead;
import io.netguard.infrastructure.intercept.HttpMessageCodec.ResponseHead;
import io.netguard.infrastructure.intercept.HttpMessageCodec.Target;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one client connection of the intercepting proxy.
 *
 * <p>Plain requests arrive in absolute form and are forwarded to the named origin. A {@code CONNECT} is answered
 * with {@code 200}, the client side of the tunnel is terminated with a leaf certificate from the
 * {@link CertificateAuthority}, and the requests inside the tunnel are forwarded over a fresh TLS session to the
 * origin. Every completed exchange produces exactly one {@link CapturedTransaction}, published before the response
 * bytes are relayed to the client; the bytes themselves are relayed unchanged.</p>
 *
 * <p>Not thread-safe; one instance per accepted socket.</p>
 */
final class ProxyConnectionHandler implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(ProxyConnectionHandler.class);
  private static final byte[] CONNECT_ESTABLISHED =
      "HTTP/1.1 200 Connection Established\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] BAD_GATEWAY =
      "HTTP/1.1 502 Bad Gateway\r\nContent-Length: 0\r\nConnection: close\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

  private final Socket client;
  private final CertificateAuthority authority;
  private final UpstreamConnector connector;
  private final CapturedTransactionListener transactions;
  private final InterceptionErrorListener errors;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Duration socketTimeout;
  private final int excerptChars;

  private String currentHost = "";
  private Socket upstream;
  private String upstreamKey;
  private InputStream upstreamIn;
  private OutputStream upstreamOut;

  ProxyConnectionHandler(
      Socket client,
      CertificateAuthority authority,
      UpstreamConnector connector,
      CapturedTransactionListener transactions,
      InterceptionErrorListener errors,
      ClockPort clock,
      MetricsPort metrics,
      Duration socketTimeout,
      int excerptChars) {
    this.client = Objects.requireNonNull(client, "client");
    this.authority = Objects.requireNonNull(authority, "authority");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.socketTimeout = Objects.requireNonNull(socketTimeout, "socketTimeout");
    this.excerptChars = excerptChars;
  }

  @Override
  public void run() {
    try (Socket socket = client) {
      socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, socketTimeout.toMillis()));
      InputStream in = new BufferedInputStream(socket.getInputStream());
      OutputStream out = new BufferedOutputStream(socket.getOutputStream());
      RequestHead first = HttpMessageCodec.readRequestHead(in);
      if (first == null) {
        return;
      }
      if (first.isConnect()) {
        Target tunnel = HttpMessageCodec.parseAuthority(first.target(), 443);
        currentHost = tunnel.host();
        out.write(CONNECT_ESTABLISHED);
        out.flush();
        SSLSocket tls = terminateTls(socket, tunnel.host());
        try (tls) {
          serve(new BufferedInputStream(tls.getInputStream()), new BufferedOutputStream(tls.getOutputStream()),
              null, tunnel);
        }
      } else {
        serve(in, out, first, null);
      }
    } catch (SocketTimeoutException ex) {
      metrics.increment("intercept.timeout");
      errors.onTimeout(currentHost, new CaptureTimeoutException("exchange with " + currentHost, socketTimeout, ex));
    } catch (InterceptionException ex) {
      metrics.increment("intercept.error");
      errors.onInterceptionError(ex);
    } catch (IOException ex) {
      metrics.increment("intercept.connectionFailed");
      log.debug("Proxy connection for {} ended: {}", currentHost, ex.getMessage());
    } finally {
      closeUpstream();
    }
  }

  private SSLSocket terminateTls(Socket socket, String host) throws InterceptionException {
    try {
      SSLContext context = authority.serverContext(host);
      SSLSocket tls = (SSLSocket) context.getSocketFactory()
          .createSocket(socket, socket.getInetAddress().getHostAddress(), socket.getPort(), false);
      tls.setUseClientMode(false);
      tls.startHandshake();
      metrics.increment("intercept.tls.handshake");
      return tls;
    } catch (GeneralSecurityException ex) {
      throw new InterceptionException(host, "Unable to issue certificate for " + host, ex);
    } catch (IOException ex) {
      throw new InterceptionException(
          host, "TLS handshake with client failed for " + host + " (is the NetGuard root CA installed?)", ex);
    }
  }

  private void serve(InputStream in, OutputStream out, RequestHead first, Target tunnel) throws IOException {
    RequestHead request = first != null ? first : awaitRequest(in);
    while (request != null) {
      Target target;
      String url;
      if (tunnel != null) {
        String path = originForm(request.target());
        target = new Target(tunnel.host(), tunnel.port(), path);
        url = "https://" + authorityOf(tunnel, 443) + path;
      } else {
        target = HttpMessageCodec.parseAbsoluteTarget(request.target(), 80);
        url = request.target();
      }
      currentHost = target.host();
      if (!exchange(in, out, request, target, url, tunnel != null)) {
        return;
      }
      request = awaitRequest(in);
    }
  }

  /**
   * Waits for the next request on a reusable connection. A read timeout before its first byte arrives is an idle
   * client, so the connection closes quietly; a timeout once the head has started still fails the exchange.
   *
   * @return the request head, or {@code null} when the client closed or went idle
   */
  private RequestHead awaitRequest(InputStream in) throws IOException {
    in.mark(1);
    int next;
    try {
      next = in.read();
    } catch (SocketTimeoutException ex) {
      metrics.increment("intercept.keepalive.idle");
      log.debug("Idle connection for {} closed after {}", currentHost, socketTimeout);
      return null;
    }
    if (next < 0) {
      return null;
    }
    in.reset();
    return HttpMessageCodec.readRequestHead(in);
  }

  private boolean exchange(
      InputStream in, OutputStream out, RequestHead request, Target target, String url, boolean tls)
      throws IOException {
    Body requestBody = HttpMessageCodec.readRequestBody(in, request.headers());
    long started = clock.nowMillis();
    try {
      ensureUpstream(target, tls);
    } catch (SocketTimeoutException ex) {
      throw ex;
    } catch (IOException ex) {
      metrics.increment("intercept.upstream.failed");
      log.debug("Upstream {}:{} unreachable: {}", target.host(), target.port(), ex.getMessage());
      out.write(BAD_GATEWAY);
      out.flush();
      return false;
    }
    HttpMessageCodec.writeUpstreamRequestHead(upstreamOut, request, target.path());
    upstreamOut.write(requestBody.raw());
    upstreamOut.flush();

    ResponseHead response = HttpMessageCodec.readResponseHead(upstreamIn);
    while (response.status() >= 100 && response.status() < 200 && response.status() != 101) {
      out.write(response.raw());
      out.flush();
      response = HttpMessageCodec.readResponseHead(upstreamIn);
    }
    Body responseBody = HttpMessageCodec.readResponseBody(upstreamIn, request.method(), response);

    CapturedTransaction transaction = new CapturedTransaction(
        UUID.randomUUID().toString(),
        url,
        request.method(),
        request.headers(),
        HttpMessageCodec.excerpt(requestBody.payload(), request.headers(), excerptChars),
        response.status(),
        response.headers(),
        HttpMessageCodec.excerpt(responseBody.payload(), response.headers(), excerptChars),
        responseBody.payload().length,
        Math.max(0L, clock.nowMillis() - started),
        clock.now());
    publish(transaction);

    out.write(response.raw());
    out.write(responseBody.raw());
    out.flush();

    boolean close = response.status() == 101
        || HttpMessageCodec.closeDelimited(request.method(), response)
        || HttpMessageCodec.wantsClose(request.version(), request.headers())
        || HttpMessageCodec.wantsClose(response.version(), response.headers());
    if (close) {
      closeUpstream();
    }
    return !close;
  }

  private void publish(CapturedTransaction transaction) {
    metrics.increment("intercept.transactions");
    try {
      transactions.onTransaction(transaction);
    } catch (RuntimeException ex) {
      metrics.increment("intercept.listener.failed");
      log.warn("Transaction listener failed for {}", transaction.requestUrl(), ex);
    }
  }

  private void ensureUpstream(Target target, boolean tls) throws IOException {
    String key = (tls ? "tls:" : "tcp:") + target.host() + ":" + target.port();
    if (upstream != null && key.equals(upstreamKey) && !upstream.isClosed()) {
      return;
    }
    closeUpstream();
    Socket socket = connector.connect(target.host(), target.port(), tls);
    upstream = socket;
    upstreamKey = key;
    upstreamIn = new BufferedInputStream(socket.getInputStream());
    upstreamOut = new BufferedOutputStream(socket.getOutputStream());
  }

  private void closeUpstream() {
    if (upstream == null) {
      return;
    }
    try {
      upstream.close();
    } catch (IOException ex) {
      log.debug("Error closing upstream {}: {}", upstreamKey, ex.getMessage());
    }
    upstream = null;
    upstreamKey = null;
    upstreamIn = null;
    upstreamOut = null;
  }

  static String originForm(String target) {
    if (target.startsWith("/")) {
      return target;
    }
    int scheme = target.indexOf("://");
    if (scheme < 0) {
      return "/" + target;
    }
    int slash = target.indexOf('/', scheme + 3);
    return slash < 0 ? "/" : target.substring(slash);
  }

  private static String authorityOf(Target target, int defaultPort) {
    String host = target.host().indexOf(':') >= 0 ? "[" + target.host() + "]" : target.host();
    return target.port() == defaultPort ? host : host + ":" + target.port();
  }
}
