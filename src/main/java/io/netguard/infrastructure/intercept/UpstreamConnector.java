package io.netguard.infrastructure.intercept;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

/**
 * Opens the proxy's upstream connections.
 *
 * @since 0.1.0
 */
@FunctionalInterface
interface UpstreamConnector {
  /**
   * Connects to the origin server.
   *
   * @param host origin host
   * @param port origin port
   * @param tls whether to negotiate TLS (with SNI and hostname verification)
   * @return connected socket with the read timeout already applied
   * @throws IOException if the connection or handshake fails
   */
  Socket connect(String host, int port, boolean tls) throws IOException;

  /**
   * Connector using the JVM default socket and TLS factories.
   *
   * @param timeout connect and read timeout
   * @return connector
   */
  static UpstreamConnector direct(Duration timeout) {
    int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    return (host, port, tls) -> {
      Socket plain = new Socket();
      try {
        plain.connect(new InetSocketAddress(host, port), millis);
        plain.setSoTimeout(millis);
        if (!tls) {
          return plain;
        }
        SSLSocket secure = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
            .createSocket(plain, host, port, true);
        SSLParameters params = secure.getSSLParameters();
        params.setEndpointIdentificationAlgorithm("HTTPS");
        if (host.indexOf(':') < 0 && !Character.isDigit(host.charAt(host.length() - 1))) {
          params.setServerNames(List.of(new SNIHostName(host)));
        }
        secure.setSSLParameters(params);
        secure.startHandshake();
        return secure;
      } catch (IOException | RuntimeException ex) {
        plain.close();
        throw ex;
      }
    };
  }
}
