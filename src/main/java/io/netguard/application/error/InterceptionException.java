package io.netguard.application.error;

import java.io.IOException;

/**
 * Raised when the intercepting proxy cannot establish or relay a session, typically a TLS handshake failure
 * because the local root certificate is not trusted by the client.
 *
 * @since 0.1.0
 */
public class InterceptionException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String host;

  public InterceptionException(String host, String message, Throwable cause) {
    super(message, cause);
    this.host = host == null ? "" : host;
  }

  /** @return target host of the failed session, or empty when unknown */
  public String host() {
    return host;
  }
}
