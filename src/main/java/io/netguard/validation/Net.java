package io.netguard.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network endpoint and domain validation utilities for NetGuard.
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;   // total length
  private static final int MAX_LABEL_LENGTH    = 63;    // per label

  // IPv4 dotted-quad shape (fast pre-check); we still range-check octets.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Normalizes user or traffic supplied input into the registrable form stored in the block list.
   *
   * <p>Accepts bare domains, {@code host:port} pairs and full URLs. The result is lower-case, has no trailing dot
   * and no leading {@code www.} label; the hosts file renders the {@code www.} alias separately.</p>
   *
   * @param value domain, host or URL; must not be blank
   * @return normalized domain
   * @throws IllegalArgumentException if the value does not contain a valid host name
   */
  public static String normalizeDomain(String value) {
    String sanitized = Strings.requireNonBlank("domain", value).toLowerCase(Locale.ROOT);
    String host = sanitized.contains("://") ? hostOf(sanitized) : stripPathAndPort(sanitized);
    if (host.endsWith(".")) {
      host = host.substring(0, host.length() - 1);
    }
    if (host.startsWith("www.") && host.indexOf('.', 4) > 0) {
      host = host.substring(4);
    }
    validateHost(host);
    return host;
  }

  /**
   * Extracts the host component of an absolute URL.
   *
   * @param url absolute URL such as {@code https://example.com/path}
   * @return lower-case host, never blank
   * @throws IllegalArgumentException if the URL has no host
   */
  public static String hostOf(String url) {
    String sanitized = Strings.requireNonBlank("url", url);
    try {
      URI uri = new URI(sanitized);
      String host = uri.getHost();
      if (host == null || host.isBlank()) {
        throw new IllegalArgumentException("url has no host: " + sanitized);
      }
      if (host.startsWith("[") && host.endsWith("]")) {
        host = host.substring(1, host.length() - 1);
      }
      return host.toLowerCase(Locale.ROOT);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("invalid url: " + sanitized, ex);
    }
  }

  /**
   * Returns {@code true} when a literal address is a globally routable unicast address.
   *
   * <p>Loopback, RFC1918/ULA private, link-local, wildcard and multicast addresses return {@code false}.
   * Only literals are parsed; no name lookup is performed.</p>
   *
   * @param literal IPv4 or IPv6 literal
   * @return whether the address identifies a remote public peer
   */
  public static boolean isPublicAddress(String literal) {
    if (literal == null || literal.isBlank()) {
      return false;
    }
    String trimmed = literal.trim();
    boolean looksLiteral = IPV4_PATTERN.matcher(trimmed).matches() || trimmed.indexOf(':') >= 0;
    if (!looksLiteral) {
      return false;
    }
    try {
      InetAddress address = InetAddress.getByName(trimmed);
      if (address.isLoopbackAddress()
          || address.isAnyLocalAddress()
          || address.isLinkLocalAddress()
          || address.isSiteLocalAddress()
          || address.isMulticastAddress()) {
        return false;
      }
      if (address instanceof Inet6Address) {
        byte first = address.getAddress()[0];
        // fc00::/7 unique local
        return (first & 0xFE) != 0xFC;
      }
      return true;
    } catch (UnknownHostException ex) {
      return false;
    }
  }

  private static String stripPathAndPort(String value) {
    String host = value;
    int slash = host.indexOf('/');
    if (slash >= 0) {
      host = host.substring(0, slash);
    }
    int colon = host.lastIndexOf(':');
    if (colon > 0 && host.indexOf(':') == colon) {
      host = host.substring(0, colon);
    }
    return host;
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return;
    }
    validateHostname(host);
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-' || c == '_')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final String part = host.substring(startIndex, endIndex);
      final int octet = Integer.parseInt(part);
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
