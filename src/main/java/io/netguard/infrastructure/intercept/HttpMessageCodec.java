package io.netguard.infrastructure.intercept;

import io.netguard.domain.capture.HttpHeaders;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import org.brotli.dec.BrotliInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP/1.x framing used by the intercepting proxy.
 *
 * <p>Heads are parsed from the raw stream while their bytes are retained, so the proxy relays exactly what it
 * received. Bodies follow Content-Length, chunked transfer coding, or (responses only) end of stream. Each body is
 * kept twice: the raw framed bytes for relaying and the de-chunked payload for the excerpt.</p>
 *
 * @since 0.1.0
 */
final class HttpMessageCodec {
  private static final Logger log = LoggerFactory.getLogger(HttpMessageCodec.class);

  /** Default bound on captured body excerpts, in characters. */
  static final int DEFAULT_EXCERPT_CHARS = 5_000;
  static final int MAX_HEAD_BYTES = 64 * 1024;
  static final long MAX_BODY_BYTES = 64L * 1024 * 1024;

  private HttpMessageCodec() {}

  /**
   * Parsed request line plus headers.
   *
   * @param method request method, upper case
   * @param target request target as sent (absolute-form, origin-form or authority-form)
   * @param version protocol version token
   * @param headers request headers in arrival order
   */
  record RequestHead(String method, String target, String version, HttpHeaders headers) {
    boolean isConnect() {
      return "CONNECT".equals(method);
    }
  }

  /**
   * Parsed status line plus headers.
   *
   * @param version protocol version token
   * @param status status code
   * @param raw head bytes exactly as received, including the terminating blank line
   * @param headers response headers in arrival order
   */
  record ResponseHead(String version, int status, byte[] raw, HttpHeaders headers) {}

  /**
   * Message body.
   *
   * @param raw framed bytes as received (chunk markers included)
   * @param payload decoded payload (chunk markers removed, content coding untouched)
   */
  record Body(byte[] raw, byte[] payload) {
    static final Body EMPTY = new Body(new byte[0], new byte[0]);
  }

  /**
   * Reads a request head.
   *
   * @param in client stream
   * @return parsed head, or {@code null} when the stream ended before any byte was read
   * @throws IOException if the head is malformed, oversized or the stream fails
   */
  static RequestHead readRequestHead(InputStream in) throws IOException {
    List<String> lines = readHeadLines(in, null);
    if (lines == null) {
      return null;
    }
    String[] parts = lines.get(0).split(" ");
    if (parts.length != 3) {
      throw new IOException("Malformed request line: " + lines.get(0));
    }
    return new RequestHead(parts[0].toUpperCase(Locale.ROOT), parts[1], parts[2], parseHeaders(lines));
  }

  /**
   * Reads a response head.
   *
   * @param in upstream stream
   * @return parsed head with its raw bytes
   * @throws IOException if the stream ends early or the status line is malformed
   */
  static ResponseHead readResponseHead(InputStream in) throws IOException {
    ByteArrayOutputStream raw = new ByteArrayOutputStream(512);
    List<String> lines = readHeadLines(in, raw);
    if (lines == null) {
      throw new IOException("Upstream closed before sending a response");
    }
    String statusLine = lines.get(0);
    String[] parts = statusLine.split(" ", 3);
    if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
      throw new IOException("Malformed status line: " + statusLine);
    }
    int status;
    try {
      status = Integer.parseInt(parts[1]);
    } catch (NumberFormatException ex) {
      throw new IOException("Malformed status code in: " + statusLine, ex);
    }
    return new ResponseHead(parts[0], status, raw.toByteArray(), parseHeaders(lines));
  }

  /** Reads a request body; requests without Content-Length or chunked coding have none. */
  static Body readRequestBody(InputStream in, HttpHeaders headers) throws IOException {
    if (isChunked(headers)) {
      return readChunked(in);
    }
    long length = contentLength(headers);
    return length > 0 ? readFixed(in, length) : Body.EMPTY;
  }

  /** Reads a response body according to the request method and status code. */
  static Body readResponseBody(InputStream in, String requestMethod, ResponseHead head) throws IOException {
    int status = head.status();
    if ("HEAD".equals(requestMethod) || (status >= 100 && status < 200) || status == 204 || status == 304) {
      return Body.EMPTY;
    }
    if (isChunked(head.headers())) {
      return readChunked(in);
    }
    long length = contentLength(head.headers());
    if (length >= 0) {
      return length == 0 ? Body.EMPTY : readFixed(in, length);
    }
    return readToEnd(in);
  }

  /** @return whether the response is delimited by connection close, so the connection cannot be reused */
  static boolean closeDelimited(String requestMethod, ResponseHead head) {
    int status = head.status();
    if ("HEAD".equals(requestMethod) || (status >= 100 && status < 200) || status == 204 || status == 304) {
      return false;
    }
    return !isChunked(head.headers()) && contentLength(head.headers()) < 0;
  }

  /** @return whether either side asked to close after this exchange */
  static boolean wantsClose(String version, HttpHeaders headers) {
    for (String value : headers.all("Connection")) {
      for (String token : value.split(",")) {
        String t = token.trim().toLowerCase(Locale.ROOT);
        if (t.equals("close")) {
          return true;
        }
        if (t.equals("keep-alive")) {
          return false;
        }
      }
    }
    return "HTTP/1.0".equalsIgnoreCase(version);
  }

  /**
   * Serializes a request head for the upstream server: the target is rewritten to origin-form and
   * {@code Proxy-Connection}/{@code Proxy-Authorization} are dropped, every other header is relayed verbatim.
   */
  static void writeUpstreamRequestHead(OutputStream out, RequestHead head, String originTarget) throws IOException {
    StringBuilder sb = new StringBuilder(256);
    sb.append(head.method()).append(' ').append(originTarget).append(' ').append(head.version()).append("\r\n");
    for (Map.Entry<String, String> header : head.headers().entries()) {
      String name = header.getKey();
      if (name.equalsIgnoreCase("Proxy-Connection") || name.equalsIgnoreCase("Proxy-Authorization")) {
        continue;
      }
      sb.append(name).append(": ").append(header.getValue()).append("\r\n");
    }
    sb.append("\r\n");
    out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
  }

  /**
   * Returns a bounded text excerpt of a payload, undoing gzip, deflate or br content coding and decoding with the
   * declared charset (UTF-8 when absent or unknown). Payloads in any other content coding yield an empty excerpt.
   *
   * @param payload decoded body payload
   * @param headers headers describing the payload
   * @param maxChars excerpt bound
   * @return excerpt, empty for empty or undecodable payloads
   */
  static String excerpt(byte[] payload, HttpHeaders headers, int maxChars) {
    if (payload.length == 0 || maxChars <= 0) {
      return "";
    }
    byte[] content = payload;
    String encoding = headers.first("Content-Encoding").orElse("").trim().toLowerCase(Locale.ROOT);
    if (!encoding.isEmpty() && !encoding.equals("identity")) {
      content = decode(payload, encoding, (long) maxChars * 4);
    }
    String text = new String(content, charsetOf(headers));
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }

  static Charset charsetOf(HttpHeaders headers) {
    Optional<String> contentType = headers.first("Content-Type");
    if (contentType.isPresent()) {
      for (String param : contentType.get().split(";")) {
        String p = param.trim();
        if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
          String name = p.substring("charset=".length()).replace("\"", "").trim();
          try {
            return Charset.forName(name);
          } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            return StandardCharsets.UTF_8;
          }
        }
      }
    }
    return StandardCharsets.UTF_8;
  }

  /**
   * Splits an absolute-form URL into host, port and origin-form target.
   *
   * @param target absolute-form request target
   * @param defaultPort port used when the URL has none
   * @return parsed target
   * @throws IOException if the target is not absolute-form http
   */
  static Target parseAbsoluteTarget(String target, int defaultPort) throws IOException {
    String lower = target.toLowerCase(Locale.ROOT);
    if (!lower.startsWith("http://")) {
      throw new IOException("Proxy requests must use absolute http:// targets, got: " + target);
    }
    String rest = target.substring("http://".length());
    int slash = rest.indexOf('/');
    String authority = slash < 0 ? rest : rest.substring(0, slash);
    String path = slash < 0 ? "/" : rest.substring(slash);
    int at = authority.lastIndexOf('@');
    if (at >= 0) {
      authority = authority.substring(at + 1);
    }
    Target parsed = parseAuthority(authority, defaultPort);
    return new Target(parsed.host(), parsed.port(), path);
  }

  /** Parses {@code host[:port]}, accepting bracketed IPv6 literals. */
  static Target parseAuthority(String authority, int defaultPort) throws IOException {
    String host = authority;
    int port = defaultPort;
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      if (close < 0) {
        throw new IOException("Malformed authority: " + authority);
      }
      host = authority.substring(1, close);
      if (close + 1 < authority.length() && authority.charAt(close + 1) == ':') {
        port = parsePort(authority.substring(close + 2), authority);
      }
    } else {
      int colon = authority.lastIndexOf(':');
      if (colon >= 0) {
        host = authority.substring(0, colon);
        port = parsePort(authority.substring(colon + 1), authority);
      }
    }
    if (host.isBlank()) {
      throw new IOException("Missing host in: " + authority);
    }
    return new Target(host.toLowerCase(Locale.ROOT), port, "/");
  }

  /**
   * Request destination.
   *
   * @param host lower-case host name or literal
   * @param port TCP port
   * @param path origin-form path and query
   */
  record Target(String host, int port, String path) {
    Target {
      Objects.requireNonNull(host, "host");
      Objects.requireNonNull(path, "path");
    }
  }

  private static int parsePort(String raw, String authority) throws IOException {
    try {
      int port = Integer.parseInt(raw);
      if (port < 1 || port > 65_535) {
        throw new IOException("Port out of range in: " + authority);
      }
      return port;
    } catch (NumberFormatException ex) {
      throw new IOException("Malformed port in: " + authority, ex);
    }
  }

  private static List<String> readHeadLines(InputStream in, ByteArrayOutputStream rawSink) throws IOException {
    List<String> lines = new ArrayList<>();
    ByteArrayOutputStream line = new ByteArrayOutputStream(128);
    int total = 0;
    boolean started = false;
    while (true) {
      int b = in.read();
      if (b < 0) {
        if (!started) {
          return null;
        }
        throw new IOException("Stream ended inside message head");
      }
      if (++total > MAX_HEAD_BYTES) {
        throw new IOException("Message head exceeds " + MAX_HEAD_BYTES + " bytes");
      }
      if (rawSink != null) {
        rawSink.write(b);
      }
      if (b == '\n') {
        String text = line.toString(StandardCharsets.ISO_8859_1);
        if (text.endsWith("\r")) {
          text = text.substring(0, text.length() - 1);
        }
        line.reset();
        if (text.isEmpty()) {
          if (!started) {
            // tolerate stray CRLF between pipelined messages
            continue;
          }
          return lines;
        }
        started = true;
        lines.add(text);
      } else {
        line.write(b);
      }
    }
  }

  private static HttpHeaders parseHeaders(List<String> lines) throws IOException {
    HttpHeaders.Builder builder = HttpHeaders.builder();
    for (int i = 1; i < lines.size(); i++) {
      String line = lines.get(i);
      int colon = line.indexOf(':');
      if (colon <= 0) {
        throw new IOException("Malformed header line: " + line);
      }
      builder.add(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
    }
    return builder.build();
  }

  private static boolean isChunked(HttpHeaders headers) {
    for (String value : headers.all("Transfer-Encoding")) {
      if (value.toLowerCase(Locale.ROOT).contains("chunked")) {
        return true;
      }
    }
    return false;
  }

  private static long contentLength(HttpHeaders headers) {
    Optional<String> value = headers.first("Content-Length");
    if (value.isEmpty()) {
      return -1;
    }
    try {
      long length = Long.parseLong(value.get().trim());
      return length < 0 ? -1 : length;
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  private static Body readFixed(InputStream in, long length) throws IOException {
    if (length > MAX_BODY_BYTES) {
      throw new IOException("Body of " + length + " bytes exceeds capture limit");
    }
    byte[] bytes = in.readNBytes((int) length);
    if (bytes.length != length) {
      throw new IOException("Stream ended after " + bytes.length + " of " + length + " body bytes");
    }
    return new Body(bytes, bytes);
  }

  private static Body readToEnd(InputStream in) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(8 * 1024);
    byte[] buffer = new byte[8 * 1024];
    int n;
    while ((n = in.read(buffer)) >= 0) {
      out.write(buffer, 0, n);
      if (out.size() > MAX_BODY_BYTES) {
        throw new IOException("Body exceeds capture limit");
      }
    }
    byte[] bytes = out.toByteArray();
    return new Body(bytes, bytes);
  }

  private static Body readChunked(InputStream in) throws IOException {
    ByteArrayOutputStream raw = new ByteArrayOutputStream(8 * 1024);
    ByteArrayOutputStream payload = new ByteArrayOutputStream(8 * 1024);
    while (true) {
      String sizeLine = readLine(in, raw);
      int ext = sizeLine.indexOf(';');
      String sizeHex = (ext >= 0 ? sizeLine.substring(0, ext) : sizeLine).trim();
      long size;
      try {
        size = Long.parseLong(sizeHex, 16);
      } catch (NumberFormatException ex) {
        throw new IOException("Malformed chunk size: " + sizeLine, ex);
      }
      if (size < 0) {
        throw new IOException("Negative chunk size: " + sizeLine);
      }
      if (size == 0) {
        String trailer;
        do {
          trailer = readLine(in, raw);
        } while (!trailer.isEmpty());
        return new Body(raw.toByteArray(), payload.toByteArray());
      }
      if (payload.size() + size > MAX_BODY_BYTES) {
        throw new IOException("Chunked body exceeds capture limit");
      }
      byte[] chunk = in.readNBytes((int) size);
      if (chunk.length != size) {
        throw new IOException("Stream ended inside chunk");
      }
      raw.write(chunk);
      payload.write(chunk);
      if (!readLine(in, raw).isEmpty()) {
        throw new IOException("Missing CRLF after chunk data");
      }
    }
  }

  private static String readLine(InputStream in, ByteArrayOutputStream raw) throws IOException {
    ByteArrayOutputStream line = new ByteArrayOutputStream(16);
    while (true) {
      int b = in.read();
      if (b < 0) {
        throw new IOException("Stream ended inside chunked body");
      }
      raw.write(b);
      if (b == '\n') {
        String text = line.toString(StandardCharsets.ISO_8859_1);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
      }
      line.write(b);
    }
  }

  private static byte[] decode(byte[] payload, String encoding, long maxBytes) {
    ByteArrayInputStream source = new ByteArrayInputStream(payload);
    try (InputStream in = switch (encoding) {
      case "gzip", "x-gzip" -> new GZIPInputStream(source);
      case "deflate" -> new InflaterInputStream(source);
      case "br" -> new BrotliInputStream(source);
      default -> null;
    }) {
      if (in == null) {
        log.debug("No decoder for {} body, excerpt left empty", encoding);
        return new byte[0];
      }
      return in.readNBytes((int) Math.min(maxBytes, Integer.MAX_VALUE));
    } catch (IOException ex) {
      log.debug("Unable to decode {} body for excerpt: {}", encoding, ex.getMessage());
      return new byte[0];
    }
  }
}
