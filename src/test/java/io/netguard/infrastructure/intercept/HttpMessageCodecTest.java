package io.netguard.infrastructure.intercept;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.domain.capture.HttpHeaders;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;

class HttpMessageCodecTest {

  @Test
  void parsesRequestHeadAndFixedBody() throws Exception {
    InputStream in = stream("POST http://casino.example/spin HTTP/1.1\r\n"
        + "Host: casino.example\r\n"
        + "Content-Length: 5\r\n"
        + "\r\n"
        + "bet=1");

    HttpMessageCodec.RequestHead head = HttpMessageCodec.readRequestHead(in);
    HttpMessageCodec.Body body = HttpMessageCodec.readRequestBody(in, head.headers());

    assertEquals("POST", head.method());
    assertEquals("http://casino.example/spin", head.target());
    assertEquals("casino.example", head.headers().first("host").orElseThrow());
    assertEquals("bet=1", new String(body.payload(), StandardCharsets.US_ASCII));
    assertFalse(head.isConnect());
  }

  @Test
  void emptyStreamYieldsNoRequest() throws Exception {
    assertNull(HttpMessageCodec.readRequestHead(stream("")));
  }

  @Test
  void rejectsMalformedHeads() {
    assertThrows(IOException.class, () -> HttpMessageCodec.readRequestHead(stream("GET /\r\n\r\n")));
    assertThrows(IOException.class,
        () -> HttpMessageCodec.readRequestHead(stream("GET / HTTP/1.1\r\nno-colon\r\n\r\n")));
    assertThrows(IOException.class, () -> HttpMessageCodec.readResponseHead(stream("HTTP/1.1 abc\r\n\r\n")));
    assertThrows(IOException.class, () -> HttpMessageCodec.readResponseHead(stream("")));
  }

  @Test
  void decodesChunkedResponseKeepingRawFraming() throws Exception {
    String wire = "HTTP/1.1 200 OK\r\n"
        + "Transfer-Encoding: chunked\r\n"
        + "\r\n"
        + "5;ext=1\r\nhello\r\n"
        + "6\r\n world\r\n"
        + "0\r\n"
        + "X-Trailer: yes\r\n"
        + "\r\n";
    InputStream in = stream(wire);

    HttpMessageCodec.ResponseHead head = HttpMessageCodec.readResponseHead(in);
    HttpMessageCodec.Body body = HttpMessageCodec.readResponseBody(in, "GET", head);

    assertEquals(200, head.status());
    assertEquals("hello world", new String(body.payload(), StandardCharsets.US_ASCII));
    assertEquals(wire.substring(wire.indexOf("\r\n\r\n") + 4), new String(body.raw(), StandardCharsets.US_ASCII));
    assertFalse(HttpMessageCodec.closeDelimited("GET", head));
  }

  @Test
  void responsesWithoutBodiesAreEmpty() throws Exception {
    HttpMessageCodec.ResponseHead notModified =
        HttpMessageCodec.readResponseHead(stream("HTTP/1.1 304 Not Modified\r\nContent-Length: 10\r\n\r\n"));
    HttpMessageCodec.ResponseHead ok =
        HttpMessageCodec.readResponseHead(stream("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\n"));

    assertEquals(0, HttpMessageCodec.readResponseBody(stream("ignored"), "GET", notModified).payload().length);
    assertEquals(0, HttpMessageCodec.readResponseBody(stream("ignored"), "HEAD", ok).payload().length);
  }

  @Test
  void closeDelimitedBodyReadsToEnd() throws Exception {
    HttpMessageCodec.ResponseHead head =
        HttpMessageCodec.readResponseHead(stream("HTTP/1.0 200 OK\r\nContent-Type: text/html\r\n\r\n"));

    HttpMessageCodec.Body body = HttpMessageCodec.readResponseBody(stream("<html>slots</html>"), "GET", head);

    assertTrue(HttpMessageCodec.closeDelimited("GET", head));
    assertEquals("<html>slots</html>", new String(body.payload(), StandardCharsets.US_ASCII));
  }

  @Test
  void truncatedFixedBodyFails() throws Exception {
    HttpMessageCodec.ResponseHead head =
        HttpMessageCodec.readResponseHead(stream("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\n"));

    assertThrows(IOException.class, () -> HttpMessageCodec.readResponseBody(stream("short"), "GET", head));
  }

  @Test
  void connectionTokensDecideReuse() {
    assertTrue(HttpMessageCodec.wantsClose("HTTP/1.1", headers("Connection", "close")));
    assertFalse(HttpMessageCodec.wantsClose("HTTP/1.0", headers("Connection", "keep-alive")));
    assertTrue(HttpMessageCodec.wantsClose("HTTP/1.0", HttpHeaders.empty()));
    assertFalse(HttpMessageCodec.wantsClose("HTTP/1.1", HttpHeaders.empty()));
  }

  @Test
  void upstreamHeadUsesOriginFormAndDropsProxyHeaders() throws Exception {
    HttpMessageCodec.RequestHead head = HttpMessageCodec.readRequestHead(stream(
        "GET http://casino.example/lobby?x=1 HTTP/1.1\r\n"
            + "Host: casino.example\r\n"
            + "Proxy-Connection: keep-alive\r\n"
            + "Proxy-Authorization: Basic abc\r\n"
            + "Accept: text/html\r\n\r\n"));
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    HttpMessageCodec.writeUpstreamRequestHead(out, head, "/lobby?x=1");

    assertEquals("GET /lobby?x=1 HTTP/1.1\r\nHost: casino.example\r\nAccept: text/html\r\n\r\n",
        out.toString(StandardCharsets.ISO_8859_1));
  }

  @Test
  void excerptInflatesGzipAndHonoursCharset() throws Exception {
    ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
      gzip.write("situs judi online terpercaya".getBytes(StandardCharsets.UTF_8));
    }
    HttpHeaders gzipped = HttpHeaders.builder()
        .add("Content-Encoding", "gzip")
        .add("Content-Type", "text/html; charset=\"utf-8\"")
        .build();

    assertEquals("situs judi", HttpMessageCodec.excerpt(compressed.toByteArray(), gzipped, 10));
    assertEquals("", HttpMessageCodec.excerpt(new byte[] {1, 2, 3}, gzipped, 10));

    byte[] latin = "café".getBytes(StandardCharsets.ISO_8859_1);
    assertEquals("café", HttpMessageCodec.excerpt(latin, headers("Content-Type", "text/html; charset=ISO-8859-1"),
        100));
    assertEquals(StandardCharsets.UTF_8, HttpMessageCodec.charsetOf(headers("Content-Type", "text/html; charset=nope")));
  }

  @Test
  void excerptDecodesBrotliAndSkipsCodingsItCannotUndo() {
    // window 16, one stored meta-block holding the text, then an empty last meta-block
    byte[] brotli = concat(new byte[] {(byte) 0xa0, 0x00, 0x10},
        "judi online".getBytes(StandardCharsets.US_ASCII), new byte[] {0x03});

    assertEquals("judi online", HttpMessageCodec.excerpt(brotli, headers("Content-Encoding", "br"), 100));
    assertEquals("", HttpMessageCodec.excerpt(new byte[] {(byte) 0xff, 0x13, 0x37}, headers("Content-Encoding", "br"),
        100));

    byte[] opaque = "(\u00b5/\u00fd judi online".getBytes(StandardCharsets.ISO_8859_1);
    assertEquals("", HttpMessageCodec.excerpt(opaque, headers("Content-Encoding", "zstd"), 100));
    assertEquals("", HttpMessageCodec.excerpt(opaque, headers("Content-Encoding", "compress"), 100));
    assertEquals("judi", HttpMessageCodec.excerpt("judi".getBytes(StandardCharsets.US_ASCII),
        headers("Content-Encoding", "identity"), 100));
  }

  @Test
  void negativeChunkSizeIsRejected() throws Exception {
    HttpMessageCodec.ResponseHead head =
        HttpMessageCodec.readResponseHead(stream("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n"));

    IOException error = assertThrows(IOException.class,
        () -> HttpMessageCodec.readResponseBody(stream("-5\r\nhello\r\n0\r\n\r\n"), "GET", head));
    assertTrue(error.getMessage().startsWith("Negative chunk size"));
  }

  @Test
  void parsesTargetsAndAuthorities() throws Exception {
    HttpMessageCodec.Target absolute = HttpMessageCodec.parseAbsoluteTarget("http://user@Casino.Example:8080", 80);
    assertEquals(new HttpMessageCodec.Target("casino.example", 8080, "/"), absolute);

    HttpMessageCodec.Target ipv6 = HttpMessageCodec.parseAuthority("[2001:db8::1]:8443", 443);
    assertEquals("2001:db8::1", ipv6.host());
    assertEquals(8443, ipv6.port());

    assertEquals(443, HttpMessageCodec.parseAuthority("casino.example", 443).port());
    assertThrows(IOException.class, () -> HttpMessageCodec.parseAbsoluteTarget("https://casino.example/", 80));
    assertThrows(IOException.class, () -> HttpMessageCodec.parseAuthority("casino.example:70000", 443));
    assertThrows(IOException.class, () -> HttpMessageCodec.parseAuthority(":443", 443));
  }

  @Test
  void keepsPayloadBytesIntact() throws Exception {
    byte[] payload = {0, (byte) 0xff, 13, 10, 42};
    byte[] wire = ("HTTP/1.1 200 OK\r\nContent-Length: 5\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
    ByteArrayOutputStream all = new ByteArrayOutputStream();
    all.write(wire);
    all.write(payload);
    InputStream in = new ByteArrayInputStream(all.toByteArray());

    HttpMessageCodec.ResponseHead head = HttpMessageCodec.readResponseHead(in);

    assertArrayEquals(wire, head.raw());
    assertArrayEquals(payload, HttpMessageCodec.readResponseBody(in, "GET", head).payload());
  }

  private static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.writeBytes(part);
    }
    return out.toByteArray();
  }

  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1));
  }

  private static HttpHeaders headers(String name, String value) {
    return HttpHeaders.builder().add(name, value).build();
  }
}
