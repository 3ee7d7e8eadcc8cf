package io.netguard.infrastructure.sampling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.domain.net.SocketEntry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcNetConnectionSourceTest {
  private static final String HEADER =
      "  sl  local_address rem_address   st tx_queue rx_queue tr tm->when retrnsmt   uid  timeout inode";

  @TempDir
  Path proc;

  @Test
  void decodesLittleEndianAddresses() {
    assertEquals("93.184.216.34", ProcNetConnectionSource.decodeAddress("22D8B85D"));
    assertEquals("127.0.0.1", ProcNetConnectionSource.decodeAddress("0100007F"));
    assertEquals("0:0:0:0:0:0:0:1", ProcNetConnectionSource.decodeAddress("00000000000000000000000001000000"));
    assertThrows(IllegalArgumentException.class, () -> ProcNetConnectionSource.decodeAddress("ABC"));
  }

  @Test
  void parsesTableLine() {
    ProcNetConnectionSource.RawSocket socket = ProcNetConnectionSource.parseLine("tcp",
        "0: 0200000A:C738 22D8B85D:01BB 01 00000000:00000000 00:00000000 00000000  1000        0 4242 1");

    assertEquals("10.0.0.2", socket.localAddress());
    assertEquals(51000, socket.localPort());
    assertEquals("93.184.216.34", socket.remoteAddress());
    assertEquals(443, socket.remotePort());
    assertEquals("ESTABLISHED", socket.state());
    assertEquals(4242, socket.inode());
  }

  @Test
  void enumeratesSocketsWithOwningProcess() throws Exception {
    Files.createDirectories(proc.resolve("net"));
    Files.writeString(proc.resolve("net/tcp"), String.join("\n",
        HEADER,
        "   0: 0200000A:C738 22D8B85D:01BB 01 00000000:00000000 00:00000000 00000000  1000 0 4242 1",
        "   1: 00000000:0050 00000000:0000 0A 00000000:00000000 00:00000000 00000000     0 0 999 1",
        "   2: garbage",
        ""), StandardCharsets.US_ASCII);
    Path fd = Files.createDirectories(proc.resolve("1200/fd"));
    Files.createSymbolicLink(fd.resolve("7"), Path.of("socket:[4242]"));
    Files.createSymbolicLink(fd.resolve("8"), Path.of("pipe:[77]"));
    Files.writeString(proc.resolve("1200/comm"), "firefox\n", StandardCharsets.UTF_8);
    Files.createDirectories(proc.resolve("self"));

    ProcNetConnectionSource source = new ProcNetConnectionSource(proc);
    List<SocketEntry> entries = source.enumerate();

    assertTrue(source.isAvailable());
    assertEquals(2, entries.size());
    SocketEntry established = entries.get(0);
    assertEquals(1200, established.pid());
    assertEquals("firefox", established.processName());
    assertFalse(established.listening());
    SocketEntry listening = entries.get(1);
    assertTrue(listening.listening());
    assertEquals(-1, listening.pid());
  }

  @Test
  void missingTablesYieldNoEntries() throws Exception {
    ProcNetConnectionSource source = new ProcNetConnectionSource(proc);

    assertFalse(source.isAvailable());
    assertTrue(source.enumerate().isEmpty());
  }
}
