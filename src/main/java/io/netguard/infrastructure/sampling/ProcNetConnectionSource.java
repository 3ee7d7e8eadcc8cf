package io.netguard.infrastructure.sampling;

import io.netguard.application.port.ConnectionSource;
import io.netguard.domain.net.SocketEntry;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ConnectionSource} that reads the Linux socket tables under {@code /proc/net}.
 * <p><strong>Why:</strong> Enumerating sockets from procfs needs no native library or elevated capture rights,
 * unlike packet capture.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse {@code tcp} and {@code tcp6}; addresses are little-endian hex words.</li>
 *   <li>Map socket inodes to owning PIDs through {@code /proc/<pid>/fd} links of the form {@code socket:[inode]}.</li>
 *   <li>Read process names from {@code /proc/<pid>/comm}.</li>
 * </ul>
 * <p>Processes owned by other users are not readable without privileges; their sockets are still reported with
 * PID {@code -1}.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls.</p>
 *
 * @since 0.1.0
 */
public final class ProcNetConnectionSource implements ConnectionSource {
  private static final Logger log = LoggerFactory.getLogger(ProcNetConnectionSource.class);
  private static final String SOCKET_LINK_PREFIX = "socket:[";
  private static final String[] STATES = {
    "", "ESTABLISHED", "SYN_SENT", "SYN_RECV", "FIN_WAIT1", "FIN_WAIT2", "TIME_WAIT",
    "CLOSE", "CLOSE_WAIT", "LAST_ACK", "LISTEN", "CLOSING", "NEW_SYN_RECV"
  };

  private final Path procRoot;

  public ProcNetConnectionSource() {
    this(Path.of("/proc"));
  }

  public ProcNetConnectionSource(Path procRoot) {
    this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
  }

  /** @return whether the socket tables exist under the configured root */
  public boolean isAvailable() {
    return Files.isReadable(procRoot.resolve("net").resolve("tcp"));
  }

  @Override
  public List<SocketEntry> enumerate() throws IOException {
    List<RawSocket> raw = new ArrayList<>();
    readTable("tcp", raw);
    readTable("tcp6", raw);
    if (raw.isEmpty()) {
      return List.of();
    }
    Map<Long, Integer> owners = socketOwners();
    Map<Integer, String> names = new HashMap<>();
    List<SocketEntry> entries = new ArrayList<>(raw.size());
    for (RawSocket socket : raw) {
      int pid = owners.getOrDefault(socket.inode(), -1);
      String processName = pid < 0 ? "" : names.computeIfAbsent(pid, this::processName);
      entries.add(new SocketEntry(
          socket.protocol(),
          socket.localAddress(),
          socket.localPort(),
          socket.remoteAddress(),
          socket.remotePort(),
          socket.state(),
          pid,
          processName));
    }
    return entries;
  }

  @Override
  public String name() {
    return "procfs(" + procRoot + ")";
  }

  private void readTable(String protocol, List<RawSocket> out) throws IOException {
    Path table = procRoot.resolve("net").resolve(protocol);
    List<String> lines;
    try {
      lines = Files.readAllLines(table, StandardCharsets.US_ASCII);
    } catch (NoSuchFileException ex) {
      log.debug("Socket table {} not present", table);
      return;
    }
    for (int i = 1; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        continue;
      }
      try {
        out.add(parseLine(protocol, line));
      } catch (IllegalArgumentException ex) {
        log.debug("Skipping malformed {} line {}: {}", protocol, i, ex.getMessage());
      }
    }
  }

  static RawSocket parseLine(String protocol, String line) {
    String[] fields = line.split("\\s+");
    if (fields.length < 10) {
      throw new IllegalArgumentException("expected at least 10 fields but found " + fields.length);
    }
    String[] local = splitEndpoint(fields[1]);
    String[] remote = splitEndpoint(fields[2]);
    int stateCode = Integer.parseInt(fields[3], 16);
    String state = stateCode > 0 && stateCode < STATES.length ? STATES[stateCode] : "UNKNOWN";
    long inode;
    try {
      inode = Long.parseLong(fields[9]);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid inode " + fields[9], ex);
    }
    return new RawSocket(
        protocol,
        decodeAddress(local[0]),
        Integer.parseInt(local[1], 16),
        decodeAddress(remote[0]),
        Integer.parseInt(remote[1], 16),
        state,
        inode);
  }

  private static String[] splitEndpoint(String field) {
    int idx = field.indexOf(':');
    if (idx <= 0 || idx == field.length() - 1) {
      throw new IllegalArgumentException("invalid endpoint " + field);
    }
    return new String[] {field.substring(0, idx), field.substring(idx + 1)};
  }

  /**
   * Decodes a procfs hex address. IPv4 is one little-endian 32-bit word; IPv6 is four of them.
   *
   * @param hex 8 or 32 hex characters
   * @return textual address
   */
  static String decodeAddress(String hex) {
    if (hex.length() != 8 && hex.length() != 32) {
      throw new IllegalArgumentException("unexpected address length " + hex.length());
    }
    byte[] bytes = new byte[hex.length() / 2];
    for (int word = 0; word < bytes.length / 4; word++) {
      for (int b = 0; b < 4; b++) {
        int hexOffset = (word * 4 + b) * 2;
        int value = Integer.parseInt(hex.substring(hexOffset, hexOffset + 2), 16);
        bytes[word * 4 + (3 - b)] = (byte) value;
      }
    }
    try {
      return InetAddress.getByAddress(bytes).getHostAddress();
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid address " + hex, ex);
    }
  }

  private Map<Long, Integer> socketOwners() {
    Map<Long, Integer> owners = new HashMap<>();
    try (DirectoryStream<Path> pids = Files.newDirectoryStream(procRoot, ProcNetConnectionSource::isPidDir)) {
      for (Path pidDir : pids) {
        collectSockets(pidDir, owners);
      }
    } catch (IOException ex) {
      log.debug("Unable to list processes under {}: {}", procRoot, ex.getMessage());
    }
    return owners;
  }

  private static boolean isPidDir(Path path) {
    String name = path.getFileName().toString();
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      if (!Character.isDigit(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static void collectSockets(Path pidDir, Map<Long, Integer> owners) {
    int pid = Integer.parseInt(pidDir.getFileName().toString());
    try (DirectoryStream<Path> fds = Files.newDirectoryStream(pidDir.resolve("fd"))) {
      for (Path fd : fds) {
        String target;
        try {
          target = Files.readSymbolicLink(fd).toString();
        } catch (IOException | UnsupportedOperationException ex) {
          log.trace("Descriptor {} vanished or is unreadable: {}", fd, ex.getMessage());
          continue;
        }
        if (target.startsWith(SOCKET_LINK_PREFIX) && target.endsWith("]")) {
          try {
            long inode = Long.parseLong(target.substring(SOCKET_LINK_PREFIX.length(), target.length() - 1));
            owners.putIfAbsent(inode, pid);
          } catch (NumberFormatException ex) {
            log.trace("Ignoring unexpected socket link {} -> {}", fd, target);
          }
        }
      }
    } catch (IOException ex) {
      log.trace("Cannot inspect descriptors of pid {}: {}", pid, ex.getMessage());
    }
  }

  private String processName(int pid) {
    try {
      return Files.readString(procRoot.resolve(Integer.toString(pid)).resolve("comm"), StandardCharsets.UTF_8).trim();
    } catch (IOException ex) {
      log.trace("Cannot read process name of pid {}: {}", pid, ex.getMessage());
      return "";
    }
  }

  record RawSocket(
      String protocol,
      String localAddress,
      int localPort,
      String remoteAddress,
      int remotePort,
      String state,
      long inode) {}
}
