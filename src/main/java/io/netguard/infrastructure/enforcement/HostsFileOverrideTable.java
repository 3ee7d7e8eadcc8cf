package io.netguard.infrastructure.enforcement;

import io.netguard.application.error.PermissionDeniedException;
import io.netguard.application.port.OverrideTable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link OverrideTable} backed by the operating system hosts file.
 * <p><strong>Why:</strong> Redirecting a domain to a loopback address in the hosts file blocks it for every
 * application without a proxy or a kernel component.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by the enforcement manager.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the full file; a missing file reads as empty.</li>
 *   <li>Replace the file through a sibling temp file and a move, falling back to an in-place write when the
 *   directory does not allow creating files (the usual case for {@code /etc} or {@code drivers\etc}).</li>
 *   <li>Translate access failures into {@link PermissionDeniedException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not synchronized; the enforcement manager is the single writer.</p>
 *
 * @since 0.1.0
 */
public final class HostsFileOverrideTable implements OverrideTable {
  private static final Logger log = LoggerFactory.getLogger(HostsFileOverrideTable.class);

  private final Path file;

  public HostsFileOverrideTable(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
  }

  /**
   * Returns the platform hosts file location.
   *
   * @return {@code %SystemRoot%\System32\drivers\etc\hosts} on Windows, {@code /etc/hosts} elsewhere
   */
  public static Path systemDefault() {
    String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    if (os.contains("win")) {
      String root = System.getenv("SystemRoot");
      return Path.of(root == null || root.isBlank() ? "C:\\Windows" : root, "System32", "drivers", "etc", "hosts");
    }
    return Path.of("/etc/hosts");
  }

  public Path file() {
    return file;
  }

  @Override
  public String read() throws IOException {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      return "";
    } catch (AccessDeniedException ex) {
      throw new PermissionDeniedException(file, ex);
    }
  }

  @Override
  public void write(String content) throws IOException {
    Objects.requireNonNull(content, "content");
    if (Files.exists(file) && !Files.isWritable(file)) {
      throw new PermissionDeniedException(file, null);
    }
    Path temp;
    try {
      temp = Files.createTempFile(file.getParent(), "." + file.getFileName(), ".netguard");
    } catch (FileSystemException ex) {
      log.debug("Cannot create temp file next to {} ({}); writing in place", file, ex.getMessage());
      writeInPlace(content);
      return;
    }
    try {
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      moveOver(temp, content);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public String describe() {
    return "hosts file " + file;
  }

  private void moveOver(Path temp, String content) throws IOException {
    try {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (FileSystemException ex) {
      log.debug("Atomic replace of {} refused ({}); writing in place", file, ex.getMessage());
      writeInPlace(content);
    }
  }

  private void writeInPlace(String content) throws IOException {
    try {
      Files.writeString(file, content, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    } catch (AccessDeniedException ex) {
      throw new PermissionDeniedException(file, ex);
    }
  }
}
