package io.netguard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireWritableDirReturnsRealPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));

    assertEquals(dir.toRealPath(), Paths.requireWritableDir(dir, false));
  }

  @Test
  void requireWritableDirCreatesWhenRequested() {
    Path validated = Paths.requireWritableDir(tempDir.resolve("data/audit"), true);

    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void requireWritableDirRejectsMissingAndFiles() throws IOException {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireWritableDir(tempDir.resolve("missing"), false));
    Path file = Files.createFile(tempDir.resolve("model.json"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireWritableDir(file, true));
  }
}
