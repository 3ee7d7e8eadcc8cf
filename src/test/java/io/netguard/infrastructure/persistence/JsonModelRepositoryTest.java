package io.netguard.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.classify.TrainingSnapshot;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonModelRepositoryTest {
  @TempDir
  Path dir;

  @Test
  void loadReturnsEmptyWithoutFile() throws Exception {
    assertTrue(new JsonModelRepository(dir.resolve(JsonModelRepository.FILE_NAME)).load().isEmpty());
  }

  @Test
  void savesAndLoadsSnapshot() throws Exception {
    JsonModelRepository repository = new JsonModelRepository(dir.resolve("nested/" + JsonModelRepository.FILE_NAME));
    TrainingSnapshot snapshot = new TrainingSnapshot(3, Instant.parse("2024-05-01T12:00:00Z"), List.of(
        new LabeledExample("situs judi online \"slot\" gacor", Label.GAMBLING),
        new LabeledExample("weather forecast", Label.BENIGN)));

    repository.save(snapshot);
    TrainingSnapshot loaded = repository.load().orElseThrow();

    assertEquals(snapshot, loaded);
  }

  @Test
  void corruptFileIsReportedAsIOException() throws Exception {
    Path file = dir.resolve(JsonModelRepository.FILE_NAME);
    Files.writeString(file, "{\"version\":", StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class, () -> new JsonModelRepository(file).load());
    assertTrue(ex.getMessage().contains("Corrupt model file"));
  }

  @Test
  void missingVersionIsRejected() throws Exception {
    Path file = dir.resolve(JsonModelRepository.FILE_NAME);
    Files.writeString(file, "{\"examples\":[]}", StandardCharsets.UTF_8);

    assertThrows(IOException.class, () -> new JsonModelRepository(file).load());
  }
}
