package io.netguard.infrastructure.persistence;

import io.netguard.application.classify.TrainingSnapshot;
import io.netguard.application.port.ModelRepository;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the classifier training snapshot as {@code model.json}.
 *
 * <p>The snapshot carries the version and the labelled examples; the model itself is rebuilt from them on load, so
 * the file stays small and human-readable.</p>
 *
 * @since 0.1.0
 */
public final class JsonModelRepository implements ModelRepository {
  private static final Logger log = LoggerFactory.getLogger(JsonModelRepository.class);

  public static final String FILE_NAME = "model.json";

  private final Path file;

  public JsonModelRepository(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
  }

  @Override
  public Optional<TrainingSnapshot> load() throws IOException {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    Map<String, Object> root;
    try {
      root = JsonSupport.parseObject(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      throw new IOException("Corrupt model file " + file + ": " + ex.getMessage(), ex);
    }
    List<LabeledExample> examples = new ArrayList<>();
    for (Object raw : JsonSupport.array(root, "examples")) {
      if (raw instanceof Map<?, ?> map) {
        Object text = map.get("text");
        Object label = map.get("label");
        if (text != null && label != null) {
          examples.add(new LabeledExample(text.toString(), Label.parse(label.toString())));
        }
      }
    }
    long version = JsonSupport.longValue(root, "version", 0L);
    Instant trainedAt = JsonSupport.instant(root, "trainedAt");
    if (version < 1 || trainedAt == null) {
      throw new IOException("Model file " + file + " is missing version or trainedAt");
    }
    log.info("Loaded model v{} ({} examples) from {}", version, examples.size(), file);
    return Optional.of(new TrainingSnapshot(version, trainedAt, examples));
  }

  @Override
  public void save(TrainingSnapshot snapshot) throws IOException {
    Objects.requireNonNull(snapshot, "snapshot");
    String json = JsonSupport.render(gen -> {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("version", snapshot.version());
      JsonSupport.writeInstant(gen, "trainedAt", snapshot.trainedAt());
      gen.writeArrayFieldStart("examples");
      for (LabeledExample example : snapshot.examples()) {
        gen.writeStartObject();
        gen.writeStringField("text", example.text());
        gen.writeStringField("label", example.label().name());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
    Files.createDirectories(file.getParent());
    Path temp = Files.createTempFile(file.getParent(), FILE_NAME, ".tmp");
    try {
      Files.writeString(temp, json, StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
