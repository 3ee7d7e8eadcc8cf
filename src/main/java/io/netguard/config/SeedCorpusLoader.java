package io.netguard.config;

import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the labelled documents the classifier trains on when no persisted model exists.
 *
 * <p>The YAML document maps each label ({@code gambling}, {@code benign}) to a list of document texts.</p>
 *
 * @since 0.1.0
 */
public final class SeedCorpusLoader {
  /** Classpath location of the bundled corpus. */
  public static final String DEFAULT_RESOURCE = "training/seed-corpus.yaml";

  private SeedCorpusLoader() {}

  public static List<LabeledExample> loadDefault() throws IOException {
    try (InputStream in = SeedCorpusLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IOException("Bundled seed corpus " + DEFAULT_RESOURCE + " not found on the classpath");
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
    }
  }

  public static List<LabeledExample> load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return parse(reader, file.toString());
    }
  }

  static List<LabeledExample> parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse seed corpus " + source, ex);
    }
    if (document == null) {
      return List.of();
    }
    List<LabeledExample> examples = new ArrayList<>();
    for (Map.Entry<String, Object> entry : YamlConfigLoader.mapping(document, source).entrySet()) {
      Label label = Label.parse(entry.getKey());
      String context = source + "." + entry.getKey().toLowerCase(Locale.ROOT);
      for (String text : LexiconLoader.words(entry.getValue(), context)) {
        if (!text.isBlank()) {
          examples.add(new LabeledExample(text.trim(), label));
        }
      }
    }
    return List.copyOf(examples);
  }
}
