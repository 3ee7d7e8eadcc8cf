package io.netguard.config;

import io.netguard.application.classify.Lexicon;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the keyword lexicon from YAML keyed by language tag.
 *
 * <pre>
 * en:
 *   keywords: [casino, poker, live casino]
 *   stopwords: [the, and]
 * id:
 *   keywords: [judi, togel, sabung ayam]
 *   stopwords: [yang, dan]
 * </pre>
 *
 * <p>Either list may be omitted for a tag. Adding a language is a data change.</p>
 *
 * @since 0.1.0
 */
public final class LexiconLoader {
  /** Classpath location of the bundled lexicon. */
  public static final String DEFAULT_RESOURCE = "lexicon/default-lexicon.yaml";

  private LexiconLoader() {}

  /**
   * Loads the bundled lexicon.
   *
   * @return lexicon
   * @throws IOException if the resource is missing or unreadable
   */
  public static Lexicon loadDefault() throws IOException {
    try (InputStream in = LexiconLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IOException("Bundled lexicon " + DEFAULT_RESOURCE + " not found on the classpath");
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
    }
  }

  /**
   * Loads a lexicon file.
   *
   * @param file YAML file
   * @return lexicon
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document does not follow the expected layout
   */
  public static Lexicon load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return parse(reader, file.toString());
    }
  }

  static Lexicon parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse lexicon " + source, ex);
    }
    if (document == null) {
      return Lexicon.empty();
    }
    Map<String, List<String>> keywords = new LinkedHashMap<>();
    Map<String, List<String>> stopwords = new LinkedHashMap<>();
    YamlConfigLoader.mapping(document, source).forEach((language, section) -> {
      if (section == null) {
        return;
      }
      Map<String, Object> lists = YamlConfigLoader.mapping(section, source + "." + language);
      keywords.put(language, words(lists.get("keywords"), source + "." + language + ".keywords"));
      stopwords.put(language, words(lists.get("stopwords"), source + "." + language + ".stopwords"));
    });
    return new Lexicon(keywords, stopwords);
  }

  static List<String> words(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> out = new ArrayList<>(raw.size());
    for (Object item : raw) {
      if (item == null) {
        continue;
      }
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException(context + " entries must be scalars");
      }
      out.add(item.toString());
    }
    return out;
  }
}
