package io.netguard.application.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Language-tagged keyword and stopword tables used by {@link LexicalFeatureExtractor}.
 *
 * <p>Keywords are gambling indicators; they are never removed by stopword or length filters. Multi-word keywords
 * (for example {@code sabung ayam}) are additionally emitted as joined phrase tokens. Adding a language is a data
 * change: a new tag in the lexicon YAML.</p>
 *
 * @since 0.1.0
 */
public final class Lexicon {
  /** Keywords shorter than this are not searched for inside longer tokens. */
  static final int MIN_EMBEDDED_KEYWORD_LENGTH = 4;

  private final Map<String, Set<String>> keywordsByLanguage;
  private final Map<String, Set<String>> stopwordsByLanguage;
  private final Set<String> keywordTokens;
  private final Set<String> embeddedKeywords;
  private final List<List<String>> phrases;
  private final Set<String> stopwords;

  /**
   * Builds a lexicon from raw tables. Entries are lower-cased and trimmed; blanks are ignored.
   *
   * @param keywordsByLanguage gambling keywords keyed by language tag
   * @param stopwordsByLanguage stopwords keyed by language tag
   */
  public Lexicon(Map<String, ? extends Iterable<String>> keywordsByLanguage,
                 Map<String, ? extends Iterable<String>> stopwordsByLanguage) {
    Objects.requireNonNull(keywordsByLanguage, "keywordsByLanguage");
    Objects.requireNonNull(stopwordsByLanguage, "stopwordsByLanguage");
    this.keywordsByLanguage = normalize(keywordsByLanguage);
    this.stopwordsByLanguage = normalize(stopwordsByLanguage);

    Set<String> singles = new TreeSet<>();
    Set<List<String>> multi = new LinkedHashSet<>();
    for (Set<String> words : this.keywordsByLanguage.values()) {
      for (String keyword : words) {
        List<String> parts = LexicalFeatureExtractor.split(keyword);
        if (parts.size() == 1) {
          singles.add(parts.get(0));
        } else if (parts.size() > 1) {
          multi.add(List.copyOf(parts));
          singles.add(String.join("_", parts));
        }
      }
    }
    Set<String> embedded = new TreeSet<>();
    for (String single : singles) {
      if (single.length() >= MIN_EMBEDDED_KEYWORD_LENGTH && single.indexOf('_') < 0) {
        embedded.add(single);
      }
    }
    Set<String> stops = new TreeSet<>();
    this.stopwordsByLanguage.values().forEach(stops::addAll);
    stops.removeAll(singles);

    this.keywordTokens = Collections.unmodifiableSet(singles);
    this.embeddedKeywords = Collections.unmodifiableSet(embedded);
    this.phrases = List.copyOf(multi);
    this.stopwords = Collections.unmodifiableSet(stops);
  }

  /** @return lexicon with no keywords and no stopwords */
  public static Lexicon empty() {
    return new Lexicon(Map.of(), Map.of());
  }

  /** @return language tags with at least one keyword or stopword entry */
  public Set<String> languages() {
    Set<String> tags = new TreeSet<>(keywordsByLanguage.keySet());
    tags.addAll(stopwordsByLanguage.keySet());
    return tags;
  }

  public Set<String> keywords(String language) {
    return keywordsByLanguage.getOrDefault(language.toLowerCase(Locale.ROOT), Set.of());
  }

  /** @return single-token keywords plus joined phrase tokens */
  public Set<String> keywordTokens() {
    return keywordTokens;
  }

  public boolean isKeyword(String token) {
    return keywordTokens.contains(token);
  }

  public boolean isStopword(String token) {
    return stopwords.contains(token);
  }

  Set<String> embeddedKeywords() {
    return embeddedKeywords;
  }

  List<List<String>> phrases() {
    return phrases;
  }

  private static Map<String, Set<String>> normalize(Map<String, ? extends Iterable<String>> raw) {
    Map<String, Set<String>> out = new LinkedHashMap<>();
    raw.forEach((language, words) -> {
      if (language == null || language.isBlank() || words == null) {
        return;
      }
      Set<String> cleaned = new TreeSet<>();
      for (String word : words) {
        if (word != null && !word.isBlank()) {
          cleaned.add(word.trim().toLowerCase(Locale.ROOT));
        }
      }
      out.put(language.trim().toLowerCase(Locale.ROOT), Collections.unmodifiableSet(cleaned));
    });
    return Collections.unmodifiableMap(out);
  }
}
