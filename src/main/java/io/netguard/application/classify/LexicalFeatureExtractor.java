package io.netguard.application.classify;

import io.netguard.domain.capture.HttpHeaders;
import io.netguard.domain.classify.FeatureVector;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Turns a URL, header values and a body excerpt into a sparse TF-IDF term vector.
 * <p><strong>Role:</strong> First stage of classification; shared by training (documents) and scoring
 * (live traffic) so both see identical terms.</p>
 * <p><strong>Text assembly:</strong> host, path, query and host labels; the {@code content-type}, {@code server},
 * {@code title} and {@code description} header values; the first {@value #BODY_PREFIX_CHARS} body characters.</p>
 * <p><strong>Term analysis:</strong>
 * <ul>
 *   <li>lower-case ({@link Locale#ROOT}) split on non-alphanumeric boundaries;</li>
 *   <li>contiguous multi-word lexicon keywords add a joined phrase token ({@code sabung_ayam});</li>
 *   <li>tokens that embed a lexicon keyword add that keyword ({@code pokerstars} adds {@code poker});</li>
 *   <li>stopwords and tokens shorter than {@value #MIN_TOKEN_LENGTH} characters are dropped unless they are
 *   lexicon keywords.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use by every pipeline lane.</p>
 * <p><strong>Performance:</strong> Linear in the text length times the phrase and embedded keyword counts.</p>
 *
 * @since 0.1.0
 */
public final class LexicalFeatureExtractor {
  static final int BODY_PREFIX_CHARS = 3_000;
  static final int MIN_TOKEN_LENGTH = 2;

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final List<String> CONTENT_HEADERS = List.of("content-type", "server", "title", "description");

  private final Lexicon lexicon;

  public LexicalFeatureExtractor(Lexicon lexicon) {
    this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
  }

  public Lexicon lexicon() {
    return lexicon;
  }

  /**
   * Assembles the document text for one observation.
   *
   * @param url absolute URL or bare host; must not be {@code null}
   * @param headers response headers; may be {@code null}
   * @param body decoded body excerpt; may be {@code null}
   * @return text ready for {@link #terms(String)}
   */
  public String documentText(String url, HttpHeaders headers, String body) {
    Objects.requireNonNull(url, "url");
    StringBuilder text = new StringBuilder(256);
    appendUrl(text, url.trim());
    if (headers != null) {
      for (String name : CONTENT_HEADERS) {
        for (String value : headers.all(name)) {
          text.append(' ').append(value);
        }
      }
    }
    if (body != null && !body.isEmpty()) {
      text.append(' ').append(body, 0, Math.min(body.length(), BODY_PREFIX_CHARS));
    }
    return text.toString();
  }

  /**
   * Analyzes text into terms, in document order, repeats preserved.
   *
   * @param text document text
   * @return terms after phrase joining, embedded keyword expansion and filtering
   */
  public List<String> terms(String text) {
    List<String> tokens = split(text);
    List<String> terms = new ArrayList<>(tokens.size() + 4);
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      boolean keyword = lexicon.isKeyword(token);
      if (keyword || (token.length() >= MIN_TOKEN_LENGTH && !lexicon.isStopword(token))) {
        terms.add(token);
      }
      if (!keyword) {
        for (String embedded : lexicon.embeddedKeywords()) {
          if (token.contains(embedded)) {
            terms.add(embedded);
          }
        }
      }
      for (List<String> phrase : lexicon.phrases()) {
        if (matchesAt(tokens, i, phrase)) {
          terms.add(String.join("_", phrase));
        }
      }
    }
    return terms;
  }

  /**
   * Counts term frequencies for {@code text}.
   *
   * @param text document text
   * @return term to raw count
   */
  public Map<String, Integer> termCounts(String text) {
    Map<String, Integer> counts = new HashMap<>();
    for (String term : terms(text)) {
      counts.merge(term, 1, Integer::sum);
    }
    return counts;
  }

  /**
   * Weights term frequencies by the vocabulary's IDF.
   *
   * @param text document text
   * @param vocabulary IDF source, normally the live model
   * @return TF-IDF vector
   */
  public FeatureVector vectorize(String text, Vocabulary vocabulary) {
    Objects.requireNonNull(vocabulary, "vocabulary");
    Map<String, Double> weights = new HashMap<>();
    termCounts(text).forEach((term, tf) -> weights.put(term, tf * vocabulary.idf(term)));
    return new FeatureVector(weights);
  }

  /**
   * Convenience for {@code vectorize(documentText(url, headers, body), vocabulary)}.
   */
  public FeatureVector extract(String url, HttpHeaders headers, String body, Vocabulary vocabulary) {
    return vectorize(documentText(url, headers, body), vocabulary);
  }

  static List<String> split(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    for (String raw : NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT))) {
      if (!raw.isEmpty()) {
        tokens.add(raw);
      }
    }
    return tokens;
  }

  private static boolean matchesAt(List<String> tokens, int start, List<String> phrase) {
    if (start + phrase.size() > tokens.size()) {
      return false;
    }
    for (int j = 0; j < phrase.size(); j++) {
      if (!tokens.get(start + j).equals(phrase.get(j))) {
        return false;
      }
    }
    return true;
  }

  private static void appendUrl(StringBuilder text, String url) {
    String candidate = url.contains("://") ? url : "http://" + url;
    try {
      URI uri = new URI(candidate);
      String host = uri.getHost() == null ? "" : uri.getHost();
      text.append(host);
      if (uri.getRawPath() != null) {
        text.append(' ').append(uri.getRawPath());
      }
      if (uri.getRawQuery() != null) {
        text.append(' ').append(uri.getRawQuery());
      }
      for (String label : host.split("\\.")) {
        if (!label.isEmpty()) {
          text.append(' ').append(label);
        }
      }
    } catch (URISyntaxException ex) {
      // Malformed URLs still carry useful words.
      text.append(url);
    }
  }
}
