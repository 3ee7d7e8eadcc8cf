package io.netguard.application.classify;

import io.netguard.application.error.InsufficientDataException;
import io.netguard.domain.classify.FeatureVector;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.classify.TermContribution;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable multinomial naive Bayes model over TF-IDF weighted term counts.
 *
 * <p>Per class {@code c}, term likelihoods use add-one smoothing over the summed TF-IDF weights:
 * {@code P(t|c) = (W_c(t) + 1) / (T_c + |V|)}. Scoring returns the logistic of the log prior ratio plus the
 * weighted log likelihood ratios, which is the posterior probability of {@link Label#GAMBLING}.</p>
 *
 * <p>Instances are never mutated after {@link #train}; {@link GamblingClassifier} swaps them atomically.</p>
 *
 * @since 0.1.0
 */
public final class NaiveBayesModel implements Vocabulary {
  private static final Comparator<TermContribution> BY_STRENGTH =
      Comparator.comparingDouble((TermContribution c) -> -Math.abs(c.contribution()))
          .thenComparing(TermContribution::term);

  private final long version;
  private final Instant trainedAt;
  private final int documentCount;
  private final int gamblingDocuments;
  private final int benignDocuments;
  private final Map<String, Integer> documentFrequency;
  private final Map<String, Double> logLikelihoodRatio;
  private final double unknownLogLikelihoodRatio;
  private final double logPriorRatio;
  private final double unseenIdf;

  private NaiveBayesModel(
      long version,
      Instant trainedAt,
      int gamblingDocuments,
      int benignDocuments,
      Map<String, Integer> documentFrequency,
      Map<String, Double> logLikelihoodRatio,
      double unknownLogLikelihoodRatio,
      double logPriorRatio) {
    this.version = version;
    this.trainedAt = trainedAt;
    this.gamblingDocuments = gamblingDocuments;
    this.benignDocuments = benignDocuments;
    this.documentCount = gamblingDocuments + benignDocuments;
    this.documentFrequency = documentFrequency;
    this.logLikelihoodRatio = logLikelihoodRatio;
    this.unknownLogLikelihoodRatio = unknownLogLikelihoodRatio;
    this.logPriorRatio = logPriorRatio;
    this.unseenIdf = Math.log(1.0 + documentCount) + 1.0;
  }

  /**
   * Returns the placeholder model used before the first successful training. It scores every vector 0.
   *
   * @param trainedAt timestamp reported by {@link #trainedAt()}
   * @return untrained model at version 0
   */
  public static NaiveBayesModel untrained(Instant trainedAt) {
    return new NaiveBayesModel(0L, trainedAt, 0, 0, Map.of(), Map.of(), 0.0, 0.0);
  }

  /**
   * Trains a model.
   *
   * @param examples labelled documents; both classes must be present
   * @param extractor term analyzer shared with scoring
   * @param version version assigned to the new model
   * @param trainedAt training timestamp
   * @return trained model
   * @throws InsufficientDataException if either class has no examples
   */
  public static NaiveBayesModel train(
      List<LabeledExample> examples, LexicalFeatureExtractor extractor, long version, Instant trainedAt)
      throws InsufficientDataException {
    Objects.requireNonNull(examples, "examples");
    Objects.requireNonNull(extractor, "extractor");
    Objects.requireNonNull(trainedAt, "trainedAt");

    int gamblingDocs = 0;
    int benignDocs = 0;
    List<Map<String, Integer>> counts = new ArrayList<>(examples.size());
    Map<String, Integer> df = new HashMap<>();
    for (LabeledExample example : examples) {
      if (example.label() == Label.GAMBLING) {
        gamblingDocs++;
      } else {
        benignDocs++;
      }
      Map<String, Integer> tf = extractor.termCounts(example.text());
      counts.add(tf);
      tf.keySet().forEach(term -> df.merge(term, 1, Integer::sum));
    }
    if (gamblingDocs == 0 || benignDocs == 0) {
      throw new InsufficientDataException(
          "training needs both classes (gambling=" + gamblingDocs + ", benign=" + benignDocs + ")");
    }

    int n = gamblingDocs + benignDocs;
    Map<String, Double> gamblingWeights = new HashMap<>();
    Map<String, Double> benignWeights = new HashMap<>();
    double gamblingTotal = 0.0;
    double benignTotal = 0.0;
    for (int i = 0; i < examples.size(); i++) {
      boolean gambling = examples.get(i).label() == Label.GAMBLING;
      Map<String, Double> target = gambling ? gamblingWeights : benignWeights;
      for (Map.Entry<String, Integer> e : counts.get(i).entrySet()) {
        double weight = e.getValue() * idf(n, df.get(e.getKey()));
        target.merge(e.getKey(), weight, Double::sum);
        if (gambling) {
          gamblingTotal += weight;
        } else {
          benignTotal += weight;
        }
      }
    }

    int vocabularySize = df.size();
    double gamblingDenominator = gamblingTotal + vocabularySize;
    double benignDenominator = benignTotal + vocabularySize;
    Map<String, Double> llr = new HashMap<>(vocabularySize * 2);
    for (String term : df.keySet()) {
      double pg = (gamblingWeights.getOrDefault(term, 0.0) + 1.0) / gamblingDenominator;
      double pb = (benignWeights.getOrDefault(term, 0.0) + 1.0) / benignDenominator;
      llr.put(term, Math.log(pg) - Math.log(pb));
    }
    double unknown = Math.log(1.0 / gamblingDenominator) - Math.log(1.0 / benignDenominator);
    double prior = Math.log(gamblingDocs) - Math.log(benignDocs);

    return new NaiveBayesModel(
        version,
        trainedAt,
        gamblingDocs,
        benignDocs,
        Collections.unmodifiableMap(new HashMap<>(df)),
        Collections.unmodifiableMap(llr),
        unknown,
        prior);
  }

  @Override
  public double idf(String term) {
    Integer df = documentFrequency.get(term);
    return df == null ? unseenIdf : idf(documentCount, df);
  }

  /**
   * Scores a vector.
   *
   * @param features TF-IDF vector computed against this model's vocabulary
   * @return probability of gambling in {@code [0, 1]}; {@code 0} for the untrained model
   */
  public double score(FeatureVector features) {
    Objects.requireNonNull(features, "features");
    if (!isTrained()) {
      return 0.0;
    }
    double z = logPriorRatio;
    for (Map.Entry<String, Double> e : features.weights().entrySet()) {
      z += e.getValue() * ratio(e.getKey());
    }
    return logistic(z);
  }

  /**
   * Lists every term's signed contribution, strongest first, ties broken by term.
   *
   * @param features vector to explain
   * @return contributions in log-odds units
   */
  public List<TermContribution> explain(FeatureVector features) {
    Objects.requireNonNull(features, "features");
    if (!isTrained()) {
      return List.of();
    }
    List<TermContribution> out = new ArrayList<>(features.size());
    features.weights().forEach((term, weight) -> out.add(new TermContribution(term, weight * ratio(term))));
    out.sort(BY_STRENGTH);
    return out;
  }

  public boolean isTrained() {
    return version > 0;
  }

  public long version() {
    return version;
  }

  public Instant trainedAt() {
    return trainedAt;
  }

  public int vocabularySize() {
    return documentFrequency.size();
  }

  public int gamblingDocuments() {
    return gamblingDocuments;
  }

  public int benignDocuments() {
    return benignDocuments;
  }

  private double ratio(String term) {
    Double known = logLikelihoodRatio.get(term);
    return known == null ? unknownLogLikelihoodRatio : known;
  }

  private static double idf(int documents, int df) {
    return Math.log((1.0 + documents) / (1.0 + df)) + 1.0;
  }

  private static double logistic(double z) {
    if (z >= 0) {
      return 1.0 / (1.0 + Math.exp(-z));
    }
    double e = Math.exp(z);
    return e / (1.0 + e);
  }
}
