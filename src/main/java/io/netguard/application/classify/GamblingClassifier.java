package io.netguard.application.classify;

import io.netguard.application.error.InsufficientDataException;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.MetricsPort;
import io.netguard.application.port.ModelRepository;
import io.netguard.domain.capture.HttpHeaders;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.classify.FeatureVector;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.classify.ModelInfo;
import io.netguard.domain.classify.TermContribution;
import io.netguard.validation.Net;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Trainable gambling classifier backed by an atomically swapped {@link NaiveBayesModel}.
 * <p><strong>Why:</strong> Scoring runs concurrently on every pipeline lane while operators retrain; lanes read
 * one immutable model per classification so a retrain never tears a score.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bootstrap from a persisted snapshot, or from the seed corpus on first run.</li>
 *   <li>Queue operator feedback and fold it in on the next successful retrain.</li>
 *   <li>Increment the model version on every successful retrain and persist the snapshot.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Scoring is lock-free; training and feedback share one monitor.</p>
 * <p><strong>Observability:</strong> Emits {@code classifier.retrain.success}, {@code classifier.retrain.insufficient},
 * {@code classifier.feedback.queued} and {@code classifier.score.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class GamblingClassifier {
  private static final Logger log = LoggerFactory.getLogger(GamblingClassifier.class);

  static final int TOP_TERMS = 5;

  private final LexicalFeatureExtractor extractor;
  private final ModelRepository repository;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AtomicReference<NaiveBayesModel> model;

  private final Object trainLock = new Object();
  private List<LabeledExample> trainingSet = List.of();
  private final List<LabeledExample> pendingFeedback = new ArrayList<>();

  public GamblingClassifier(
      LexicalFeatureExtractor extractor, ModelRepository repository, ClockPort clock, MetricsPort metrics) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.model = new AtomicReference<>(NaiveBayesModel.untrained(clock.now()));
  }

  /**
   * Loads the persisted snapshot, or trains on {@code seedCorpus} when none exists.
   *
   * @param seedCorpus fallback training documents
   * @throws IOException if a persisted snapshot exists but cannot be read
   * @throws InsufficientDataException if the seed corpus lacks a class
   */
  public void bootstrap(List<LabeledExample> seedCorpus) throws IOException, InsufficientDataException {
    Objects.requireNonNull(seedCorpus, "seedCorpus");
    Optional<TrainingSnapshot> stored = repository.load();
    if (stored.isPresent()) {
      TrainingSnapshot snapshot = stored.get();
      synchronized (trainLock) {
        NaiveBayesModel restored = NaiveBayesModel.train(
            snapshot.examples(), extractor, snapshot.version(), snapshot.trainedAt());
        trainingSet = snapshot.examples();
        model.set(restored);
      }
      log.info("Restored classifier model v{} ({} documents, {} terms)",
          snapshot.version(), snapshot.examples().size(), model.get().vocabularySize());
      return;
    }
    long version = train(seedCorpus);
    log.info("Trained classifier model v{} from seed corpus ({} documents)", version, seedCorpus.size());
  }

  /**
   * Replaces the training set and swaps in a freshly trained model.
   *
   * @param examples labelled documents
   * @return new model version
   * @throws InsufficientDataException if either class is missing; the current model stays live
   */
  public long train(List<LabeledExample> examples) throws InsufficientDataException {
    Objects.requireNonNull(examples, "examples");
    synchronized (trainLock) {
      List<LabeledExample> copy = List.copyOf(examples);
      NaiveBayesModel next = build(copy);
      trainingSet = copy;
      publish(next, copy);
      return next.version();
    }
  }

  /**
   * Retrains on the current training set plus all pending feedback.
   *
   * <p>Pending feedback is cleared only when training succeeds.</p>
   *
   * @return new model version
   * @throws InsufficientDataException if the combined set lacks a class
   */
  public long retrain() throws InsufficientDataException {
    synchronized (trainLock) {
      List<LabeledExample> combined = new ArrayList<>(trainingSet.size() + pendingFeedback.size());
      combined.addAll(trainingSet);
      combined.addAll(pendingFeedback);
      NaiveBayesModel next = build(combined);
      int applied = pendingFeedback.size();
      trainingSet = List.copyOf(combined);
      pendingFeedback.clear();
      publish(next, trainingSet);
      log.info("Retrained classifier model v{} ({} documents, {} feedback applied)",
          next.version(), trainingSet.size(), applied);
      return next.version();
    }
  }

  /**
   * Queues a corrected label for {@code domain}. The live model is unchanged until {@link #retrain()}.
   *
   * @param domain domain or URL the operator labelled
   * @param label corrected label
   */
  public void submitFeedback(String domain, Label label) {
    Objects.requireNonNull(label, "label");
    String normalized = Net.normalizeDomain(domain);
    String text = extractor.documentText("http://" + normalized, null, null);
    synchronized (trainLock) {
      pendingFeedback.add(new LabeledExample(text, label));
    }
    metrics.increment("classifier.feedback.queued");
    log.info("Queued {} feedback for {}", label, normalized);
  }

  /** @return live model; never {@code null} */
  public NaiveBayesModel currentModel() {
    return model.get();
  }

  /**
   * Extracts a vector against the live model's vocabulary.
   *
   * @param url absolute URL or host
   * @param headers response headers, may be {@code null}
   * @param body body excerpt, may be {@code null}
   * @return TF-IDF vector
   */
  public FeatureVector features(String url, HttpHeaders headers, String body) {
    return extractor.extract(url, headers, body, model.get());
  }

  public double score(FeatureVector features) {
    return model.get().score(features);
  }

  public List<TermContribution> explain(FeatureVector features) {
    return model.get().explain(features);
  }

  /**
   * Extracts, scores and explains one observation against a single model snapshot.
   *
   * @param subject what is being classified, recorded on the result
   * @param domain normalized domain
   * @param url URL used for text assembly
   * @param headers response headers, may be {@code null}
   * @param body body excerpt, may be {@code null}
   * @return classification result
   */
  public ClassificationResult classify(
      String subject, String domain, String url, HttpHeaders headers, String body) {
    long start = System.nanoTime();
    NaiveBayesModel snapshot = model.get();
    FeatureVector vector = extractor.extract(url, headers, body, snapshot);
    double score = snapshot.score(vector);
    List<TermContribution> explanation = snapshot.explain(vector);
    List<TermContribution> top = explanation.subList(0, Math.min(TOP_TERMS, explanation.size()));
    metrics.observe("classifier.score.latencyNanos", System.nanoTime() - start);
    return new ClassificationResult(subject, domain, score, top, snapshot.version(), clock.now());
  }

  /**
   * Scores labelled documents with the live model.
   *
   * @param testSet labelled documents
   * @param threshold score at or above which a document counts as gambling
   * @return confusion counts
   */
  public ValidationReport validate(List<LabeledExample> testSet, double threshold) {
    Objects.requireNonNull(testSet, "testSet");
    NaiveBayesModel snapshot = model.get();
    int tp = 0;
    int fp = 0;
    int tn = 0;
    int fn = 0;
    for (LabeledExample example : testSet) {
      boolean predicted = snapshot.score(extractor.vectorize(example.text(), snapshot)) >= threshold;
      boolean actual = example.label() == Label.GAMBLING;
      if (predicted && actual) {
        tp++;
      } else if (predicted) {
        fp++;
      } else if (actual) {
        fn++;
      } else {
        tn++;
      }
    }
    return new ValidationReport(tp, fp, tn, fn, snapshot.version());
  }

  public ModelInfo modelInfo() {
    NaiveBayesModel snapshot = model.get();
    int pending;
    synchronized (trainLock) {
      pending = pendingFeedback.size();
    }
    return new ModelInfo(
        snapshot.version(),
        snapshot.vocabularySize(),
        snapshot.gamblingDocuments(),
        snapshot.benignDocuments(),
        pending,
        snapshot.trainedAt());
  }

  private NaiveBayesModel build(List<LabeledExample> examples) throws InsufficientDataException {
    try {
      NaiveBayesModel next =
          NaiveBayesModel.train(examples, extractor, model.get().version() + 1, clock.now());
      metrics.increment("classifier.retrain.success");
      return next;
    } catch (InsufficientDataException ex) {
      metrics.increment("classifier.retrain.insufficient");
      log.warn("Classifier retrain skipped; keeping model v{}: {}", model.get().version(), ex.getMessage());
      throw ex;
    }
  }

  private void publish(NaiveBayesModel next, List<LabeledExample> examples) {
    model.set(next);
    try {
      repository.save(new TrainingSnapshot(next.version(), next.trainedAt(), examples));
    } catch (IOException ex) {
      metrics.increment("classifier.persist.error");
      log.error("Failed to persist classifier model v{}; it stays live for this run", next.version(), ex);
    }
  }
}
