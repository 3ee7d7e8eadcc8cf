package io.netguard.application.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.error.InsufficientDataException;
import io.netguard.application.port.ModelRepository;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.classify.ModelInfo;
import io.netguard.testing.ManualClock;
import io.netguard.testing.RecordingMetrics;
import io.netguard.testing.TestCorpus;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class GamblingClassifierTest {
  private final ManualClock clock = new ManualClock();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final MemoryRepository repository = new MemoryRepository();

  private GamblingClassifier classifier() {
    return new GamblingClassifier(TestCorpus.extractor(), repository, clock, metrics);
  }

  @Test
  void bootstrapTrainsSeedCorpusWhenNothingIsPersisted() throws Exception {
    GamblingClassifier classifier = classifier();

    classifier.bootstrap(TestCorpus.seed());

    assertEquals(1L, classifier.currentModel().version());
    assertEquals(1L, repository.stored.version());
    assertEquals(TestCorpus.seed().size(), repository.stored.examples().size());
    assertEquals(1L, metrics.count("classifier.retrain.success"));
  }

  @Test
  void bootstrapRestoresPersistedSnapshotVersion() throws Exception {
    repository.stored = new TrainingSnapshot(7L, Instant.parse("2024-04-01T00:00:00Z"), TestCorpus.seed());
    GamblingClassifier classifier = classifier();

    classifier.bootstrap(List.of());

    assertEquals(7L, classifier.currentModel().version());
    assertEquals(Instant.parse("2024-04-01T00:00:00Z"), classifier.modelInfo().trainedAt());
  }

  @Test
  void feedbackAppliesOnlyAfterRetrain() throws Exception {
    GamblingClassifier classifier = classifier();
    classifier.bootstrap(TestCorpus.seed());
    double before = classifier.classify("http://wagerzone.example", "wagerzone.example",
        "http://wagerzone.example", null, null).score();

    classifier.submitFeedback("https://www.wagerzone.example/lobby", Label.GAMBLING);
    classifier.submitFeedback("wagerzone.example", Label.GAMBLING);

    assertEquals(2, classifier.modelInfo().pendingFeedback());
    assertEquals(1L, classifier.currentModel().version());

    long version = classifier.retrain();

    assertEquals(2L, version);
    assertEquals(0, classifier.modelInfo().pendingFeedback());
    assertEquals(TestCorpus.seed().size() + 2, repository.stored.examples().size());
    double after = classifier.classify("http://wagerzone.example", "wagerzone.example",
        "http://wagerzone.example", null, null).score();
    assertTrue(after > before, "score should rise after gambling feedback: " + before + " -> " + after);
  }

  @Test
  void failedRetrainKeepsModelAndPendingFeedback() {
    GamblingClassifier classifier = classifier();
    classifier.submitFeedback("casino.example", Label.GAMBLING);

    assertThrows(InsufficientDataException.class, classifier::retrain);

    assertEquals(0L, classifier.currentModel().version());
    assertEquals(1, classifier.modelInfo().pendingFeedback());
    assertEquals(1L, metrics.count("classifier.retrain.insufficient"));
  }

  @Test
  void untrainedClassifierScoresZero() {
    ClassificationResult result = classifier().classify(
        "http://casino.example", "casino.example", "http://casino.example", null, "jackpot roulette");

    assertEquals(0.0, result.score());
    assertEquals(0L, result.modelVersion());
    assertTrue(result.topTerms().isEmpty());
  }

  @Test
  void classifyReportsAtMostFiveTopTerms() throws Exception {
    GamblingClassifier classifier = classifier();
    classifier.bootstrap(TestCorpus.seed());

    ClassificationResult result = classifier.classify("http://casino.example/poker", "casino.example",
        "http://casino.example/poker", null, "jackpot roulette betting live casino togel taruhan news weather");

    assertTrue(result.score() > 0.9);
    assertEquals(GamblingClassifier.TOP_TERMS, result.topTerms().size());
    assertEquals(1L, result.modelVersion());
    assertEquals(clock.now(), result.timestamp());
    assertEquals(1, metrics.observations("classifier.score.latencyNanos").size());
  }

  @Test
  void validateCountsConfusionMatrix() throws Exception {
    GamblingClassifier classifier = classifier();
    classifier.bootstrap(TestCorpus.seed());

    ValidationReport report = classifier.validate(List.of(
        new LabeledExample("casino jackpot", Label.GAMBLING),
        new LabeledExample("togel taruhan", Label.GAMBLING),
        new LabeledExample("news weather", Label.BENIGN),
        new LabeledExample("poker betting", Label.BENIGN)), 0.5);

    assertEquals(2, report.truePositives());
    assertEquals(1, report.falsePositives());
    assertEquals(1, report.trueNegatives());
    assertEquals(0, report.falseNegatives());
    assertEquals(4, report.total());
    assertEquals(0.75, report.accuracy(), 1e-9);
  }

  @Test
  void persistenceFailureKeepsNewModelLive() throws Exception {
    repository.failSaves = true;
    GamblingClassifier classifier = classifier();

    classifier.bootstrap(TestCorpus.seed());

    ModelInfo info = classifier.modelInfo();
    assertEquals(1L, info.version());
    assertEquals(5, info.gamblingExamples());
    assertEquals(5, info.benignExamples());
    assertEquals(1L, metrics.count("classifier.persist.error"));
  }

  private static final class MemoryRepository implements ModelRepository {
    private TrainingSnapshot stored;
    private boolean failSaves;

    @Override
    public Optional<TrainingSnapshot> load() {
      return Optional.ofNullable(stored);
    }

    @Override
    public void save(TrainingSnapshot snapshot) throws IOException {
      if (failSaves) {
        throw new IOException("disk full");
      }
      stored = snapshot;
    }
  }
}
