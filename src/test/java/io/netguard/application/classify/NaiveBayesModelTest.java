package io.netguard.application.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.decision.DecisionEngine;
import io.netguard.application.decision.ManualOverrides;
import io.netguard.application.error.InsufficientDataException;
import io.netguard.domain.classify.ClassificationResult;
import io.netguard.domain.classify.FeatureVector;
import io.netguard.domain.classify.Label;
import io.netguard.domain.classify.LabeledExample;
import io.netguard.domain.classify.TermContribution;
import io.netguard.domain.decision.Verdict;
import io.netguard.testing.ManualClock;
import io.netguard.testing.TestCorpus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NaiveBayesModelTest {
  private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
  private final LexicalFeatureExtractor extractor = TestCorpus.extractor();

  @Test
  void untrainedModelScoresZeroAndExplainsNothing() {
    NaiveBayesModel model = NaiveBayesModel.untrained(T0);
    FeatureVector vector = new FeatureVector(Map.of("casino", 3.0));

    assertFalse(model.isTrained());
    assertEquals(0L, model.version());
    assertEquals(0.0, model.score(vector));
    assertTrue(model.explain(vector).isEmpty());
  }

  @Test
  void trainingRequiresBothClasses() {
    List<LabeledExample> onlyGambling = List.of(new LabeledExample("casino", Label.GAMBLING));

    InsufficientDataException ex = assertThrows(InsufficientDataException.class,
        () -> NaiveBayesModel.train(onlyGambling, extractor, 1L, T0));
    assertTrue(ex.getMessage().contains("benign=0"));
  }

  @Test
  void idfFollowsSmoothedFormula() throws Exception {
    List<LabeledExample> corpus = List.of(
        new LabeledExample("casino poker", Label.GAMBLING),
        new LabeledExample("casino news", Label.BENIGN),
        new LabeledExample("weather news", Label.BENIGN));

    NaiveBayesModel model = NaiveBayesModel.train(corpus, extractor, 1L, T0);

    assertEquals(Math.log(4.0 / 3.0) + 1.0, model.idf("casino"), 1e-9);
    assertEquals(Math.log(4.0 / 2.0) + 1.0, model.idf("poker"), 1e-9);
    assertEquals(Math.log(4.0) + 1.0, model.idf("unseen"), 1e-9);
    assertEquals(4, model.vocabularySize());
    assertEquals(1, model.gamblingDocuments());
    assertEquals(2, model.benignDocuments());
  }

  @Test
  void gamblingTextOutscoresBenignText() throws Exception {
    NaiveBayesModel model = NaiveBayesModel.train(TestCorpus.seed(), extractor, 1L, T0);

    double gambling = model.score(extractor.vectorize("casino jackpot poker betting", model));
    double benign = model.score(extractor.vectorize("news weather tutorial", model));

    assertTrue(gambling > 0.9, "gambling score " + gambling);
    assertTrue(benign < 0.1, "benign score " + benign);
  }

  @Test
  void emptyVectorScoresThePrior() throws Exception {
    List<LabeledExample> corpus = List.of(
        new LabeledExample("casino", Label.GAMBLING),
        new LabeledExample("news", Label.BENIGN),
        new LabeledExample("weather", Label.BENIGN),
        new LabeledExample("tutorial", Label.BENIGN));

    NaiveBayesModel model = NaiveBayesModel.train(corpus, extractor, 1L, T0);

    assertEquals(0.25, model.score(FeatureVector.empty()), 1e-9);
  }

  @Test
  void explainOrdersByAbsoluteContribution() throws Exception {
    NaiveBayesModel model = NaiveBayesModel.train(TestCorpus.seed(), extractor, 1L, T0);

    List<TermContribution> terms = model.explain(extractor.vectorize("casino casino weather", model));

    assertEquals(2, terms.size());
    assertEquals("casino", terms.get(0).term());
    assertTrue(terms.get(0).contribution() > 0);
    assertTrue(terms.get(1).contribution() < 0);
    assertTrue(Math.abs(terms.get(0).contribution()) >= Math.abs(terms.get(1).contribution()));
  }

  @Test
  void trainingIsDeterministic() throws Exception {
    NaiveBayesModel first = NaiveBayesModel.train(TestCorpus.seed(), extractor, 3L, T0);
    NaiveBayesModel second = NaiveBayesModel.train(TestCorpus.seed(), extractor, 3L, T0);
    FeatureVector sample = extractor.vectorize("live casino togel news", first);

    assertEquals(first.score(sample), second.score(sample), 0.0);
    assertEquals(3L, second.version());
  }

  @Test
  void twoDocumentCorpusBlocksUnseenBonusSlotText() throws Exception {
    List<LabeledExample> corpus = List.of(
        new LabeledExample("bonus slot judi online", Label.GAMBLING),
        new LabeledExample("library book catalog", Label.BENIGN));
    NaiveBayesModel model = NaiveBayesModel.train(corpus, extractor, 1L, T0);
    DecisionEngine engine = new DecisionEngine(ManualOverrides.NONE, new ManualClock(), 0.10, 50);

    double score = model.score(extractor.vectorize("free bonus slot spin", model));
    ClassificationResult result =
        new ClassificationResult("free bonus slot spin", "spin.example", score, List.of(), model.version(), T0);

    assertEquals(Verdict.BLOCK, engine.decide(result).verdict(), "score " + score);
  }
}
