package io.netguard.application.port;

import io.netguard.application.classify.TrainingSnapshot;
import java.io.IOException;
import java.util.Optional;

/**
 * Persists the classifier's training snapshot so restarts keep the model version and learned feedback.
 *
 * @since 0.1.0
 */
public interface ModelRepository {
  /**
   * Loads the last saved snapshot.
   *
   * @return snapshot, or empty when nothing was saved yet
   * @throws IOException if a saved snapshot exists but cannot be read
   */
  Optional<TrainingSnapshot> load() throws IOException;

  void save(TrainingSnapshot snapshot) throws IOException;

  /** Repository that keeps nothing. */
  ModelRepository NONE = new ModelRepository() {
    @Override public Optional<TrainingSnapshot> load() {
      return Optional.empty();
    }

    @Override public void save(TrainingSnapshot snapshot) {}
  };
}
