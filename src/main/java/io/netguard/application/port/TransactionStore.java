package io.netguard.application.port;

import io.netguard.domain.capture.CapturedTransaction;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bounded store of captured transactions. Oldest entries are evicted once the capacity is reached.
 *
 * @since 0.1.0
 */
public interface TransactionStore {
  void add(CapturedTransaction transaction);

  /**
   * Returns the newest transactions first.
   *
   * @param limit maximum number of entries
   * @return newest-first snapshot
   */
  List<CapturedTransaction> recent(int limit);

  Optional<CapturedTransaction> find(String id);

  /**
   * Removes transactions captured before {@code horizon}.
   *
   * @param horizon exclusive cutoff
   * @return number of removed transactions
   */
  int purgeOlderThan(Instant horizon);

  int size();
}
