package io.netguard.infrastructure.persistence;

import io.netguard.application.port.ClockPort;
import io.netguard.application.port.TransactionStore;
import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.validation.Numbers;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory {@link TransactionStore}.
 *
 * <p>Holds at most {@code capacity} transactions and none older than {@code maxAge}; the oldest entry is evicted
 * first. Captured bodies therefore never outlive the retention window.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryTransactionStore implements TransactionStore {
  public static final int DEFAULT_CAPACITY = 1_000;
  public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(1);

  private final int capacity;
  private final Duration maxAge;
  private final ClockPort clock;
  private final Deque<CapturedTransaction> entries = new ArrayDeque<>();

  public InMemoryTransactionStore(int capacity, Duration maxAge, ClockPort clock) {
    this.capacity = (int) Numbers.requireRange("capacity", capacity, 1, 1_000_000);
    this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public InMemoryTransactionStore() {
    this(DEFAULT_CAPACITY, DEFAULT_MAX_AGE, ClockPort.SYSTEM);
  }

  @Override
  public synchronized void add(CapturedTransaction transaction) {
    Objects.requireNonNull(transaction, "transaction");
    entries.addLast(transaction);
    while (entries.size() > capacity) {
      entries.removeFirst();
    }
    evictOlderThan(clock.now().minus(maxAge));
  }

  @Override
  public synchronized List<CapturedTransaction> recent(int limit) {
    evictOlderThan(clock.now().minus(maxAge));
    List<CapturedTransaction> out = new ArrayList<>(Math.max(0, Math.min(limit, entries.size())));
    Iterator<CapturedTransaction> it = entries.descendingIterator();
    while (it.hasNext() && out.size() < limit) {
      out.add(it.next());
    }
    return List.copyOf(out);
  }

  @Override
  public synchronized Optional<CapturedTransaction> find(String id) {
    Objects.requireNonNull(id, "id");
    for (CapturedTransaction tx : entries) {
      if (tx.id().equals(id)) {
        return Optional.of(tx);
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized int purgeOlderThan(Instant horizon) {
    return evictOlderThan(Objects.requireNonNull(horizon, "horizon"));
  }

  @Override
  public synchronized int size() {
    return entries.size();
  }

  private int evictOlderThan(Instant horizon) {
    int removed = 0;
    Iterator<CapturedTransaction> it = entries.iterator();
    while (it.hasNext()) {
      if (it.next().timestamp().isBefore(horizon)) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }
}
