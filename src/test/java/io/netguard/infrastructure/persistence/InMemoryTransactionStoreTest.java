package io.netguard.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.domain.capture.CapturedTransaction;
import io.netguard.testing.ManualClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryTransactionStoreTest {
  private final ManualClock clock = new ManualClock();

  @Test
  void keepsOnlyTheNewestEntriesUpToCapacity() {
    InMemoryTransactionStore store = new InMemoryTransactionStore(3, Duration.ofHours(1), clock);
    for (int i = 0; i < 5; i++) {
      store.add(tx("t" + i, clock.now()));
    }

    assertEquals(3, store.size());
    assertEquals(List.of("t4", "t3"), store.recent(2).stream().map(CapturedTransaction::id).toList());
    assertTrue(store.find("t0").isEmpty());
    assertTrue(store.find("t2").isPresent());
  }

  @Test
  void evictsEntriesOlderThanMaxAge() {
    InMemoryTransactionStore store = new InMemoryTransactionStore(10, Duration.ofMinutes(30), clock);
    store.add(tx("old", clock.now()));
    clock.advance(Duration.ofMinutes(31));
    store.add(tx("new", clock.now()));

    assertEquals(List.of("new"), store.recent(10).stream().map(CapturedTransaction::id).toList());
  }

  @Test
  void purgeRemovesEntriesBeforeHorizon() {
    InMemoryTransactionStore store = new InMemoryTransactionStore(10, Duration.ofHours(1), clock);
    Instant now = clock.now();
    store.add(tx("a", now.minusSeconds(120)));
    store.add(tx("b", now.minusSeconds(10)));

    assertEquals(1, store.purgeOlderThan(now.minusSeconds(60)));
    assertEquals(1, store.size());
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> new InMemoryTransactionStore(0, Duration.ofHours(1), clock));
    assertThrows(IllegalArgumentException.class, () -> new InMemoryTransactionStore(10, Duration.ZERO, clock));
  }

  private static CapturedTransaction tx(String id, Instant at) {
    return new CapturedTransaction(id, "https://casino.example/" + id, "GET", null, null, 200, null,
        "<html>jackpot</html>", 20, 5, at);
  }
}
