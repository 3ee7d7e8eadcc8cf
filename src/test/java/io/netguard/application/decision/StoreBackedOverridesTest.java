package io.netguard.application.decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import io.netguard.infrastructure.persistence.JsonBlockedSiteStore;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreBackedOverridesTest {
  private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

  @TempDir Path tempDir;

  @Test
  void manualBlockCoversSubdomainsButAutoBlockDoesNot() throws Exception {
    JsonBlockedSiteStore store = JsonBlockedSiteStore.open(tempDir.resolve("sites.json"));
    store.save(BlockedSite.active("casino.example", BlockSource.MANUAL, "operator", T0));
    store.save(BlockedSite.active("slots.example", BlockSource.AUTO, "classifier", T0));
    StoreBackedOverrides overrides = new StoreBackedOverrides(store);

    assertTrue(overrides.isManuallyBlocked("casino.example"));
    assertTrue(overrides.isManuallyBlocked("cdn.casino.example"));
    assertFalse(overrides.isManuallyBlocked("slots.example"));
    assertFalse(overrides.isManuallyBlocked("example"));
  }

  @Test
  void deactivatedManualBlockNoLongerApplies() throws Exception {
    JsonBlockedSiteStore store = JsonBlockedSiteStore.open(tempDir.resolve("sites.json"));
    store.save(BlockedSite.active("casino.example", BlockSource.MANUAL, "operator", T0).deactivate(T0));

    assertFalse(new StoreBackedOverrides(store).isManuallyBlocked("casino.example"));
  }

  @Test
  void allowListCoversSubdomains() throws Exception {
    JsonBlockedSiteStore store = JsonBlockedSiteStore.open(tempDir.resolve("sites.json"));
    store.setAllowed("poker-news.example", true);
    StoreBackedOverrides overrides = new StoreBackedOverrides(store);

    assertTrue(overrides.isManuallyAllowed("poker-news.example"));
    assertTrue(overrides.isManuallyAllowed("m.poker-news.example"));
    assertFalse(overrides.isManuallyAllowed("news.example"));
  }

  @Test
  void suffixesStopBeforeSingleLabel() {
    assertEquals(List.of("a.b.example", "b.example"), StoreBackedOverrides.suffixes("a.b.example"));
    assertEquals(List.of("localhost"), StoreBackedOverrides.suffixes("localhost"));
  }
}
