package io.netguard.application.enforcement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.error.PermissionDeniedException;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import io.netguard.infrastructure.persistence.JsonBlockedSiteStore;
import io.netguard.infrastructure.persistence.JsonLinesAuditLog;
import io.netguard.testing.InMemoryOverrideTable;
import io.netguard.testing.ManualClock;
import io.netguard.testing.RecordingMetrics;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnforcementManagerTest {
  @TempDir
  Path dataDir;

  private final ManualClock clock = new ManualClock();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private InMemoryOverrideTable table;
  private JsonBlockedSiteStore sites;
  private JsonLinesAuditLog audit;
  private EnforcementManager manager;

  @BeforeEach
  void setUp() throws Exception {
    table = new InMemoryOverrideTable("# static entries\n127.0.0.1 localhost\n");
    sites = JsonBlockedSiteStore.open(dataDir.resolve("blocked-sites.json"));
    audit = JsonLinesAuditLog.open(dataDir, metrics);
    manager = new EnforcementManager(table, sites, audit, clock, metrics, "127.0.0.1");
  }

  @AfterEach
  void tearDown() throws Exception {
    audit.close();
  }

  @Test
  void writesActiveSitesAndAuditsEachAddition() throws Exception {
    sites.save(BlockedSite.active("casino.example", BlockSource.AUTO, "score 0.97", clock.now()));
    sites.save(BlockedSite.active("poker.example", BlockSource.MANUAL, "operator", clock.now()));

    ReconcileResult result = manager.reconcile();

    assertTrue(result.written());
    assertEquals(Set.of("casino.example", "poker.example"), result.added());
    assertTrue(result.removed().isEmpty());
    assertTrue(table.content().startsWith("# static entries\n127.0.0.1 localhost\n"));
    assertTrue(table.content().contains("127.0.0.1 www.poker.example\n"));
    List<EnforcementAction> actions = audit.recentEnforcementActions(10);
    assertEquals(2, actions.size());
    assertTrue(actions.stream().allMatch(a -> a.action() == EnforcementAction.Action.ADD
        && a.outcome() == EnforcementAction.Outcome.APPLIED));
    assertEquals(1, metrics.count("enforce.reconcile.written"));
  }

  @Test
  void explicitWwwBlockIsNotAuditedAsASeparateAddition() throws Exception {
    sites.save(BlockedSite.active("casino.example", BlockSource.AUTO, "", clock.now()));
    sites.save(BlockedSite.active("www.casino.example", BlockSource.MANUAL, "imported", clock.now()));

    ReconcileResult result = manager.reconcile();

    assertEquals(Set.of("casino.example"), result.added());
    assertEquals(1, audit.recentEnforcementActions(10).size());
    String content = table.content();
    assertEquals(content.indexOf("127.0.0.1 www.casino.example"), content.lastIndexOf("127.0.0.1 www.casino.example"));
    assertFalse(manager.reconcile().written());
  }

  @Test
  void secondPassIsANoOp() throws Exception {
    sites.save(BlockedSite.active("casino.example", BlockSource.AUTO, "", clock.now()));
    manager.reconcile();
    String afterFirst = table.content();

    ReconcileResult second = manager.reconcile();

    assertFalse(second.written());
    assertEquals(1, table.writes());
    assertEquals(afterFirst, table.content());
    assertEquals(1, metrics.count("enforce.reconcile.noop"));
    assertEquals(1, audit.recentEnforcementActions(10).size());
  }

  @Test
  void deactivatedSiteIsRemovedFromRegion() throws Exception {
    BlockedSite site = BlockedSite.active("casino.example", BlockSource.AUTO, "", clock.now());
    sites.save(site);
    manager.reconcile();
    sites.save(site.deactivate(clock.now()));

    ReconcileResult result = manager.reconcile();

    assertEquals(Set.of("casino.example"), result.removed());
    assertFalse(table.content().contains("casino.example"));
    assertTrue(table.content().contains(ManagedRegion.BEGIN_MARKER));
    EnforcementAction latest = audit.recentEnforcementActions(1).get(0);
    assertEquals(EnforcementAction.Action.REMOVE, latest.action());
  }

  @Test
  void permissionDeniedIsAuditedAndRethrownWithoutTouchingBlockList() throws Exception {
    sites.save(BlockedSite.active("casino.example", BlockSource.AUTO, "", clock.now()));
    table.denyWrites(true);

    assertThrows(PermissionDeniedException.class, manager::reconcile);

    assertEquals(1, sites.active().size());
    assertFalse(table.content().contains("casino.example"));
    EnforcementAction failed = audit.recentEnforcementActions(1).get(0);
    assertEquals(EnforcementAction.Outcome.FAILED, failed.outcome());
    assertEquals("casino.example", failed.domain());
    assertEquals(1, metrics.count("enforce.reconcile.denied"));

    table.denyWrites(false);
    assertTrue(manager.reconcile().written());
    assertTrue(table.content().contains("127.0.0.1 casino.example"));
  }

  @Test
  void rejectsBlankRedirectAddress() {
    assertThrows(IllegalArgumentException.class,
        () -> new EnforcementManager(table, sites, audit, clock, metrics, " "));
  }
}
