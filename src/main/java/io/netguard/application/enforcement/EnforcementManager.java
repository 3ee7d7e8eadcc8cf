package io.netguard.application.enforcement;

import io.netguard.application.error.PermissionDeniedException;
import io.netguard.application.port.AuditLog;
import io.netguard.application.port.BlockedSiteStore;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.MetricsPort;
import io.netguard.application.port.OverrideTable;
import io.netguard.domain.audit.EnforcementAction;
import io.netguard.domain.site.BlockedSite;
import io.netguard.validation.Strings;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reconciles the active block list against the managed region of the override table.
 * <p><strong>Why:</strong> The block list is the source of truth; the hosts file only mirrors it, so every pass
 * recomputes the region from scratch instead of applying deltas.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write only when the rendered region differs from the file (idempotent).</li>
 *   <li>Preserve every line outside the managed region verbatim.</li>
 *   <li>Audit each added or removed domain as an {@link EnforcementAction}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Passes run under a single lock; concurrent callers queue.</p>
 * <p><strong>Observability:</strong> Emits {@code enforce.reconcile.noop}, {@code enforce.reconcile.written},
 * {@code enforce.reconcile.denied}, {@code enforce.reconcile.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class EnforcementManager {
  private static final Logger log = LoggerFactory.getLogger(EnforcementManager.class);

  public static final String DEFAULT_REDIRECT_ADDRESS = "127.0.0.1";

  private final OverrideTable table;
  private final BlockedSiteStore sites;
  private final AuditLog audit;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final String redirectAddress;
  private final ReentrantLock lock = new ReentrantLock();

  public EnforcementManager(
      OverrideTable table,
      BlockedSiteStore sites,
      AuditLog audit,
      ClockPort clock,
      MetricsPort metrics,
      String redirectAddress) {
    this.table = Objects.requireNonNull(table, "table");
    this.sites = Objects.requireNonNull(sites, "sites");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.redirectAddress = Strings.requireNonBlank("redirectAddress", redirectAddress);
  }

  /**
   * Runs one reconciliation pass.
   *
   * @return what changed
   * @throws PermissionDeniedException if the table is not writable; the block list is left untouched
   * @throws IOException if the table cannot be read or written for another reason
   */
  public ReconcileResult reconcile() throws IOException {
    long start = System.nanoTime();
    lock.lock();
    try {
      Set<String> active = new TreeSet<>();
      for (BlockedSite site : sites.active()) {
        active.add(site.domain());
      }
      Set<String> desired = ManagedRegion.canonical(active);
      ManagedRegion region = ManagedRegion.parse(table.read());
      List<String> desiredEntries = ManagedRegion.renderEntries(desired, redirectAddress);
      if (region.matches(desiredEntries)) {
        metrics.increment("enforce.reconcile.noop");
        return ReconcileResult.unchanged();
      }

      Set<String> current = region.domains();
      Set<String> added = new TreeSet<>(desired);
      added.removeAll(current);
      Set<String> removed = new TreeSet<>(current);
      removed.removeAll(desired);

      try {
        table.write(region.replaceWith(desiredEntries));
      } catch (PermissionDeniedException ex) {
        metrics.increment("enforce.reconcile.denied");
        log.warn("Cannot write {} ({} to add, {} to remove); will retry next tick: {}",
            table.describe(), added.size(), removed.size(), ex.getMessage());
        record(added, removed, EnforcementAction.Outcome.FAILED, ex.getMessage());
        throw ex;
      }
      metrics.increment("enforce.reconcile.written");
      log.info("Reconciled {}: added {}, removed {}", table.describe(), added, removed);
      record(added, removed, EnforcementAction.Outcome.APPLIED, "");
      return new ReconcileResult(added, removed, true);
    } finally {
      lock.unlock();
      metrics.observe("enforce.reconcile.latencyNanos", System.nanoTime() - start);
    }
  }

  public String redirectAddress() {
    return redirectAddress;
  }

  private void record(Set<String> added, Set<String> removed, EnforcementAction.Outcome outcome, String detail) {
    for (String domain : added) {
      append(domain, EnforcementAction.Action.ADD, outcome, detail);
    }
    for (String domain : removed) {
      append(domain, EnforcementAction.Action.REMOVE, outcome, detail);
    }
  }

  private void append(
      String domain, EnforcementAction.Action action, EnforcementAction.Outcome outcome, String detail) {
    EnforcementAction entry = new EnforcementAction(
        UUID.randomUUID().toString(), domain, action, outcome, detail, clock.now());
    try {
      audit.appendEnforcement(entry);
    } catch (IOException ex) {
      metrics.increment("audit.append.error");
      log.error("Failed to audit {} {} for {}", outcome, action, domain, ex);
    }
  }
}
