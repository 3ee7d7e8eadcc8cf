package io.netguard.application.port;

import io.netguard.domain.site.BlockedSite;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Port persisting block list entries and the manual allow list.
 * <p><strong>Invariant:</strong> At most one entry exists per domain, so at most one is active.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent readers and writers; the
 * pipeline lanes and the service facade mutate concurrently.</p>
 *
 * @since 0.1.0
 */
public interface BlockedSiteStore {
  /** @return every entry, active or not, ordered by domain */
  List<BlockedSite> all();

  /** @return active entries ordered by domain */
  List<BlockedSite> active();

  Optional<BlockedSite> find(String domain);

  /**
   * Inserts or replaces the entry for {@link BlockedSite#domain()}.
   *
   * @param site entry to store
   * @throws IOException if the store cannot be persisted
   */
  void save(BlockedSite site) throws IOException;

  /** @return domains the operator explicitly allowed */
  Set<String> allowList();

  /**
   * Adds or removes a domain from the manual allow list.
   *
   * @param domain normalized domain
   * @param allowed {@code true} to add, {@code false} to remove
   * @throws IOException if the store cannot be persisted
   */
  void setAllowed(String domain, boolean allowed) throws IOException;
}
