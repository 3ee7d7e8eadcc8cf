package io.netguard.application.decision;

import io.netguard.application.port.BlockedSiteStore;
import io.netguard.domain.site.BlockSource;
import io.netguard.domain.site.BlockedSite;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ManualOverrides} read from the blocked-site store. An override on {@code example.com} also covers its
 * subdomains such as {@code cdn.example.com}.
 */
public final class StoreBackedOverrides implements ManualOverrides {
  private final BlockedSiteStore store;

  public StoreBackedOverrides(BlockedSiteStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  @Override
  public boolean isManuallyBlocked(String domain) {
    for (String candidate : suffixes(domain)) {
      Optional<BlockedSite> site = store.find(candidate);
      if (site.isPresent() && site.get().active() && site.get().source() == BlockSource.MANUAL) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isManuallyAllowed(String domain) {
    Set<String> allowed = store.allowList();
    if (allowed.isEmpty()) {
      return false;
    }
    for (String candidate : suffixes(domain)) {
      if (allowed.contains(candidate)) {
        return true;
      }
    }
    return false;
  }

  /** Returns {@code a.b.c}, {@code b.c}; single-label suffixes are never matched. */
  static List<String> suffixes(String domain) {
    List<String> out = new ArrayList<>(4);
    String current = domain;
    while (current.indexOf('.') > 0) {
      out.add(current);
      current = current.substring(current.indexOf('.') + 1);
    }
    if (out.isEmpty()) {
      out.add(domain);
    }
    return out;
  }
}
