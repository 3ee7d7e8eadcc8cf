package io.netguard.infrastructure.persistence;

import io.netguard.application.port.BlockedSiteStore;
import io.netguard.domain.site.BlockedSite;
import io.netguard.validation.Net;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BlockedSiteStore} persisted as a single JSON document ({@code blocked-sites.json}).
 *
 * <p>Every mutation rewrites the document through a temp file so a crash never leaves a truncated block list. The
 * store keeps one entry per domain: saving a site replaces the previous entry for the same domain, which preserves
 * the "at most one active entry per domain" rule.</p>
 *
 * <p>Thread-safe; mutations and reads synchronize on the instance.</p>
 *
 * @since 0.1.0
 */
public final class JsonBlockedSiteStore implements BlockedSiteStore {
  private static final Logger log = LoggerFactory.getLogger(JsonBlockedSiteStore.class);

  public static final String FILE_NAME = "blocked-sites.json";

  private final Path file;
  private final Map<String, BlockedSite> sites = new LinkedHashMap<>();
  private final Set<String> allowList = new TreeSet<>();

  private JsonBlockedSiteStore(Path file) {
    this.file = file;
  }

  /**
   * Loads the store from {@code file}, starting empty when the file does not exist yet.
   *
   * @param file document path
   * @return loaded store
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the file is not a valid block list document
   */
  public static JsonBlockedSiteStore open(Path file) throws IOException {
    JsonBlockedSiteStore store = new JsonBlockedSiteStore(Objects.requireNonNull(file, "file"));
    if (Files.exists(file)) {
      BlockedSiteJson.Document document = BlockedSiteJson.read(file);
      for (BlockedSite site : document.sites()) {
        store.sites.put(site.domain(), site);
      }
      store.allowList.addAll(document.allowList());
      log.info("Loaded {} blocked site entries ({} active) from {}",
          store.sites.size(), store.active().size(), file);
    }
    return store;
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized List<BlockedSite> all() {
    return List.copyOf(sites.values());
  }

  @Override
  public synchronized List<BlockedSite> active() {
    List<BlockedSite> out = new ArrayList<>();
    for (BlockedSite site : sites.values()) {
      if (site.active()) {
        out.add(site);
      }
    }
    return List.copyOf(out);
  }

  @Override
  public synchronized Optional<BlockedSite> find(String domain) {
    return Optional.ofNullable(sites.get(Net.normalizeDomain(domain)));
  }

  @Override
  public synchronized void save(BlockedSite site) throws IOException {
    Objects.requireNonNull(site, "site");
    String domain = Net.normalizeDomain(site.domain());
    BlockedSite normalized = domain.equals(site.domain())
        ? site
        : new BlockedSite(domain, site.source(), site.reason(), site.addedAt(), site.active(), site.deactivatedAt());
    BlockedSite previous = sites.put(domain, normalized);
    try {
      persist();
    } catch (IOException ex) {
      if (previous == null) {
        sites.remove(domain);
      } else {
        sites.put(domain, previous);
      }
      throw ex;
    }
  }

  @Override
  public synchronized Set<String> allowList() {
    return Set.copyOf(allowList);
  }

  @Override
  public synchronized void setAllowed(String domain, boolean allowed) throws IOException {
    String normalized = Net.normalizeDomain(domain);
    boolean changed = allowed ? allowList.add(normalized) : allowList.remove(normalized);
    if (!changed) {
      return;
    }
    try {
      persist();
    } catch (IOException ex) {
      if (allowed) {
        allowList.remove(normalized);
      } else {
        allowList.add(normalized);
      }
      throw ex;
    }
  }

  private void persist() throws IOException {
    BlockedSiteJson.write(file, sites.values(), allowList);
  }
}
