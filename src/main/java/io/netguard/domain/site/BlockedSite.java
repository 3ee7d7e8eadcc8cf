package io.netguard.domain.site;

import java.time.Instant;
import java.util.Objects;

/**
 * Block list entry. Entries are never deleted; unblocking deactivates them so the history stays auditable.
 *
 * @param domain normalized domain
 * @param source automatic or manual
 * @param reason free-text reason shown to operators
 * @param addedAt time the entry was (re)activated
 * @param active whether the domain is currently enforced
 * @param deactivatedAt time the entry was deactivated, {@code null} while active
 * @since 0.1.0
 */
public record BlockedSite(
    String domain,
    BlockSource source,
    String reason,
    Instant addedAt,
    boolean active,
    Instant deactivatedAt) {

  public BlockedSite {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(source, "source");
    reason = reason == null ? "" : reason;
    Objects.requireNonNull(addedAt, "addedAt");
    if (active) {
      deactivatedAt = null;
    }
  }

  public static BlockedSite active(String domain, BlockSource source, String reason, Instant addedAt) {
    return new BlockedSite(domain, source, reason, addedAt, true, null);
  }

  public BlockedSite deactivate(Instant when) {
    return new BlockedSite(domain, source, reason, addedAt, false, Objects.requireNonNull(when, "when"));
  }
}
