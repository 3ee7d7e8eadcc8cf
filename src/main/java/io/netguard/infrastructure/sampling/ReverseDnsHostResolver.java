package io.netguard.infrastructure.sampling;

import io.netguard.application.port.ClockPort;
import io.netguard.application.port.HostResolver;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caching reverse-DNS {@link HostResolver}.
 *
 * <p>A failed lookup resolves to the literal address and is cached like a success, so an unresolvable peer costs
 * one lookup per TTL. The cache is bounded; when full, expired entries are evicted first and then an arbitrary
 * one.</p>
 *
 * @since 0.1.0
 */
public final class ReverseDnsHostResolver implements HostResolver {
  private static final Logger log = LoggerFactory.getLogger(ReverseDnsHostResolver.class);

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
  public static final int DEFAULT_MAX_ENTRIES = 4_096;

  private final UnaryOperator<String> lookup;
  private final ClockPort clock;
  private final long ttlMillis;
  private final int maxEntries;
  private final Map<String, Cached> cache = new ConcurrentHashMap<>();

  public ReverseDnsHostResolver(ClockPort clock) {
    this(ReverseDnsHostResolver::reverseLookup, clock, DEFAULT_TTL, DEFAULT_MAX_ENTRIES);
  }

  public ReverseDnsHostResolver(UnaryOperator<String> lookup, ClockPort clock, Duration ttl, int maxEntries) {
    this.lookup = Objects.requireNonNull(lookup, "lookup");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ttlMillis = Objects.requireNonNull(ttl, "ttl").toMillis();
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1");
    }
    this.maxEntries = maxEntries;
  }

  @Override
  public String resolve(String address) {
    Objects.requireNonNull(address, "address");
    long now = clock.nowMillis();
    Cached cached = cache.get(address);
    if (cached != null && now - cached.resolvedAt() < ttlMillis) {
      return cached.host();
    }
    String host = lookup.apply(address);
    if (host == null || host.isBlank()) {
      host = address;
    }
    if (cache.size() >= maxEntries) {
      evict(now);
    }
    cache.put(address, new Cached(host, now));
    return host;
  }

  int cachedEntries() {
    return cache.size();
  }

  private void evict(long now) {
    cache.values().removeIf(entry -> now - entry.resolvedAt() >= ttlMillis);
    Iterator<String> keys = cache.keySet().iterator();
    while (cache.size() >= maxEntries && keys.hasNext()) {
      keys.next();
      keys.remove();
    }
  }

  private static String reverseLookup(String address) {
    try {
      String name = InetAddress.getByName(address).getCanonicalHostName();
      return name.equals(address) ? address : name.toLowerCase(Locale.ROOT);
    } catch (UnknownHostException | SecurityException ex) {
      log.debug("Reverse lookup of {} failed: {}", address, ex.getMessage());
      return address;
    }
  }

  private record Cached(String host, long resolvedAt) {}
}
