package io.netguard.application.port;

/**
 * Maps a remote IP literal to a host name. Implementations fall back to the literal itself when no name is known;
 * they never throw for lookup failures.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostResolver {
  /**
   * Resolves {@code address} to a host name.
   *
   * @param address IPv4 or IPv6 literal
   * @return host name, or {@code address} when reverse lookup fails
   */
  String resolve(String address);

  /** Resolver that never performs lookups. */
  HostResolver LITERAL = address -> address;
}
