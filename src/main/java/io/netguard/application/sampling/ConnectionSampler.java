package io.netguard.application.sampling;

import io.netguard.application.error.CaptureTimeoutException;
import io.netguard.application.port.ClockPort;
import io.netguard.application.port.ConnectionListener;
import io.netguard.application.port.ConnectionSource;
import io.netguard.application.port.ErrorRecorder;
import io.netguard.application.port.HostResolver;
import io.netguard.application.port.MetricsPort;
import io.netguard.domain.net.Connection;
import io.netguard.domain.net.ConnectionEvent;
import io.netguard.domain.net.ConnectionKey;
import io.netguard.domain.net.SocketEntry;
import io.netguard.infrastructure.exec.ExecutorFactories;
import io.netguard.validation.Net;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Periodically enumerates outbound connections and reports opened and closed ones.
 * <p><strong>Why:</strong> Connection metadata is the always-on evidence source; it needs no proxy configuration
 * on the client.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip listening sockets and loopback, private and link-local peers.</li>
 *   <li>Diff each pass against the owned connection table; emit OPENED for new keys and CLOSED once a key has
 *   been absent longer than the idle timeout.</li>
 *   <li>Bound every enumeration with a timeout and never run two passes at once.</li>
 *   <li>Resolve new peers within the same budget; lookups still pending fall back to the address literal.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Passes run on one tick thread; {@link #snapshot()} may be called from any
 * thread.</p>
 * <p><strong>Observability:</strong> Emits {@code sampler.pass.latencyNanos}, {@code sampler.pass.skipped},
 * {@code sampler.pass.timeout}, {@code sampler.pass.error}, {@code sampler.resolve.timeout},
 * {@code sampler.connections.opened}, {@code sampler.connections.closed}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionSampler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionSampler.class);

  private static final long SHUTDOWN_TIMEOUT_MILLIS = 2_000L;

  private final ConnectionSource source;
  private final HostResolver resolver;
  private final ConnectionListener listener;
  private final ErrorRecorder errors;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SamplerSettings settings;

  private final Map<ConnectionKey, Connection> table = new ConcurrentHashMap<>();
  private final AtomicBoolean passInFlight = new AtomicBoolean();
  private final LongAdder observed = new LongAdder();
  private final Object lifecycleLock = new Object();
  private final ExecutorService resolvers;

  private ScheduledExecutorService scheduler;
  private ExecutorService enumerator;
  private volatile Future<List<SocketEntry>> lastEnumeration;

  public ConnectionSampler(
      ConnectionSource source,
      HostResolver resolver,
      ConnectionListener listener,
      ErrorRecorder errors,
      ClockPort clock,
      MetricsPort metrics,
      SamplerSettings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.resolvers = ExecutorFactories.newConnectionPool("netguard-resolve",
        (t, ex) -> log.error("Resolver thread {} crashed", t.getName(), ex));
  }

  /** Starts periodic sampling; a no-op when already running. */
  public void start() {
    synchronized (lifecycleLock) {
      if (scheduler != null) {
        return;
      }
      lastEnumeration = null;
      enumerator = ExecutorFactories.newSingleWorker("netguard-enumerate");
      scheduler = ExecutorFactories.newTickScheduler("netguard-sampler",
          (t, ex) -> log.error("Sampler thread {} crashed", t.getName(), ex));
      long periodMillis = settings.pollInterval().toMillis();
      scheduler.scheduleAtFixedRate(this::tick, 0L, periodMillis, TimeUnit.MILLISECONDS);
      log.info("Connection sampler started using {} (poll {} ms, idle timeout {} ms)",
          source.name(), periodMillis, settings.idleTimeout().toMillis());
    }
  }

  /** Stops sampling and waits briefly for an in-flight pass; a no-op when not running. */
  public void stop() {
    ScheduledExecutorService s;
    ExecutorService e;
    synchronized (lifecycleLock) {
      s = scheduler;
      e = enumerator;
      scheduler = null;
      enumerator = null;
    }
    if (s == null) {
      return;
    }
    s.shutdownNow();
    e.shutdownNow();
    try {
      if (!s.awaitTermination(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Sampler tick still running after {} ms", SHUTDOWN_TIMEOUT_MILLIS);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    log.info("Connection sampler stopped; {} connections in table", table.size());
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return scheduler != null;
    }
  }

  @Override
  public void close() {
    stop();
    resolvers.shutdownNow();
  }

  /**
   * Runs one sampling pass synchronously, bounded by the enumeration timeout.
   *
   * @return events emitted by this pass, empty when the pass was skipped
   */
  public List<ConnectionEvent> sampleOnce() {
    if (!passInFlight.compareAndSet(false, true)) {
      metrics.increment("sampler.pass.skipped");
      log.debug("Previous sampling pass still running; skipping tick");
      return List.of();
    }
    try {
      ExecutorService worker = currentEnumerator();
      if (worker == null) {
        try {
          return diff(source.enumerate());
        } catch (IOException ex) {
          return fail(ex);
        }
      }
      Future<List<SocketEntry>> previous = lastEnumeration;
      if (previous != null && !previous.isDone()) {
        metrics.increment("sampler.pass.skipped");
        log.debug("Previous enumeration still running; skipping tick");
        return List.of();
      }
      return enumerateWithin(worker);
    } finally {
      passInFlight.set(false);
    }
  }

  private List<ConnectionEvent> enumerateWithin(ExecutorService worker) {
    Future<List<SocketEntry>> pending;
    try {
      pending = worker.submit(source::enumerate);
    } catch (RejectedExecutionException rejected) {
      log.debug("Sampler stopping; enumeration rejected");
      return List.of();
    }
    lastEnumeration = pending;
    long budget = settings.enumerationTimeout().toMillis();
    try {
      return diff(pending.get(budget, TimeUnit.MILLISECONDS));
    } catch (TimeoutException ex) {
      pending.cancel(true);
      metrics.increment("sampler.pass.timeout");
      CaptureTimeoutException timeout =
          new CaptureTimeoutException("connection enumeration", settings.enumerationTimeout(), ex);
      log.warn("Sampling pass skipped: {}", timeout.getMessage());
      errors.record("sampler", "", timeout);
      return List.of();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return fail(cause);
    } catch (CancellationException ex) {
      return List.of();
    } catch (InterruptedException ex) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      return List.of();
    }
  }

  /** @return current connection table ordered by first observation */
  public List<Connection> snapshot() {
    List<Connection> out = new ArrayList<>(table.values());
    out.sort(Comparator.comparing(Connection::firstSeen).thenComparing(c -> c.key().toString()));
    return out;
  }

  public int activeConnections() {
    return table.size();
  }

  /** @return connections opened since construction */
  public long connectionsObserved() {
    return observed.sum();
  }

  private void tick() {
    MDC.put("pipeline", "sampler");
    long start = System.nanoTime();
    try {
      sampleOnce();
    } catch (RuntimeException ex) {
      metrics.increment("sampler.pass.error");
      log.error("Sampling pass failed", ex);
      errors.record("sampler", "", ex);
    } finally {
      metrics.observe("sampler.pass.latencyNanos", System.nanoTime() - start);
      MDC.remove("pipeline");
    }
  }

  private List<ConnectionEvent> fail(Throwable cause) {
    metrics.increment("sampler.pass.error");
    log.warn("Connection enumeration via {} failed: {}", source.name(), cause.getMessage());
    errors.record("sampler", "", cause);
    return List.of();
  }

  private ExecutorService currentEnumerator() {
    synchronized (lifecycleLock) {
      return enumerator;
    }
  }

  private List<ConnectionEvent> diff(List<SocketEntry> entries) {
    Instant now = clock.now();
    List<ConnectionEvent> events = new ArrayList<>();
    Set<ConnectionKey> seen = new HashSet<>();
    Map<ConnectionKey, SocketEntry> fresh = new LinkedHashMap<>();
    for (SocketEntry entry : entries) {
      if (entry.listening() || !Net.isPublicAddress(entry.remoteAddress())) {
        continue;
      }
      ConnectionKey key = new ConnectionKey(
          entry.remoteAddress(), entry.remotePort(), entry.pid(), entry.protocol());
      if (!seen.add(key)) {
        continue;
      }
      Connection existing = table.get(key);
      if (existing != null) {
        table.put(key, existing.touch(now));
      } else {
        fresh.put(key, entry);
      }
    }

    Map<String, String> names = resolveAll(fresh.values());
    for (Map.Entry<ConnectionKey, SocketEntry> e : fresh.entrySet()) {
      SocketEntry entry = e.getValue();
      Connection opened = new Connection(
          entry.remoteAddress(),
          names.get(entry.remoteAddress()),
          entry.remotePort(),
          entry.pid(),
          entry.processName(),
          entry.protocol(),
          now,
          now);
      table.put(e.getKey(), opened);
      observed.increment();
      metrics.increment("sampler.connections.opened");
      events.add(ConnectionEvent.opened(opened));
    }

    long idleMillis = settings.idleTimeout().toMillis();
    Iterator<Map.Entry<ConnectionKey, Connection>> it = table.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<ConnectionKey, Connection> e = it.next();
      if (seen.contains(e.getKey())) {
        continue;
      }
      if (now.toEpochMilli() - e.getValue().lastSeen().toEpochMilli() > idleMillis) {
        it.remove();
        metrics.increment("sampler.connections.closed");
        events.add(ConnectionEvent.closed(e.getValue()));
      }
    }

    for (ConnectionEvent event : events) {
      try {
        listener.onConnectionEvent(event);
      } catch (RuntimeException ex) {
        metrics.increment("sampler.listener.error");
        log.error("Connection listener failed for {}", event.connection().remoteHost(), ex);
        errors.record("sampler", event.connection().remoteHost(), ex);
      }
    }
    return events;
  }

  /**
   * Reverse-resolves the peers of new connections in parallel, waiting at most one enumeration timeout for all of
   * them together.
   *
   * @return host name per address; addresses whose lookup did not finish in time map to themselves
   */
  private Map<String, String> resolveAll(Collection<SocketEntry> entries) {
    Map<String, Future<String>> lookups = new LinkedHashMap<>();
    Map<String, String> names = new HashMap<>();
    for (SocketEntry entry : entries) {
      String address = entry.remoteAddress();
      if (lookups.containsKey(address) || names.containsKey(address)) {
        continue;
      }
      try {
        lookups.put(address, resolvers.submit(() -> resolver.resolve(address)));
      } catch (RejectedExecutionException rejected) {
        names.put(address, address);
      }
    }
    long deadline = System.nanoTime() + settings.enumerationTimeout().toNanos();
    int late = 0;
    for (Map.Entry<String, Future<String>> lookup : lookups.entrySet()) {
      String address = lookup.getKey();
      Future<String> pending = lookup.getValue();
      String name = address;
      try {
        name = pending.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      } catch (TimeoutException ex) {
        pending.cancel(true);
        metrics.increment("sampler.resolve.timeout");
        late++;
      } catch (ExecutionException ex) {
        log.debug("Reverse lookup of {} failed: {}", address, String.valueOf(ex.getCause()));
      } catch (InterruptedException ex) {
        pending.cancel(true);
        Thread.currentThread().interrupt();
      }
      names.put(address, name);
    }
    if (late > 0) {
      log.warn("Reverse lookup of {} address(es) exceeded {} ms; using literals",
          late, settings.enumerationTimeout().toMillis());
    }
    return names;
  }
}
