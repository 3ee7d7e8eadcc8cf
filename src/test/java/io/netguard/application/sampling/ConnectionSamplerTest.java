package io.netguard.application.sampling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.error.CaptureTimeoutException;
import io.netguard.application.port.ConnectionSource;
import io.netguard.domain.net.Connection;
import io.netguard.domain.net.ConnectionEvent;
import io.netguard.domain.net.SocketEntry;
import io.netguard.testing.ManualClock;
import io.netguard.testing.RecordingMetrics;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConnectionSamplerTest {
  private static final SamplerSettings SETTINGS = new SamplerSettings(
      Duration.ofHours(1), Duration.ofSeconds(30), Duration.ofSeconds(2), Duration.ofMinutes(5));

  private final ManualClock clock = new ManualClock();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final List<ConnectionEvent> events = new CopyOnWriteArrayList<>();
  private final List<Throwable> errors = new CopyOnWriteArrayList<>();
  private final FakeSource source = new FakeSource();

  @Test
  void reportsNewPublicConnectionsOnceAndSkipsLocalPeers() {
    source.entries.add(socket("93.184.216.34", 443, "ESTABLISHED", 1200));
    source.entries.add(socket("93.184.216.34", 443, "ESTABLISHED", 1200));
    source.entries.add(socket("192.168.1.10", 443, "ESTABLISHED", 1200));
    source.entries.add(socket("127.0.0.1", 8080, "ESTABLISHED", 1200));
    source.entries.add(socket("0.0.0.0", 0, "LISTEN", 1));
    ConnectionSampler sampler = sampler();

    List<ConnectionEvent> first = sampler.sampleOnce();
    List<ConnectionEvent> second = sampler.sampleOnce();

    assertEquals(1, first.size());
    ConnectionEvent opened = first.get(0);
    assertEquals(ConnectionEvent.Type.OPENED, opened.type());
    assertEquals("example.test", opened.connection().remoteHost());
    assertEquals("firefox", opened.connection().processName());
    assertTrue(second.isEmpty());
    assertEquals(first, events);
    assertEquals(1, sampler.activeConnections());
    assertEquals(1, sampler.connectionsObserved());
  }

  @Test
  void closesConnectionsAbsentLongerThanIdleTimeout() {
    source.entries.add(socket("93.184.216.34", 443, "ESTABLISHED", 1200));
    ConnectionSampler sampler = sampler();
    sampler.sampleOnce();

    source.entries.clear();
    clock.advance(Duration.ofSeconds(20));
    assertTrue(sampler.sampleOnce().isEmpty());

    clock.advance(Duration.ofSeconds(15));
    List<ConnectionEvent> closed = sampler.sampleOnce();

    assertEquals(1, closed.size());
    assertEquals(ConnectionEvent.Type.CLOSED, closed.get(0).type());
    assertEquals(0, sampler.activeConnections());
    assertEquals(1, metrics.count("sampler.connections.closed"));
  }

  @Test
  void refreshesLastSeenForConnectionsStillPresent() {
    source.entries.add(socket("93.184.216.34", 443, "ESTABLISHED", 1200));
    ConnectionSampler sampler = sampler();
    sampler.sampleOnce();
    clock.advance(Duration.ofSeconds(25));
    sampler.sampleOnce();
    source.entries.clear();
    clock.advance(Duration.ofSeconds(25));

    assertTrue(sampler.sampleOnce().isEmpty());
    Connection tracked = sampler.snapshot().get(0);
    assertEquals(clock.now().minusSeconds(25), tracked.lastSeen());
  }

  @Test
  void enumerationFailureIsRecordedAndPassEmitsNothing() {
    source.failure = new IOException("permission denied reading /proc/net/tcp");
    ConnectionSampler sampler = sampler();

    assertTrue(sampler.sampleOnce().isEmpty());

    assertEquals(1, errors.size());
    assertEquals(1, metrics.count("sampler.pass.error"));
  }

  @Test
  void listenerFailureDoesNotStopOtherEvents() {
    source.entries.add(socket("93.184.216.34", 443, "ESTABLISHED", 1));
    source.entries.add(socket("93.184.216.35", 443, "ESTABLISHED", 2));
    List<ConnectionEvent> delivered = new ArrayList<>();
    ConnectionSampler sampler = new ConnectionSampler(source, address -> address, event -> {
      if (event.connection().pid() == 1) {
        throw new IllegalStateException("listener broke");
      }
      delivered.add(event);
    }, (stage, domain, error) -> errors.add(error), clock, metrics, SETTINGS);

    assertEquals(2, sampler.sampleOnce().size());
    assertEquals(1, delivered.size());
    assertEquals(1, metrics.count("sampler.listener.error"));
  }

  @Test
  void slowEnumerationTimesOutWhileRunning() throws Exception {
    CountDownLatch recorded = new CountDownLatch(1);
    CountDownLatch never = new CountDownLatch(1);
    ConnectionSource blocking = () -> {
      try {
        never.await();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      return List.of();
    };
    SamplerSettings fast = new SamplerSettings(
        Duration.ofHours(1), Duration.ofSeconds(30), Duration.ofMillis(50), Duration.ofMinutes(5));
    ConnectionSampler sampler = new ConnectionSampler(blocking, address -> address, events::add,
        (stage, domain, error) -> {
          errors.add(error);
          recorded.countDown();
        }, clock, metrics, fast);

    sampler.start();
    try {
      assertTrue(recorded.await(5, TimeUnit.SECONDS));
    } finally {
      sampler.stop();
    }

    assertInstanceOf(CaptureTimeoutException.class, errors.get(0));
    assertEquals(1, metrics.count("sampler.pass.timeout"));
    assertFalse(sampler.isRunning());
  }

  @Test
  void slowReverseLookupFallsBackToAddressWithinBudget() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    source.entries.add(socket("93.184.216.34", 443, "ESTABLISHED", 1200));
    source.entries.add(socket("203.0.113.9", 443, "ESTABLISHED", 1200));
    SamplerSettings fast = new SamplerSettings(
        Duration.ofHours(1), Duration.ofSeconds(30), Duration.ofMillis(100), Duration.ofMinutes(5));
    ConnectionSampler sampler = new ConnectionSampler(source, address -> {
      if (address.equals("203.0.113.9")) {
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
        return "stuck.example";
      }
      return "casino.example";
    }, events::add, (stage, domain, error) -> errors.add(error), clock, metrics, fast);

    try {
      long started = System.nanoTime();
      List<ConnectionEvent> opened = sampler.sampleOnce();
      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

      assertTrue(elapsedMillis < 2_000, "pass took " + elapsedMillis + " ms");
      assertEquals(2, opened.size());
      assertEquals("casino.example", opened.get(0).connection().remoteHost());
      assertEquals("203.0.113.9", opened.get(1).connection().remoteHost());
      assertEquals(1, metrics.count("sampler.resolve.timeout"));
      assertTrue(errors.isEmpty());
    } finally {
      release.countDown();
      sampler.close();
    }
  }

  private ConnectionSampler sampler() {
    return new ConnectionSampler(source, address -> "example.test", events::add,
        (stage, domain, error) -> errors.add(error), clock, metrics, SETTINGS);
  }

  private static SocketEntry socket(String remote, int port, String state, int pid) {
    return new SocketEntry("tcp", "10.0.0.2", 51000, remote, port, state, pid, "firefox");
  }

  private static final class FakeSource implements ConnectionSource {
    final List<SocketEntry> entries = new ArrayList<>();
    IOException failure;

    @Override
    public List<SocketEntry> enumerate() throws IOException {
      if (failure != null) {
        throw failure;
      }
      return List.copyOf(entries);
    }
  }
}
