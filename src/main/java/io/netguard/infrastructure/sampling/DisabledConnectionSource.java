package io.netguard.infrastructure.sampling;

import io.netguard.application.port.ConnectionSource;
import io.netguard.domain.net.SocketEntry;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection source for platforms without a supported socket table; reports nothing.
 *
 * @since 0.1.0
 */
public final class DisabledConnectionSource implements ConnectionSource {
  private static final Logger log = LoggerFactory.getLogger(DisabledConnectionSource.class);

  private final String reason;
  private final AtomicBoolean warned = new AtomicBoolean();

  public DisabledConnectionSource(String reason) {
    this.reason = reason == null || reason.isBlank() ? "unsupported platform" : reason;
  }

  @Override
  public List<SocketEntry> enumerate() {
    if (warned.compareAndSet(false, true)) {
      log.warn("Connection sampling disabled: {}", reason);
    }
    return List.of();
  }

  @Override
  public String name() {
    return "disabled(" + reason + ")";
  }
}
