package io.netguard.testing;

import io.netguard.application.error.PermissionDeniedException;
import io.netguard.application.port.OverrideTable;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;

/** Override table held in memory; can be switched to refuse writes like an unprivileged hosts file. */
public final class InMemoryOverrideTable implements OverrideTable {
  private volatile String content;
  private volatile boolean denyWrites;
  private volatile int writes;

  public InMemoryOverrideTable(String initial) {
    this.content = initial;
  }

  public InMemoryOverrideTable() {
    this("127.0.0.1 localhost\n");
  }

  @Override
  public String read() {
    return content;
  }

  @Override
  public synchronized void write(String updated) throws PermissionDeniedException {
    if (denyWrites) {
      throw new PermissionDeniedException(Path.of("hosts"), new AccessDeniedException("hosts"));
    }
    content = updated;
    writes++;
  }

  @Override
  public String describe() {
    return "in-memory hosts";
  }

  public String content() {
    return content;
  }

  public int writes() {
    return writes;
  }

  public void denyWrites(boolean deny) {
    this.denyWrites = deny;
  }
}
