package io.netguard.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netguard.application.enforcement.ManagedRegion;
import io.netguard.application.port.MetricsPort;
import io.netguard.config.CompositionRoot;
import io.netguard.config.NetGuardConfig;
import io.netguard.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SitesCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private Path hosts;

  @BeforeEach
  void setUp() throws IOException {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    hosts = tempDir.resolve("hosts");
    Files.writeString(hosts, "127.0.0.1 localhost\n");
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void blockWritesHostsFileAndListShowsEntry() throws IOException {
    assertEquals(ExitCode.SUCCESS, run("block", "domain=WWW.Casino.Example", "reason=operator report"));

    String content = Files.readString(hosts);
    assertTrue(content.startsWith("127.0.0.1 localhost\n"));
    assertTrue(content.contains(ManagedRegion.BEGIN_MARKER));
    assertTrue(content.contains("127.0.0.1 casino.example"));
    assertTrue(content.contains("127.0.0.1 www.casino.example"));
    assertTrue(buffer.toString().contains("Blocked casino.example (operator report)"));

    buffer.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS, run("list"));
    assertTrue(buffer.toString().contains("casino.example"));
    assertTrue(buffer.toString().contains("1 blocked site(s) listed"));
  }

  @Test
  void unblockRemovesHostsEntryAndAllowLists() throws IOException {
    run("block", "domain=casino.example");
    buffer.getBuffer().setLength(0);

    assertEquals(ExitCode.SUCCESS, run("unblock", "domain=casino.example"));

    assertFalse(Files.readString(hosts).contains("casino.example"));
    assertTrue(buffer.toString().contains("Unblocked casino.example and added it to the allow list"));

    buffer.getBuffer().setLength(0);
    run("list", "--all");
    assertTrue(buffer.toString().contains("inactive"));
    assertTrue(buffer.toString().matches("(?s).*casino\\.example\\s+allowed.*"));
  }

  @Test
  void exportThenImportIntoFreshDataDirectory() throws IOException {
    run("block", "domain=casino.example");
    run("unblock", "domain=news.example");
    Path export = tempDir.resolve("sites.json");
    assertEquals(ExitCode.SUCCESS, run("export", "file=" + export));
    assertTrue(Files.exists(export));

    Path otherData = tempDir.resolve("other");
    Path otherHosts = tempDir.resolve("other-hosts");
    buffer.getBuffer().setLength(0);
    ExitCode code = SitesCli.run(new String[] {
        "import", "file=" + export, "dataDir=" + otherData, "hostsFile=" + otherHosts, "metricsExporter=none"},
        SitesCliTest::root);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Imported 1 block list entries and 1 allow list entries"));
    assertTrue(Files.readString(otherHosts).contains("127.0.0.1 casino.example"));
  }

  @Test
  void missingDomainIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, run("block"));
    assertTrue(buffer.toString().contains("usage: netguard sites"));
  }

  @Test
  void invalidDomainIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, run("block", "domain=bad_host!"));
  }

  @Test
  void unknownActionIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, run("purge"));
  }

  @Test
  void reconcileOnCleanStateReportsUpToDate() {
    assertEquals(ExitCode.SUCCESS, run("reconcile"));
    assertTrue(buffer.toString().contains("Hosts file already up to date"));
  }

  private ExitCode run(String... args) {
    List<String> all = new ArrayList<>(Arrays.asList(args));
    all.add("dataDir=" + tempDir.resolve("data"));
    all.add("hostsFile=" + hosts);
    all.add("metricsExporter=none");
    return SitesCli.run(all.toArray(String[]::new), SitesCliTest::root);
  }

  static CompositionRoot root(NetGuardConfig config) {
    return new CompositionRoot(config, MetricsPort.NO_OP, new SystemClockAdapter());
  }
}
