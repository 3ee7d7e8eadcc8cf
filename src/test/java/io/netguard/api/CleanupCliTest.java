package io.netguard.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CleanupCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void keepsDetectionsOfActiveBlocks() {
    SitesCli.run(new String[] {"block", "domain=casino.example", "dataDir=" + tempDir, "hostsFile="
        + tempDir.resolve("hosts"), "metricsExporter=none"}, SitesCliTest::root);
    buffer.getBuffer().setLength(0);

    ExitCode code = CleanupCli.run(new String[] {"retentionDays=0", "dataDir=" + tempDir,
        "hostsFile=" + tempDir.resolve("hosts"), "metricsExporter=none"}, SitesCliTest::root);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Removed 1 audit entries and 0 captured transactions older than 0 day(s)"),
        buffer.toString());
  }

  @Test
  void retentionOutOfRangeIsInvalidArgs() {
    ExitCode code = CleanupCli.run(new String[] {"retentionDays=5000", "dataDir=" + tempDir}, SitesCliTest::root);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: netguard cleanup"));
  }

  @Test
  void strayActionIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, CleanupCli.run(new String[] {"now"}, SitesCliTest::root));
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, CleanupCli.run(new String[] {"--help"}, SitesCliTest::root));
    assertTrue(buffer.toString().contains("retentionDays=N"));
  }
}
