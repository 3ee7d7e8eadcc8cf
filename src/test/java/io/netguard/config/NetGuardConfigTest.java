package io.netguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetGuardConfigTest {

  @TempDir Path tempDir;

  @Test
  void defaultsUseLoopbackProxyAndRedirect() {
    NetGuardConfig config = NetGuardConfig.defaults();

    assertEquals("127.0.0.1", config.redirectAddress());
    assertEquals("127.0.0.1", config.proxyAddress().getHostString());
    assertEquals(8080, config.proxyAddress().getPort());
    assertTrue(config.dataDir().endsWith(".netguard"));
    assertEquals(config.dataDir().resolve("ca"), config.caDir());
    assertEquals(config.dataDir().resolve("audit"), config.auditDir());
    assertFalse(config.lexiconFile().isPresent());
  }

  @Test
  void fromMapParsesOverrides() {
    Map<String, String> kv = new HashMap<>();
    kv.put("dataDir", tempDir.toString());
    kv.put("hostsFile", tempDir.resolve("hosts").toString());
    kv.put("redirectAddress", "0.0.0.0");
    kv.put("pollIntervalMs", "2500");
    kv.put("enumerationTimeoutMs", "500");
    kv.put("reanalysisWindowSec", "60");
    kv.put("laneCount", "4");
    kv.put("laneCapacity", "32");
    kv.put("reconcileIntervalMs", "15000");
    kv.put("observeBand", "0.2");
    kv.put("proxyPort", "8899");
    kv.put("transactionMaxAgeMin", "5");
    kv.put("lexicon", tempDir.resolve("lexicon.yaml").toString());

    NetGuardConfig config = NetGuardConfig.fromMap(kv);

    assertEquals(tempDir.toAbsolutePath().normalize(), config.dataDir());
    assertEquals("0.0.0.0", config.redirectAddress());
    assertEquals(Duration.ofMillis(2500), config.sampler().pollInterval());
    assertEquals(Duration.ofMillis(500), config.sampler().enumerationTimeout());
    assertEquals(Duration.ofSeconds(60), config.sampler().reanalysisWindow());
    assertEquals(4, config.pipeline().laneCount());
    assertEquals(32, config.pipeline().laneCapacity());
    assertEquals(Duration.ofSeconds(15), config.reconcileInterval());
    assertEquals(0.2, config.observeBand(), 1e-9);
    assertEquals(8899, config.proxyAddress().getPort());
    assertEquals(Duration.ofMinutes(5), config.transactionMaxAge());
    assertTrue(config.lexiconFile().isPresent());
    assertFalse(config.seedCorpusFile().isPresent());
    assertEquals("0.0.0.0", config.monitorOptions().redirectAddress());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    NetGuardConfig config = NetGuardConfig.fromMap(Map.of("laneCount", " ", "lexicon", ""));

    assertEquals(NetGuardConfig.defaults().pipeline().laneCount(), config.pipeline().laneCount());
    assertFalse(config.lexiconFile().isPresent());
  }

  @Test
  void publicRedirectAddressIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> NetGuardConfig.fromMap(Map.of("redirectAddress", "93.184.216.34")));

    assertTrue(ex.getMessage().contains("redirectAddress"));
  }

  @Test
  void malformedAndOutOfRangeValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> NetGuardConfig.fromMap(Map.of("pollIntervalMs", "soon")));
    assertThrows(IllegalArgumentException.class, () -> NetGuardConfig.fromMap(Map.of("laneCount", "0")));
    assertThrows(IllegalArgumentException.class, () -> NetGuardConfig.fromMap(Map.of("proxyPort", "70000")));
    assertThrows(IllegalArgumentException.class, () -> NetGuardConfig.fromMap(Map.of("observeBand", "1.5")));
  }

  @Test
  void toStringRedactsCaPassword() {
    NetGuardConfig config = NetGuardConfig.fromMap(Map.of("caPassword", "s3cret-pass"));

    assertEquals("s3cret-pass", config.caPassword());
    assertFalse(config.toString().contains("s3cret-pass"));
    assertTrue(config.toString().contains("[REDACTED]"));
  }
}
