package io.netguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigMergerTest {

  @TempDir Path tempDir;

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("laneCount", "2", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("laneCount", "4", "dataDir", "/srv/netguard");
    Map<String, String> cli = Map.of("laneCount", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "monitor",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("8", merged.get("laneCount"));
    assertEquals("/srv/netguard", merged.get("dataDir"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: laneCount"), warnings);
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "sites",
            Optional.empty(),
            Map.of("metricsExporter", "prometheus"),
            Map.of(),
            msg -> {}));
  }

  @Test
  void enumerationTimeoutMayNotExceedPollInterval() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "monitor",
            Optional.of(Map.of("pollIntervalMs", "1000")),
            Map.of("enumerationTimeoutMs", "5000"),
            Map.of(),
            msg -> {}));

    assertTrue(ex.getMessage().contains("enumerationTimeoutMs"));
  }

  @Test
  void hostsFileMustNotBeDirectory() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "sites",
            Optional.empty(),
            Map.of("hostsFile", tempDir.toString()),
            Map.of(),
            msg -> {}));
  }

  @Test
  void remoteProxyRequiresAcknowledgement() {
    Map<String, String> cli = Map.of("proxyHost", "0.0.0.0");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("monitor", Optional.empty(), cli, Map.of(), msg -> {}));

    Map<String, String> acknowledged = ConfigMerger.buildEffectiveConfig(
        "monitor",
        Optional.empty(),
        Map.of("proxyHost", "0.0.0.0", "allowRemoteProxy", "true"),
        Map.of(),
        msg -> {});
    assertEquals("0.0.0.0", acknowledged.get("proxyHost"));
  }

  @Test
  void proxyRuleOnlyAppliesToMonitor() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "sites",
        Optional.empty(),
        Map.of("proxyHost", "10.0.0.5"),
        null,
        null);

    assertEquals("10.0.0.5", merged.get("proxyHost"));
  }
}
