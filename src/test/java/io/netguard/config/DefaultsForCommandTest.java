package io.netguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForCommandTest {

  @Test
  void monitorDefaultsIncludeSamplerAndProxyKeys() {
    Map<String, String> defaults = DefaultsForCommand.asFlatMap("monitor");

    assertEquals("127.0.0.1", defaults.get("proxyHost"));
    assertEquals("false", defaults.get("allowRemoteProxy"));
    assertTrue(defaults.containsKey("pollIntervalMs"));
    assertEquals("otlp", defaults.get("metricsExporter"));
  }

  @Test
  void otherCommandsOnlyCarryCommonKeys() {
    Map<String, String> sites = DefaultsForCommand.asFlatMap("Sites");

    assertTrue(sites.containsKey("dataDir"));
    assertFalse(sites.containsKey("pollIntervalMs"));
    assertEquals("30", DefaultsForCommand.asFlatMap("cleanup").get("retentionDays"));
  }

  @Test
  void defaultsParseBackIntoConfig() {
    NetGuardConfig config = NetGuardConfig.fromMap(DefaultsForCommand.asFlatMap("monitor"));

    assertEquals(NetGuardConfig.defaults(), config);
  }

  @Test
  void unknownCommandIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForCommand.asFlatMap("capture"));
  }
}
