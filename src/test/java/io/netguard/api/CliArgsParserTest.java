package io.netguard.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"domain=casino.example", " reason = promo page "});
    assertEquals("casino.example", map.get("domain"));
    assertEquals("promo page", map.get("reason"));
  }

  @Test
  void splitsOnFirstEqualsAndKeepsLastDuplicate() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"url=https://a.example/?q=1", "limit=5", "limit=9"});
    assertEquals("https://a.example/?q=1", map.get("url"));
    assertEquals("9", map.get("limit"));
  }

  @Test
  void emptyValueIsKeptToClearYamlSetting() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"lexicon="});
    assertTrue(map.containsKey("lexicon"));
    assertEquals("", map.get("lexicon"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"block"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"reason=a\u0007b"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
