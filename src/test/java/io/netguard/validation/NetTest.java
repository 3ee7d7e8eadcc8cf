package io.netguard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void normalizeDomainStripsSchemePathPortAndWww() {
    assertEquals("casino.example", Net.normalizeDomain("https://WWW.Casino.Example:8443/slots?x=1"));
    assertEquals("casino.example", Net.normalizeDomain("casino.example:443"));
    assertEquals("casino.example", Net.normalizeDomain("Casino.Example./lobby"));
    assertEquals("www.example", Net.normalizeDomain("www.example"));
  }

  @Test
  void normalizeDomainAcceptsIpv4Literals() {
    assertEquals("203.0.113.9", Net.normalizeDomain("203.0.113.9"));
    assertThrows(IllegalArgumentException.class, () -> Net.normalizeDomain("300.0.113.9"));
  }

  @Test
  void normalizeDomainRejectsBlankAndMalformedHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.normalizeDomain("  "));
    assertThrows(IllegalArgumentException.class, () -> Net.normalizeDomain("-bad-.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.normalizeDomain("bad host.example"));
  }

  @Test
  void hostOfRequiresHost() {
    assertEquals("poker.example", Net.hostOf("http://Poker.Example/path"));
    assertThrows(IllegalArgumentException.class, () -> Net.hostOf("mailto:someone"));
  }

  @Test
  void isPublicAddressRejectsLocalRanges() {
    assertTrue(Net.isPublicAddress("203.0.113.9"));
    assertTrue(Net.isPublicAddress("2001:db8::1"));
    assertFalse(Net.isPublicAddress("127.0.0.1"));
    assertFalse(Net.isPublicAddress("10.1.2.3"));
    assertFalse(Net.isPublicAddress("192.168.1.1"));
    assertFalse(Net.isPublicAddress("169.254.1.1"));
    assertFalse(Net.isPublicAddress("0.0.0.0"));
    assertFalse(Net.isPublicAddress("::1"));
    assertFalse(Net.isPublicAddress("fd00::1"));
    assertFalse(Net.isPublicAddress("casino.example"));
    assertFalse(Net.isPublicAddress(null));
  }
}
