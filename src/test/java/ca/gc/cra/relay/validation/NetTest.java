package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsHostnamesAndLiterals() {
    assertEquals("jira.domain.com", Net.validateHost("targetHost", " jira.domain.com "));
    assertEquals("10.0.0.5", Net.validateHost("targetHost", "10.0.0.5"));
    assertEquals("::1", Net.validateHost("listenAddress", "[::1]"));
    assertEquals("fe80::1", Net.validateHost("listenAddress", "fe80::1"));
  }

  @Test
  void rejectsMalformedHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetHost", "300.1.1.1"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetHost", "-bad.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetHost", "under_score.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetHost", "trailing."));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetHost", "[12345::1]"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetHost", ""));
  }

  @Test
  void portsMustBeInRange() {
    assertEquals(443, Net.validatePort("targetPort", "443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("targetPort", "0"));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("targetPort", "65536"));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("targetPort", "https"));
  }
}
