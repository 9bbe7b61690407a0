package ca.gc.cra.bulk.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsHostnamesAndIpv4() {
    assertEquals("broker-1.example.com:9092", Net.validateHostPort("broker-1.example.com:9092"));
    assertEquals("10.0.0.1:19092", Net.validateHostPort(" 10.0.0.1:19092 "));
    assertEquals("a:1,b:2", Net.validateBootstrapServers("a:1,b:2"));
  }

  @Test
  void rejectsMalformedEndpoints() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:0"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("300.1.1.1:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("::1:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("bad_host:9092"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBootstrapServers("a:1,,b:2"));
  }
}
