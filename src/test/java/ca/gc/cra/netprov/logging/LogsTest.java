package ca.gc.cra.netprov.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("+vlan 10", Logs.truncate("+vlan 10", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void truncateReportsOriginalLength() {
    assertEquals("abc... (truncated, 3 of 6 bytes)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncateDropsPartialCodepoint() {
    assertEquals("a... (truncated, 2 of 4 bytes)", Logs.truncate("a\u00e9b", 2));
  }

  @Test
  void previewKeepsFirstLines() {
    assertEquals("hostname leaf1\nvlan 10\n...", Logs.preview("hostname leaf1\nvlan 10\nvlan 20", 2));
    assertEquals("hostname leaf1", Logs.preview("hostname leaf1", 2));
    assertThrows(IllegalArgumentException.class, () -> Logs.preview("x", 0));
  }

  @Test
  void redactNeverEchoesValue() {
    assertEquals("<hidden>", Logs.redact("s3cret"));
  }
}
