package ca.gc.cra.netprov.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"devices=leaf1,leaf2", "timeout.commitMs=5000", "otelResourceAttributes=env=lab"});

    assertEquals(List.of("devices", "timeout.commitMs", "otelResourceAttributes"), List.copyOf(map.keySet()));
    assertEquals("leaf1,leaf2", map.get("devices"));
    assertEquals("env=lab", map.get("otelResourceAttributes"));
  }

  @Test
  void allowsEmptyValueAndSkipsBlankArgs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelEndpoint=", " ", null});

    assertEquals(Map.of("otelEndpoint", ""), map);
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"leaf1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=leaf1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"dev ices=leaf1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"devices=a\u0007"}));
  }

  @Test
  void rejectsControlCharactersAnywhereInValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"devices=\u0007a"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"devices=a\u0000b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"devices=leaf1\u001b"}));
    assertEquals(Map.of("devices", "leaf1"), CliArgsParser.toMap(new String[] {" devices=leaf1 \n"}));
  }

  @Test
  void rejectsDuplicateKeys() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"devices=leaf1", "devices=leaf2"}));
  }
}
