package ca.gc.cra.netprov.infrastructure.intent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netprov.application.port.IntendedConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileIntendedConfigAdapterTest {
  @TempDir
  Path dir;

  @Test
  void readsConfigAndModificationTime() throws Exception {
    Path file = dir.resolve("leaf1.cfg");
    Files.writeString(file, "hostname leaf1\nvlan 10\n", StandardCharsets.UTF_8);
    Instant modified = Instant.parse("2024-05-01T12:00:00Z");
    Files.setLastModifiedTime(file, FileTime.from(modified));

    IntendedConfig config = new FileIntendedConfigAdapter(dir).intendedConfig("leaf1").orElseThrow();

    assertEquals("hostname leaf1\nvlan 10\n", config.text());
    assertEquals(modified, config.lastUpdated().orElseThrow());
  }

  @Test
  void missingOrBlankFileMeansNoIntendedConfig() throws Exception {
    Files.writeString(dir.resolve("leaf2.cfg"), " \n\t\n", StandardCharsets.UTF_8);
    FileIntendedConfigAdapter adapter = new FileIntendedConfigAdapter(dir);

    assertTrue(adapter.intendedConfig("leaf1").isEmpty());
    assertTrue(adapter.intendedConfig("leaf2").isEmpty());
  }

  @Test
  void rejectsNamesEscapingTheDirectory() {
    FileIntendedConfigAdapter adapter = new FileIntendedConfigAdapter(dir);

    assertThrows(IllegalArgumentException.class, () -> adapter.intendedConfig("../etc/passwd"));
    assertThrows(IllegalArgumentException.class, () -> adapter.intendedConfig("a/b"));
    assertThrows(IllegalArgumentException.class, () -> adapter.intendedConfig(" "));
  }
}
