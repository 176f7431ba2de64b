package ca.gc.cra.netprov.infrastructure.intent;

import ca.gc.cra.netprov.application.port.IntendedConfig;
import ca.gc.cra.netprov.application.port.IntendedConfigPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads intended configurations from {@code <directory>/<device>.cfg}.
 *
 * <p>A missing or blank file means no intended configuration. The file modification time is reported as the
 * last-updated instant. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FileIntendedConfigAdapter implements IntendedConfigPort {
  static final String SUFFIX = ".cfg";
  private static final Logger log = LoggerFactory.getLogger(FileIntendedConfigAdapter.class);

  private final Path directory;

  /**
   * Creates an adapter rooted at {@code directory}.
   *
   * @param directory directory holding one file per device
   */
  public FileIntendedConfigAdapter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public Optional<IntendedConfig> intendedConfig(String deviceName) throws IOException {
    Objects.requireNonNull(deviceName, "deviceName");
    if (deviceName.isBlank() || deviceName.contains("/") || deviceName.contains("\\")
        || deviceName.contains("..")) {
      throw new IllegalArgumentException("device name is not usable as a file name: " + deviceName);
    }
    Path file = directory.resolve(deviceName + SUFFIX);
    if (!Files.isRegularFile(file)) {
      log.debug("No intended configuration file for {} at {}", deviceName, file);
      return Optional.empty();
    }
    String text = Files.readString(file, StandardCharsets.UTF_8);
    if (text.isBlank()) {
      log.debug("Intended configuration file for {} is blank", deviceName);
      return Optional.empty();
    }
    return Optional.of(new IntendedConfig(text, Optional.of(Files.getLastModifiedTime(file).toInstant())));
  }
}
