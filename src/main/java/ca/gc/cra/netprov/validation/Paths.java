package ca.gc.cra.netprov.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Path validation for files and directories NETPROV reads (inventory, intended
 * configurations, secret files).
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} names an existing, readable regular file.
   *
   * @param name logical name for diagnostics
   * @param path candidate path
   * @return canonical path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path real = canonical(name, path);
    if (!Files.isRegularFile(real)) {
      throw new IllegalArgumentException(name + " must be a regular file: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }

  /**
   * Ensures {@code path} names an existing, readable directory.
   *
   * @param name logical name for diagnostics
   * @param path candidate path
   * @return canonical path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path real = canonical(name, path);
    if (!Files.isDirectory(real)) {
      throw new IllegalArgumentException(name + " must be a directory: " + path);
    }
    if (!Files.isReadable(real)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return real;
  }

  private static Path canonical(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    try {
      return path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to access " + name + ": " + path, ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
