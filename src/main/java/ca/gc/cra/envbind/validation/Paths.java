package ca.gc.cra.envbind.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for input files named on the command line.
 * <p><strong>Role:</strong> Support utility executed before sources open {@code KEY=VALUE} or YAML files.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, holds control characters, is not a regular file
   *     or is not readable
   */
  public static Path requireReadableFile(String name, Path path) {
    String label = name == null || name.isBlank() ? "path" : name;
    if (path == null) {
      throw new IllegalArgumentException(label + " must not be null");
    }
    if (containsControl(path.toString())) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(label + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(label + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(label + " is not readable: " + normalized);
    }
    return normalized;
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
