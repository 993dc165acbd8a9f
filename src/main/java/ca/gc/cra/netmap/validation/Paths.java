package ca.gc.cra.netmap.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Filesystem path validation for the store file and CLI output targets.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} names a regular file (existing or not) whose parent directory
   * exists or can be created and is writable.
   *
   * @param path candidate file path
   * @param createParents whether missing parent directories should be created
   * @return absolute, normalized path
   * @throws IllegalArgumentException when the path is unusable
   */
  public static Path validateWritableFile(Path path, boolean createParents) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is a directory, expected a file: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("file is not writable: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent)) {
        if (!createParents) {
          throw new IllegalArgumentException("parent directory does not exist: " + parent);
        }
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  /**
   * Validates that {@code path} names an existing readable regular file.
   *
   * @param path candidate file path
   * @return absolute, normalized path
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
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
