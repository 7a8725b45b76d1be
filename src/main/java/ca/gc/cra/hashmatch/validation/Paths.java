package ca.gc.cra.hashmatch.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks run before the pipeline opens its input or writes its report.
 * <p><strong>Why:</strong> Surfaces a missing input or an unwritable results location as a configuration error
 * instead of discovering it after every candidate has been digested.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is an existing, readable regular file.
   *
   * @param name label used in error messages
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " file not found: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("no read permission for " + name + " file: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that {@code path} can be written, creating missing parent directories when asked.
   *
   * @param name label used in error messages
   * @param path target file
   * @param createParents whether to create the parent directories
   * @param allowOverwrite whether an existing file may be replaced
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file exists without {@code allowOverwrite}, is a directory, or its
   *     parent is not a writable directory
   */
  public static Path validateWritableFile(String name, Path path, boolean createParents, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " must be a file, not a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " file is not writable: " + normalized);
      }
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    try {
      if (!Files.exists(parent) && createParents) {
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to create parent directory for " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
    Path existing = nearestExistingAncestor(parent);
    if (!Files.isDirectory(existing)) {
      throw new IllegalArgumentException("parent of " + name + " is not a directory: " + existing);
    }
    if (!Files.isWritable(existing)) {
      throw new IllegalArgumentException("parent directory of " + name + " is not writable: " + existing);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " path must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException(name + " path must not be blank");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path nearestExistingAncestor(Path start) {
    Path current = start;
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current;
  }
}
