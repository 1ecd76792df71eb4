package ca.gc.cra.textpipe.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for database, lexicon, and batch input paths.
 * <p><strong>Why:</strong> Surfaces unusable paths as configuration errors before the pipeline is assembled.
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> Emits no logs; exception messages include offending paths.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a database file location, creating missing parent directories.
   *
   * @param path candidate database file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory, or its parent cannot be created or written
   */
  public static Path validateDatabaseFile(Path path) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("database path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("database file is not writable: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("database path has no parent directory: " + normalized);
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("directory is not writable: " + parent);
    }
    return normalized;
  }

  /**
   * Validates that a path names an existing readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not regular, or not readable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
