package ca.gc.cra.dfmet.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the convert CLI.
 * <p><strong>Why:</strong> Fails fast on unreadable inputs, unwritable output directories and accidental overwrites
 * before any log is decoded.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths.</li>
 *   <li>Verify the input log is a readable regular file.</li>
 *   <li>Verify (or create) the output directory and refuse to replace existing outputs unless allowed.</li>
 * </ul>
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
   * Validates an input file.
   *
   * @param path candidate input file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is missing, not a regular file or not readable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("input file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output directory.
   *
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Guards an output file against accidental replacement.
   *
   * @param file planned output file
   * @param allowOverwrite whether replacing an existing file is permitted
   * @return the file
   * @throws IllegalArgumentException if the file exists and {@code allowOverwrite} is {@code false}
   */
  public static Path requireAbsentOrOverwritable(Path file, boolean allowOverwrite) {
    if (!allowOverwrite && Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(
          "output " + file + " already exists; re-run with --allow-overwrite to replace it");
    }
    return file;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
