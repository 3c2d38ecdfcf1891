package ca.gc.cra.dfmet.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name without its last extension ({@code flight.BIN} becomes {@code flight}).
   *
   * @param path source path; may be {@code null}
   * @return optional base name; a name that is only an extension (e.g., {@code .bin}) is returned unchanged
   */
  public static Optional<String> baseName(Path path) {
    return fileName(path).map(name -> {
      int dot = name.lastIndexOf('.');
      return dot > 0 ? name.substring(0, dot) : name;
    });
  }

  /**
   * Returns the lowercase extension of the file name.
   *
   * @param path source path; may be {@code null}
   * @return optional extension without the dot; empty when there is none
   */
  public static Optional<String> extension(Path path) {
    return fileName(path).flatMap(name -> {
      int dot = name.lastIndexOf('.');
      if (dot <= 0 || dot == name.length() - 1) {
        return Optional.empty();
      }
      return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    });
  }
}
