package ca.gc.cra.dfmet.application.port;

import ca.gc.cra.dfmet.validation.Strings;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how a {@link TableWriter} places its file.
 *
 * @param directory output directory
 * @param baseName file name without extension; each writer appends its own
 * @param sourceName name of the input log, recorded as provenance
 * @param allowOverwrite whether an existing output file may be replaced
 * @since 0.1.0
 */
public record OutputTarget(Path directory, String baseName, String sourceName, boolean allowOverwrite) {

  /** Validates components. */
  public OutputTarget {
    Objects.requireNonNull(directory, "directory");
    baseName = Strings.requireNonBlank("baseName", baseName);
    sourceName = Objects.requireNonNullElse(sourceName, baseName);
  }

  /**
   * Resolves the output file for an extension.
   *
   * @param extension extension without the dot (e.g., {@code txt})
   * @return {@code directory/baseName.extension}
   */
  public Path resolve(String extension) {
    return directory.resolve(baseName + "." + extension);
  }
}
