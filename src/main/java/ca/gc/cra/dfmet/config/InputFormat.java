package ca.gc.cra.dfmet.config;

import ca.gc.cra.dfmet.util.PathUtils;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Input log encodings understood by the converter.
 *
 * @since 0.1.0
 */
public enum InputFormat {
  /** Choose from the file extension. */
  AUTO,
  /** ArduPilot DataFlash binary log. */
  DATAFLASH,
  /** Newline-delimited JSON, one decoded message per line. */
  NDJSON;

  /**
   * Parses a string into an {@link InputFormat}, defaulting to {@link #AUTO} when blank.
   *
   * @param value textual representation such as {@code "ndjson"}
   * @return parsed format
   * @throws IllegalArgumentException if the string does not match a known format
   */
  public static InputFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return AUTO;
    }
    try {
      return InputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown inputFormat: " + value, ex);
    }
  }

  /**
   * Resolves {@link #AUTO} against an input file name.
   *
   * @param input input log
   * @return a concrete format; {@code .json}, {@code .jsonl} and {@code .ndjson} are NDJSON, anything else DataFlash
   */
  public InputFormat resolve(Path input) {
    if (this != AUTO) {
      return this;
    }
    String extension = PathUtils.extension(input).orElse("");
    return switch (extension) {
      case "json", "jsonl", "ndjson" -> NDJSON;
      default -> DATAFLASH;
    };
  }
}
