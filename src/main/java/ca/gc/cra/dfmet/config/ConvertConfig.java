package ca.gc.cra.dfmet.config;

import ca.gc.cra.dfmet.application.engine.EngineSettings;
import ca.gc.cra.dfmet.application.port.OutputTarget;
import ca.gc.cra.dfmet.domain.met.MovingAverage;
import ca.gc.cra.dfmet.util.PathUtils;
import ca.gc.cra.dfmet.validation.Numbers;
import ca.gc.cra.dfmet.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for one {@code convert} run.
 * <p><strong>Why:</strong> Gives the CLI and composition root one immutable view of the merged defaults, YAML and
 * command-line values.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input input log
 * @param outputDirectory directory receiving the outputs; defaults to the input's directory
 * @param baseName output file name without extension; defaults to the input's base name
 * @param inputFormat input encoding, possibly {@link InputFormat#AUTO}
 * @param positionRangeCheck blank out-of-range position fixes
 * @param smoothingWindow odd air-temperature smoothing width
 * @param gpsLeapSeconds GPS minus UTC offset used to anchor DataFlash clocks
 * @param textOutput write the text table
 * @param netcdfOutput write the NetCDF file
 * @param allowOverwrite replace existing outputs
 * @param dryRun validate and print the plan only
 * @since 0.1.0
 */
public record ConvertConfig(
    Path input,
    Path outputDirectory,
    String baseName,
    InputFormat inputFormat,
    boolean positionRangeCheck,
    int smoothingWindow,
    int gpsLeapSeconds,
    boolean textOutput,
    boolean netcdfOutput,
    boolean allowOverwrite,
    boolean dryRun) {

  static final int DEFAULT_LEAP_SECONDS = 18;
  static final int MAX_LEAP_SECONDS = 60;
  static final int MAX_SMOOTHING_WINDOW = 3_601;

  /**
   * Normalizes paths, fills derived defaults and validates.
   *
   * @throws IllegalArgumentException when a value is out of range or no output is enabled
   */
  public ConvertConfig {
    Objects.requireNonNull(input, "input");
    input = input.toAbsolutePath().normalize();
    Path parent = input.getParent();
    outputDirectory = outputDirectory == null
        ? (parent == null ? input.getRoot() : parent)
        : outputDirectory.toAbsolutePath().normalize();
    String candidate = Strings.trimToNull(baseName);
    baseName = candidate != null
        ? Strings.requireNonBlank("baseName", candidate)
        : PathUtils.baseName(input).orElseThrow(() -> new IllegalArgumentException("input has no file name"));
    if (baseName.contains("/") || baseName.contains("\\")) {
      throw new IllegalArgumentException("baseName must not contain path separators");
    }
    inputFormat = Objects.requireNonNullElse(inputFormat, InputFormat.AUTO);
    Numbers.requireRange("smoothingWindow", smoothingWindow, 1, MAX_SMOOTHING_WINDOW);
    Numbers.requireOdd("smoothingWindow", smoothingWindow);
    Numbers.requireRange("gpsLeapSeconds", gpsLeapSeconds, 0, MAX_LEAP_SECONDS);
    if (!textOutput && !netcdfOutput) {
      throw new IllegalArgumentException("At least one of textOutput or netcdfOutput must be true");
    }
  }

  /**
   * Builds a configuration from a flat key/value map.
   *
   * @param options merged options; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static ConvertConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = Strings.trimToNull(options.get("in"));
    if (in == null) {
      throw new IllegalArgumentException("in is required");
    }
    String outDir = Strings.trimToNull(options.get("outDir"));
    return new ConvertConfig(
        parsePath("in", in),
        outDir == null ? null : parsePath("outDir", outDir),
        options.get("baseName"),
        InputFormat.fromString(options.get("inputFormat")),
        parseBoolean("positionRangeCheck", options.get("positionRangeCheck"), false),
        parseInt("smoothingWindow", options.get("smoothingWindow"), MovingAverage.DEFAULT_WINDOW),
        parseInt("gpsLeapSeconds", options.get("gpsLeapSeconds"), DEFAULT_LEAP_SECONDS),
        parseBoolean("textOutput", options.get("textOutput"), true),
        parseBoolean("netcdfOutput", options.get("netcdfOutput"), true),
        parseBoolean("allowOverwrite", options.get("allowOverwrite"), false),
        parseBoolean("dryRun", options.get("dryRun"), false));
  }

  /**
   * Returns a copy with the overwrite and dry-run switches replaced.
   *
   * @param allowOverwrite new overwrite switch
   * @param dryRun new dry-run switch
   * @return updated configuration
   */
  public ConvertConfig withSwitches(boolean allowOverwrite, boolean dryRun) {
    return new ConvertConfig(input, outputDirectory, baseName, inputFormat, positionRangeCheck, smoothingWindow,
        gpsLeapSeconds, textOutput, netcdfOutput, allowOverwrite, dryRun);
  }

  /**
   * Returns the engine tunables.
   *
   * @return engine settings
   */
  public EngineSettings engineSettings() {
    return new EngineSettings(positionRangeCheck, smoothingWindow);
  }

  /**
   * Returns the concrete input format.
   *
   * @return {@link #inputFormat()} resolved against the input file name
   */
  public InputFormat resolvedInputFormat() {
    return inputFormat.resolve(input);
  }

  /**
   * Returns where outputs are placed.
   *
   * @return output target
   */
  public OutputTarget outputTarget() {
    return new OutputTarget(
        outputDirectory, baseName, PathUtils.fileName(input).orElse(baseName), allowOverwrite);
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static int parseInt(String key, String raw, int defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static boolean parseBoolean(String key, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String trimmed = raw.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
  }
}
