package ca.gc.cra.dfmet.config;

import ca.gc.cra.dfmet.domain.met.MovingAverage;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each DFMET CLI mode.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code convert})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "convert" -> buildConvertDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  /**
   * Returns the setting names shared by every mode.
   *
   * @return unmodifiable key set ({@code metricsExporter}, {@code otelEndpoint}, {@code verbose})
   */
  public static Set<String> commonKeys() {
    return COMMON_DEFAULTS.keySet();
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  // Blank outDir and baseName are derived from the input path.
  private static Map<String, String> buildConvertDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("outDir", "");
    map.put("baseName", "");
    map.put("inputFormat", InputFormat.AUTO.name());
    map.put("positionRangeCheck", "false");
    map.put("smoothingWindow", Integer.toString(MovingAverage.DEFAULT_WINDOW));
    map.put("gpsLeapSeconds", Integer.toString(ConvertConfig.DEFAULT_LEAP_SECONDS));
    map.put("textOutput", "true");
    map.put("netcdfOutput", "true");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
