package ca.gc.cra.dfmet.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the optional {@code config=} YAML file of the convert command.
 *
 * <p>The document has at most two sections. {@code common} takes the telemetry and logging settings shared by every
 * command; {@code convert} takes any convert setting and wins over {@code common}. Settings are flat scalars named
 * exactly like the CLI keys, so a file line {@code smoothingWindow: 5} means the same as {@code smoothingWindow=5}.
 * Unknown sections and unknown keys are rejected so a misspelt setting is never silently ignored. An explicit
 * {@code null} yields a blank value, which falls back to the built-in default.
 *
 * @since 0.1.0
 * @see ConfigMerger
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  static final String CONVERT_SECTION = "convert";

  private YamlConfigLoader() {}

  /**
   * Loads convert settings from {@code path}.
   *
   * @param path YAML file
   * @return settings keyed by CLI name; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or names unknown sections or settings
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config " + path + " must be a mapping of sections");
    }

    Map<?, ?> common = null;
    Map<?, ?> convert = null;
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      Object name = entry.getKey();
      if (COMMON_SECTION.equals(name)) {
        common = section(COMMON_SECTION, entry.getValue());
      } else if (CONVERT_SECTION.equals(name)) {
        convert = section(CONVERT_SECTION, entry.getValue());
      } else {
        throw new IllegalArgumentException(
            "unknown YAML section '" + name + "' (expected " + COMMON_SECTION + " or " + CONVERT_SECTION + ")");
      }
    }

    Map<String, String> settings = new LinkedHashMap<>();
    copySettings(COMMON_SECTION, common, DefaultsForMode.commonKeys(), settings);
    copySettings(CONVERT_SECTION, convert, DefaultsForMode.asFlatMap(CONVERT_SECTION).keySet(), settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<?, ?> section(String name, Object value) {
    if (value == null) {
      return Map.of();
    }
    if (!(value instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(name + " section must be a mapping");
    }
    return map;
  }

  private static void copySettings(
      String sectionName, Map<?, ?> section, Set<String> allowed, Map<String, String> target) {
    if (section == null) {
      return;
    }
    for (Map.Entry<?, ?> entry : section.entrySet()) {
      if (!(entry.getKey() instanceof String key) || !allowed.contains(key)) {
        throw new IllegalArgumentException("unknown " + sectionName + " setting '" + entry.getKey() + "'");
      }
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof String || value instanceof Number || value instanceof Boolean) {
        target.put(key, value.toString());
      } else {
        throw new IllegalArgumentException(sectionName + "." + key + " must be a single value");
      }
    }
  }
}
