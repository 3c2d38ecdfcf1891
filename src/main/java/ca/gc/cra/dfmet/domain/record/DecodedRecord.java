package ca.gc.cra.dfmet.domain.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Immutable decoded flight-log message handed from a record source to the conversion engine.
 * <p><strong>Why:</strong> Decouples the engine from any particular on-disk log format; every source produces the
 * same {@code (timestamp, type, fields)} triple.</p>
 * <p><strong>Role:</strong> Domain value object at the decoder boundary.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the field map is copied and wrapped unmodifiable.</p>
 *
 * @param timestamp absolute time in seconds since the Unix epoch, as supplied by the record source
 * @param type message type name such as {@code GPS} or {@code BARO}
 * @param fields numeric fields keyed by name; names are trimmed and {@code null} values are discarded
 * @since 0.1.0
 */
public record DecodedRecord(double timestamp, String type, Map<String, Double> fields) {

  /**
   * Normalizes the type and copies the field map.
   *
   * @throws NullPointerException if {@code type} is {@code null}
   */
  public DecodedRecord {
    type = Objects.requireNonNull(type, "type").trim();
    Map<String, Double> copy = new LinkedHashMap<>();
    if (fields != null) {
      for (Map.Entry<String, Double> entry : fields.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        copy.put(entry.getKey().trim(), entry.getValue());
      }
    }
    fields = Collections.unmodifiableMap(copy);
  }

  /**
   * Looks up a field by name.
   *
   * @param name field name (already trimmed)
   * @return the value when the field is present, which may itself be NaN; empty when absent
   */
  public OptionalDouble field(String name) {
    Double value = fields.get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  /**
   * Returns the first present field among the supplied names.
   *
   * @param names candidate field names in priority order
   * @return the first present value, or empty when none of the names is present
   */
  public OptionalDouble firstField(String... names) {
    for (String name : names) {
      OptionalDouble value = field(name);
      if (value.isPresent()) {
        return value;
      }
    }
    return OptionalDouble.empty();
  }

  /**
   * Indicates whether every named field is present.
   *
   * @param names field names
   * @return {@code true} when all fields are present
   */
  public boolean hasAll(String... names) {
    for (String name : names) {
      if (!fields.containsKey(name)) {
        return false;
      }
    }
    return true;
  }
}
