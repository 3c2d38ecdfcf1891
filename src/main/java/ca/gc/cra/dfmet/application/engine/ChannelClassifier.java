package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.met.NanMean;
import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import ca.gc.cra.dfmet.domain.sample.HumiditySample;
import ca.gc.cra.dfmet.domain.sample.InertialTemperatureSample;
import ca.gc.cra.dfmet.domain.sample.PositionSample;
import ca.gc.cra.dfmet.domain.sample.PressureSample;
import ca.gc.cra.dfmet.domain.sample.Sample;
import ca.gc.cra.dfmet.domain.sample.TemperatureSample;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Routes decoded flight-log records into typed sensor channels.
 * <p><strong>Why:</strong> ArduPilot firmware and add-on sensors name the same physical quantity differently; the
 * classifier maps every known message shape onto one {@link Sample} type and normalizes units to Celsius.</p>
 * <p><strong>Role:</strong> First stage of the {@link ConversionEngine}.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * <p>Routing (message types are case-sensitive):
 * <ul>
 *   <li>{@code GPS} with {@code Lat}, {@code Lng}, {@code Alt}: position.</li>
 *   <li>{@code BARO}, {@code SCALED_PRESSURE} with {@code press_abs} or {@code Press}: pressure; {@code temperature}
 *       or {@code Temp} converted from Kelvin only above 200.</li>
 *   <li>{@code TEMP}, {@code TEMPERATURE} with any of {@code Temp1..Temp3}: temperature in Celsius.</li>
 *   <li>{@code WXTP} with any of {@code t0..t2}: temperature in Kelvin.</li>
 *   <li>{@code WXRH} with any of {@code rh0..rh2}: humidity, with {@code t0..t2} in Kelvin, each pre-averaged.</li>
 *   <li>{@code HUM} with {@code Humidity}: humidity; {@code Temp} converted from Kelvin only above 200.</li>
 *   <li>{@code IMU} with {@code Temp}: inertial temperature.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ChannelClassifier {
  static final double KELVIN_OFFSET = 273.15;
  static final double KELVIN_THRESHOLD = 200.0;

  /**
   * Classifies one decoded record.
   *
   * @param sequence 0-based decode ordinal of the record
   * @param record decoded record; must not be {@code null}
   * @return the typed sample, or empty when the record is not meteorologically relevant, lacks its required fields
   *     or carries a non-finite timestamp
   */
  public Optional<Sample> classify(long sequence, DecodedRecord record) {
    double ts = record.timestamp();
    if (!Double.isFinite(ts)) {
      return Optional.empty();
    }
    return switch (record.type()) {
      case "GPS" -> position(sequence, ts, record);
      case "BARO", "SCALED_PRESSURE" -> pressure(sequence, ts, record);
      case "TEMP", "TEMPERATURE" -> temperature(sequence, ts, record, "Temp1", "Temp2", "Temp3", false);
      case "WXTP" -> temperature(sequence, ts, record, "t0", "t1", "t2", true);
      case "WXRH" -> weatherHumidity(sequence, ts, record);
      case "HUM" -> humidity(sequence, ts, record);
      case "IMU" -> inertial(sequence, ts, record);
      default -> Optional.empty();
    };
  }

  private static Optional<Sample> position(long sequence, double ts, DecodedRecord record) {
    if (!record.hasAll("Lat", "Lng", "Alt")) {
      return Optional.empty();
    }
    return Optional.of(
        new PositionSample(
            sequence,
            ts,
            record.field("Lat").getAsDouble(),
            record.field("Lng").getAsDouble(),
            record.field("Alt").getAsDouble()));
  }

  private static Optional<Sample> pressure(long sequence, double ts, DecodedRecord record) {
    OptionalDouble pressure = record.firstField("press_abs", "Press");
    if (pressure.isEmpty()) {
      return Optional.empty();
    }
    OptionalDouble temperature = kelvinIfAboveThreshold(record.firstField("temperature", "Temp"));
    return Optional.of(new PressureSample(sequence, ts, pressure.getAsDouble(), temperature));
  }

  private static Optional<Sample> temperature(
      long sequence, double ts, DecodedRecord record, String first, String second, String third, boolean kelvin) {
    OptionalDouble t1 = record.field(first);
    OptionalDouble t2 = record.field(second);
    OptionalDouble t3 = record.field(third);
    if (t1.isEmpty() && t2.isEmpty() && t3.isEmpty()) {
      return Optional.empty();
    }
    if (kelvin) {
      t1 = fromKelvin(t1);
      t2 = fromKelvin(t2);
      t3 = fromKelvin(t3);
    }
    return Optional.of(new TemperatureSample(sequence, ts, t1, t2, t3));
  }

  private static Optional<Sample> weatherHumidity(long sequence, double ts, DecodedRecord record) {
    NanMean humidity = new NanMean();
    boolean anyHumidity = false;
    for (String name : new String[] {"rh0", "rh1", "rh2"}) {
      OptionalDouble value = record.field(name);
      if (value.isPresent()) {
        anyHumidity = true;
        humidity.add(value.getAsDouble());
      }
    }
    if (!anyHumidity) {
      return Optional.empty();
    }
    NanMean temperature = new NanMean();
    boolean anyTemperature = false;
    for (String name : new String[] {"t0", "t1", "t2"}) {
      OptionalDouble value = record.field(name);
      if (value.isPresent()) {
        anyTemperature = true;
        temperature.add(value.getAsDouble() - KELVIN_OFFSET);
      }
    }
    OptionalDouble meanTemperature =
        anyTemperature ? OptionalDouble.of(temperature.mean()) : OptionalDouble.empty();
    return Optional.of(new HumiditySample(sequence, ts, humidity.mean(), meanTemperature));
  }

  private static Optional<Sample> humidity(long sequence, double ts, DecodedRecord record) {
    OptionalDouble humidity = record.field("Humidity");
    if (humidity.isEmpty()) {
      return Optional.empty();
    }
    OptionalDouble temperature = kelvinIfAboveThreshold(record.field("Temp"));
    return Optional.of(new HumiditySample(sequence, ts, humidity.getAsDouble(), temperature));
  }

  private static Optional<Sample> inertial(long sequence, double ts, DecodedRecord record) {
    OptionalDouble temperature = record.field("Temp");
    if (temperature.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new InertialTemperatureSample(sequence, ts, temperature.getAsDouble()));
  }

  private static OptionalDouble fromKelvin(OptionalDouble value) {
    return value.isPresent() ? OptionalDouble.of(value.getAsDouble() - KELVIN_OFFSET) : value;
  }

  // NaN compares false, so it passes through unconverted.
  private static OptionalDouble kelvinIfAboveThreshold(OptionalDouble value) {
    if (value.isPresent() && value.getAsDouble() > KELVIN_THRESHOLD) {
      return OptionalDouble.of(value.getAsDouble() - KELVIN_OFFSET);
    }
    return value;
  }
}
