package ca.gc.cra.dfmet.domain.sample;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Barometer reading with the sensor's own temperature when reported.
 *
 * @param sequence decode ordinal of the originating record
 * @param timestamp seconds since the Unix epoch
 * @param pressure static pressure as logged
 * @param temperature sensor temperature in Celsius, empty when the record carried none
 * @since 0.1.0
 */
public record PressureSample(
    long sequence, double timestamp, double pressure, OptionalDouble temperature)
    implements Sample {

  public PressureSample {
    temperature = Objects.requireNonNullElse(temperature, OptionalDouble.empty());
  }

  @Override
  public Channel channel() {
    return Channel.PRESSURE;
  }

  @Override
  public OptionalDouble airTemperature() {
    return temperature;
  }
}
