package ca.gc.cra.dfmet.domain.sample;

import java.util.OptionalDouble;

/**
 * IMU die temperature in Celsius.
 *
 * @param sequence decode ordinal of the originating record
 * @param timestamp seconds since the Unix epoch
 * @param temperature reported temperature
 * @since 0.1.0
 */
public record InertialTemperatureSample(long sequence, double timestamp, double temperature)
    implements Sample {

  @Override
  public Channel channel() {
    return Channel.INERTIAL_TEMPERATURE;
  }

  @Override
  public OptionalDouble airTemperature() {
    return OptionalDouble.of(temperature);
  }
}
