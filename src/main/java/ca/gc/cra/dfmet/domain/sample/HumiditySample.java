package ca.gc.cra.dfmet.domain.sample;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Relative humidity reading, already averaged across the hygrometer's sub-sensors.
 *
 * @param sequence decode ordinal of the originating record
 * @param timestamp seconds since the Unix epoch
 * @param humidity relative humidity in percent (may be NaN)
 * @param temperature accompanying temperature in Celsius, empty when none was reported
 * @since 0.1.0
 */
public record HumiditySample(
    long sequence, double timestamp, double humidity, OptionalDouble temperature)
    implements Sample {

  public HumiditySample {
    temperature = Objects.requireNonNullElse(temperature, OptionalDouble.empty());
  }

  @Override
  public Channel channel() {
    return Channel.HUMIDITY;
  }

  @Override
  public OptionalDouble airTemperature() {
    return temperature;
  }
}
