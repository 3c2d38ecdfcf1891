package ca.gc.cra.dfmet.domain.sample;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Dedicated temperature sensor reading with up to three sub-channels, all in Celsius.
 *
 * <p>Only the primary sub-reading feeds the pooled air-temperature column; the secondary readings are kept for
 * completeness.</p>
 *
 * @param sequence decode ordinal of the originating record
 * @param timestamp seconds since the Unix epoch
 * @param primary first sub-reading
 * @param secondary second sub-reading
 * @param tertiary third sub-reading
 * @since 0.1.0
 */
public record TemperatureSample(
    long sequence,
    double timestamp,
    OptionalDouble primary,
    OptionalDouble secondary,
    OptionalDouble tertiary)
    implements Sample {

  public TemperatureSample {
    primary = Objects.requireNonNullElse(primary, OptionalDouble.empty());
    secondary = Objects.requireNonNullElse(secondary, OptionalDouble.empty());
    tertiary = Objects.requireNonNullElse(tertiary, OptionalDouble.empty());
  }

  @Override
  public Channel channel() {
    return Channel.TEMPERATURE;
  }

  @Override
  public OptionalDouble airTemperature() {
    return primary;
  }
}
