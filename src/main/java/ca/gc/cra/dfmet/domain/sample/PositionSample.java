package ca.gc.cra.dfmet.domain.sample;

import java.util.OptionalDouble;

/**
 * Positioning fix in decimal degrees and metres.
 *
 * @param sequence decode ordinal of the originating record
 * @param timestamp seconds since the Unix epoch
 * @param latitude latitude in degrees north
 * @param longitude longitude in degrees east
 * @param altitude altitude above mean sea level in metres
 * @since 0.1.0
 */
public record PositionSample(
    long sequence, double timestamp, double latitude, double longitude, double altitude)
    implements Sample {

  @Override
  public Channel channel() {
    return Channel.POSITION;
  }

  @Override
  public OptionalDouble airTemperature() {
    return OptionalDouble.empty();
  }

  /**
   * Checks the coordinates against the geographic ranges.
   *
   * @return {@code true} when latitude is within [-90, 90] and longitude within [-180, 180]
   */
  public boolean withinGeographicRange() {
    return latitude >= -90.0 && latitude <= 90.0 && longitude >= -180.0 && longitude <= 180.0;
  }
}
