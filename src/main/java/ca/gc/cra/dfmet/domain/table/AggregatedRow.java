package ca.gc.cra.dfmet.domain.table;

/**
 * <strong>What:</strong> One per-second meteorological observation.
 * <p><strong>Why:</strong> Aligns every sensor channel onto the one-second grid defined by the positioning fixes.</p>
 * <p><strong>Role:</strong> Row of the {@link OutputTable} handed to table writers.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Missing values are NaN. The geopotential and wind accessors are reserved columns that this engine never
 * populates.</p>
 *
 * @param observation 1-based observation index
 * @param time whole-second bucket, seconds since the Unix epoch
 * @param latitude degrees north
 * @param longitude degrees east
 * @param altitude metres above mean sea level
 * @param airTemperature combined, smoothed air temperature in Celsius
 * @param dewPoint dew point in Celsius
 * @param relativeHumidity relative humidity in percent
 * @param airPressure static pressure as logged
 * @since 0.1.0
 */
public record AggregatedRow(
    int observation,
    long time,
    double latitude,
    double longitude,
    double altitude,
    double airTemperature,
    double dewPoint,
    double relativeHumidity,
    double airPressure) {

  /**
   * Geopotential; always NaN.
   *
   * @return NaN
   */
  public double gpt() {
    return Double.NaN;
  }

  /**
   * Geopotential height; always NaN.
   *
   * @return NaN
   */
  public double gptHeight() {
    return Double.NaN;
  }

  /**
   * Wind speed; always NaN.
   *
   * @return NaN
   */
  public double windSpeed() {
    return Double.NaN;
  }

  /**
   * Wind direction; always NaN.
   *
   * @return NaN
   */
  public double windDirection() {
    return Double.NaN;
  }
}
