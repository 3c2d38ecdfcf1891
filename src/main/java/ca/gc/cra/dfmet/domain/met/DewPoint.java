package ca.gc.cra.dfmet.domain.met;

/**
 * Dew point from air temperature and relative humidity using the Magnus approximation
 * ({@code b = 17.62}, {@code c = 243.12 °C}).
 *
 * <p>Relative humidity is clipped to {@code [0.1, 100]} before the logarithm; temperature is not clipped. A NaN in
 * either input yields NaN.
 *
 * @since 0.1.0
 */
public final class DewPoint {
  static final double MAGNUS_B = 17.62;
  static final double MAGNUS_C = 243.12;
  static final double MIN_RELATIVE_HUMIDITY = 0.1;
  static final double MAX_RELATIVE_HUMIDITY = 100.0;

  private DewPoint() {}

  /**
   * Computes the dew point for one observation.
   *
   * @param temperatureCelsius air temperature in degrees Celsius
   * @param relativeHumidity relative humidity in percent
   * @return dew point in degrees Celsius, or NaN when either input is NaN
   */
  public static double magnus(double temperatureCelsius, double relativeHumidity) {
    if (Double.isNaN(temperatureCelsius) || Double.isNaN(relativeHumidity)) {
      return Double.NaN;
    }
    double rh = Math.max(MIN_RELATIVE_HUMIDITY, Math.min(MAX_RELATIVE_HUMIDITY, relativeHumidity));
    double alpha =
        (MAGNUS_B * temperatureCelsius) / (MAGNUS_C + temperatureCelsius) + Math.log(rh / 100.0);
    return (MAGNUS_C * alpha) / (MAGNUS_B - alpha);
  }

  /**
   * Computes dew points element-wise.
   *
   * @param temperatureCelsius temperature column
   * @param relativeHumidity humidity column of the same length
   * @return new dew-point column
   * @throws IllegalArgumentException if the columns differ in length
   */
  public static double[] magnus(double[] temperatureCelsius, double[] relativeHumidity) {
    if (temperatureCelsius.length != relativeHumidity.length) {
      throw new IllegalArgumentException(
          "column lengths differ: " + temperatureCelsius.length + " vs " + relativeHumidity.length);
    }
    double[] out = new double[temperatureCelsius.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = magnus(temperatureCelsius[i], relativeHumidity[i]);
    }
    return out;
  }
}
