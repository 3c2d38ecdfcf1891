package ca.gc.cra.dfmet.domain.met;

/**
 * Running arithmetic mean that ignores NaN inputs.
 *
 * <p>Not thread-safe; intended for one bucket reduction at a time.
 *
 * @since 0.1.0
 */
public final class NanMean {
  private double sum;
  private int count;

  /**
   * Adds a value; NaN is ignored.
   *
   * @param value candidate value
   * @return this accumulator
   */
  public NanMean add(double value) {
    if (!Double.isNaN(value)) {
      sum += value;
      count++;
    }
    return this;
  }

  /**
   * Returns the number of non-NaN values added.
   *
   * @return accepted value count
   */
  public int count() {
    return count;
  }

  /**
   * Returns the mean of the accepted values.
   *
   * @return mean, or NaN when no value was accepted
   */
  public double mean() {
    return count == 0 ? Double.NaN : sum / count;
  }

  /**
   * Mean of the supplied values ignoring NaN.
   *
   * @param values values to average
   * @return mean, or NaN when every value is NaN or none is supplied
   */
  public static double of(double... values) {
    NanMean mean = new NanMean();
    for (double value : values) {
      mean.add(value);
    }
    return mean.mean();
  }
}
