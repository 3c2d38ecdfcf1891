package ca.gc.cra.dfmet.domain.met;

/**
 * Centered moving average with nearest-edge padding.
 *
 * <p>Indices outside the column are clamped to the first or last element. Each output is the arithmetic mean of its
 * own window, so a NaN input makes NaN exactly the outputs whose window contains it.
 *
 * @since 0.1.0
 */
public final class MovingAverage {
  /** Window used for the air-temperature column. */
  public static final int DEFAULT_WINDOW = 9;

  private MovingAverage() {}

  /**
   * Smooths a column.
   *
   * @param values input column; not modified
   * @param window odd window width, at least 1
   * @return a new smoothed column, or an unmodified copy when {@code values.length <= window}
   * @throws IllegalArgumentException if {@code window} is even or below 1
   */
  public static double[] centered(double[] values, int window) {
    validateWindow(window);
    int n = values.length;
    if (n <= window) {
      return values.clone();
    }
    int half = window / 2;
    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0.0;
      for (int k = i - half; k <= i + half; k++) {
        sum += values[Math.max(0, Math.min(n - 1, k))];
      }
      out[i] = sum / window;
    }
    return out;
  }

  /**
   * Validates a smoothing window width.
   *
   * @param window candidate width
   * @return the width
   * @throws IllegalArgumentException if {@code window} is even or below 1
   */
  public static int validateWindow(int window) {
    if (window < 1 || window % 2 == 0) {
      throw new IllegalArgumentException("smoothing window must be an odd number >= 1 (was " + window + ")");
    }
    return window;
  }
}
