package ca.gc.cra.dfmet.infrastructure.persistence.text;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point formatting with printf semantics.
 *
 * <p>Rounds the exact binary value half-even, keeps the sign of negative values that round to zero
 * ({@code -0.001} with two places is {@code -0.00}) and writes {@code NaN}, {@code inf} and {@code -inf} for
 * non-finite values.
 */
final class FixedDecimal {
  private FixedDecimal() {}

  static String format(double value, int places) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    }
    BigDecimal rounded = new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN);
    String text = rounded.toPlainString();
    boolean negative = value < 0 || (value == 0.0 && 1.0 / value < 0);
    if (negative && rounded.signum() == 0) {
      return "-" + text;
    }
    return text;
  }
}
