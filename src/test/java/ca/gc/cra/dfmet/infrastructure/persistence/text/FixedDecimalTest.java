package ca.gc.cra.dfmet.infrastructure.persistence.text;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FixedDecimalTest {

  @Test
  void roundsHalfEvenOnExactBinaryValue() {
    assertEquals("0.12", FixedDecimal.format(0.125, 2));
    assertEquals("0.38", FixedDecimal.format(0.375, 2));
    assertEquals("2.67", FixedDecimal.format(2.675, 2));
    assertEquals("45.4215000", FixedDecimal.format(45.4215, 7));
  }

  @Test
  void padsToFixedPlacesWithoutExponent() {
    assertEquals("1700000000.00", FixedDecimal.format(1.7e9, 2));
    assertEquals("0.000001", FixedDecimal.format(1e-6, 6));
    assertEquals("-3.500000", FixedDecimal.format(-3.5, 6));
  }

  @Test
  void keepsSignOfNegativeValuesRoundingToZero() {
    assertEquals("-0.00", FixedDecimal.format(-0.001, 2));
    assertEquals("-0.00", FixedDecimal.format(-0.0, 2));
    assertEquals("0.00", FixedDecimal.format(0.001, 2));
  }

  @Test
  void nonFiniteValuesAreSpelledOut() {
    assertEquals("NaN", FixedDecimal.format(Double.NaN, 6));
    assertEquals("inf", FixedDecimal.format(Double.POSITIVE_INFINITY, 6));
    assertEquals("-inf", FixedDecimal.format(Double.NEGATIVE_INFINITY, 6));
  }
}
