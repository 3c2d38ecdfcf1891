package ca.gc.cra.dfmet.domain.sample;

import java.util.Locale;

/**
 * Sensor channels recognised by the conversion engine. Each channel has its own reduction policy.
 *
 * @since 0.1.0
 */
public enum Channel {
  /** Satellite positioning fix. */
  POSITION,
  /** Barometric or static pressure with optional sensor temperature. */
  PRESSURE,
  /** Dedicated temperature sensor with up to three sub-readings. */
  TEMPERATURE,
  /** Relative humidity with an accompanying temperature. */
  HUMIDITY,
  /** Temperature reported by the inertial measurement unit. */
  INERTIAL_TEMPERATURE;

  /**
   * Returns the lowercase name used in metric keys and log lines.
   *
   * @return metric-friendly channel name (e.g., {@code inertial_temperature})
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
