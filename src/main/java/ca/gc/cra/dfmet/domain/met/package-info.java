/**
 * Meteorological arithmetic: dew point, smoothing and NaN-aware means.
 * <p><strong>Role:</strong> Pure numeric helpers used by the conversion engine.</p>
 */
package ca.gc.cra.dfmet.domain.met;
