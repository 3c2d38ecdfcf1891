package ca.gc.cra.dfmet.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time.
 * <p><strong>Why:</strong> Output provenance (the NetCDF {@code history} attribute) must be deterministic under
 * test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.dfmet.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
