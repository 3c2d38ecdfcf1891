package ca.gc.cra.dfmet.application.port;

/**
 * <strong>What:</strong> Port abstracting conversion metrics emission.
 * <p><strong>Why:</strong> Lets the convert use case count records, samples and outputs without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} when metrics are off.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code convert.records.read}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code convert.output.netcdf.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Adds {@code amount} to the named counter.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param amount non-negative increment
   */
  default void add(String key, long amount) {
    for (long i = 0; i < amount; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, units defined by the key suffix (e.g., {@code latencyMillis})
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void add(String key, long amount) {}

    @Override public void observe(String key, long value) {}
  };
}
