package ca.gc.cra.dfmet.application.engine;

/**
 * Per-row scalars produced by the {@link ChannelAggregator}, aligned with a {@link MasterIndex}.
 *
 * <p>Arrays are owned by the engine invocation that created them and are mutated in place by the smoothing step.
 *
 * @param latitude first-fix latitude per row
 * @param longitude first-fix longitude per row
 * @param altitude first-fix altitude per row
 * @param airTemperature pooled air-temperature mean per row
 * @param relativeHumidity humidity mean per row
 * @param airPressure pressure mean per row
 * @since 0.1.0
 */
record AggregatedColumns(
    double[] latitude,
    double[] longitude,
    double[] altitude,
    double[] airTemperature,
    double[] relativeHumidity,
    double[] airPressure) {

  int rows() {
    return latitude.length;
  }
}
