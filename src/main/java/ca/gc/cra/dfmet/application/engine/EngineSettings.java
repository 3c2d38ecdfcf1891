package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.met.MovingAverage;

/**
 * Tunables of the conversion engine.
 *
 * @param positionRangeCheck blank the position of a row whose first fix lies outside the geographic ranges
 * @param smoothingWindow odd width of the air-temperature moving average
 * @since 0.1.0
 */
public record EngineSettings(boolean positionRangeCheck, int smoothingWindow) {

  /**
   * Validates the smoothing window.
   *
   * @throws IllegalArgumentException if the window is even or below 1
   */
  public EngineSettings {
    MovingAverage.validateWindow(smoothingWindow);
  }

  /**
   * Returns settings with the range check disabled and a nine-second window.
   *
   * @return default settings
   */
  public static EngineSettings defaults() {
    return new EngineSettings(false, MovingAverage.DEFAULT_WINDOW);
  }
}
