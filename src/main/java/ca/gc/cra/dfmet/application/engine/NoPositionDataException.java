package ca.gc.cra.dfmet.application.engine;

/**
 * Signals that a flight session holds no usable positioning fix, so no time index and no table can be produced.
 *
 * @since 0.1.0
 */
public final class NoPositionDataException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message diagnostic message
   */
  public NoPositionDataException(String message) {
    super(message);
  }
}
