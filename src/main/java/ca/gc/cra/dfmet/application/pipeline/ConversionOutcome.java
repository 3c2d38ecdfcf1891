package ca.gc.cra.dfmet.application.pipeline;

/**
 * Terminal status of a conversion that produced a table.
 *
 * @since 0.1.0
 */
public enum ConversionOutcome {
  /** Every enabled output was written. */
  COMPLETED("Processing completed successfully"),
  /** The required output was written but at least one optional output failed. */
  COMPLETED_WITH_OUTPUT_ERRORS("Processing completed with output errors");

  private final String statusMessage;

  ConversionOutcome(String statusMessage) {
    this.statusMessage = statusMessage;
  }

  /**
   * Returns the status line printed by the CLI.
   *
   * @return human-readable status
   */
  public String statusMessage() {
    return statusMessage;
  }
}
