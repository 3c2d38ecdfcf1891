package ca.gc.cra.dfmet.api;

/**
 * <strong>What:</strong> Canonical exit codes of the DFMET command line.
 * <ul>
 *   <li>Enumerate well-known success and failure outcomes.</li>
 *   <li>Expose the numeric value consumed by operating systems and scripts.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including runs where an optional output failed. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The input log held no position fixes, so no table was produced. */
  NO_DATA(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
