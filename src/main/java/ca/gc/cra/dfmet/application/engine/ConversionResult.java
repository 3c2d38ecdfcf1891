package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.table.OutputTable;
import java.util.Objects;

/**
 * Output of one engine invocation.
 *
 * @param table assembled table
 * @param stats classification counts
 * @since 0.1.0
 */
public record ConversionResult(OutputTable table, ClassificationStats stats) {

  /** Validates components. */
  public ConversionResult {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(stats, "stats");
  }
}
