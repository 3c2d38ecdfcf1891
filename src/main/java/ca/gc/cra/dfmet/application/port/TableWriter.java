package ca.gc.cra.dfmet.application.port;

import ca.gc.cra.dfmet.domain.table.OutputTable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port that renders an {@link OutputTable} into one output file.
 * <p><strong>Why:</strong> The convert use case applies one error policy to every format: a failing required writer
 * aborts the run, a failing optional writer is reported and the run completes.</p>
 * <p><strong>Role:</strong> Implemented by {@code TextTableWriter} and {@code NetcdfTableWriter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless or confined to one call.</p>
 *
 * @since 0.1.0
 */
public interface TableWriter {
  /**
   * Short lowercase name used in metric keys and logs (e.g., {@code text}).
   *
   * @return writer name
   */
  String name();

  /**
   * Indicates whether a failure of this writer aborts the conversion.
   *
   * @return {@code true} for required outputs
   */
  boolean required();

  /**
   * Returns the file this writer produces for a target.
   *
   * @param target output target
   * @return output file path
   */
  Path outputFile(OutputTarget target);

  /**
   * Writes the table.
   *
   * @param table table to render; never empty
   * @param target output placement
   * @return the written file
   * @throws IOException if the file cannot be written or exists and overwriting is not allowed
   */
  Path write(OutputTable table, OutputTarget target) throws IOException;
}
