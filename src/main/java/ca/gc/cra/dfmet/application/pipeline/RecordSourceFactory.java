package ca.gc.cra.dfmet.application.pipeline;

import ca.gc.cra.dfmet.application.port.RecordSource;
import java.nio.file.Path;

/**
 * Creates the {@link RecordSource} for an input log.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordSourceFactory {
  /**
   * Creates an unopened source.
   *
   * @param input input log
   * @return record source; the caller opens and closes it
   */
  RecordSource create(Path input);
}
