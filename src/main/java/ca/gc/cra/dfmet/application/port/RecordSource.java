package ca.gc.cra.dfmet.application.port;

import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import java.io.IOException;

/**
 * <strong>What:</strong> Port that supplies decoded flight-log records to the convert use case.
 * <p><strong>Why:</strong> Keeps the engine agnostic to the on-disk log format (binary DataFlash, NDJSON dumps).</p>
 * <p><strong>Role:</strong> Implemented by {@code DataFlashLogReader} and {@code NdjsonRecordSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and close the underlying file.</li>
 *   <li>Deliver records in decode order with absolute Unix-second timestamps.</li>
 *   <li>Skip malformed input with a logged warning and count it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded use only.</p>
 *
 * @implNote Callers must invoke {@link #open()} before {@link #next()} and always {@link #close()}.
 * @since 0.1.0
 */
public interface RecordSource extends AutoCloseable {
  /**
   * Opens the source.
   *
   * @throws IOException if the input cannot be read
   */
  void open() throws IOException;

  /**
   * Returns the next decoded record.
   *
   * @return the next record, or {@code null} when the source is exhausted
   * @throws IOException if reading fails
   */
  DecodedRecord next() throws IOException;

  /**
   * Returns how many malformed or unusable records were skipped so far.
   *
   * @return skipped record count
   */
  long skipped();

  /**
   * Releases the underlying file.
   *
   * @throws IOException if closing fails
   */
  @Override
  void close() throws IOException;
}
