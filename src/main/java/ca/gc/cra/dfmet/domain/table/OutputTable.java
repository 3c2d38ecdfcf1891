package ca.gc.cra.dfmet.domain.table;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered, immutable set of per-second observations for one flight session.
 * <p><strong>Why:</strong> The single artifact crossing into the output writers, so its ordering guarantees are
 * enforced at construction rather than trusted.</p>
 * <p><strong>Thread-safety:</strong> Immutable; rows are copied.</p>
 *
 * @param rows rows in strictly ascending time order with observation indices {@code 1..N}
 * @since 0.1.0
 */
public record OutputTable(List<AggregatedRow> rows) {

  /**
   * Copies the rows and validates ordering.
   *
   * @throws IllegalArgumentException when times are not strictly ascending or observation indices are not
   *     consecutive from 1
   */
  public OutputTable {
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    long previous = Long.MIN_VALUE;
    for (int i = 0; i < rows.size(); i++) {
      AggregatedRow row = rows.get(i);
      if (row.observation() != i + 1) {
        throw new IllegalArgumentException(
            "observation index at position " + i + " must be " + (i + 1) + " (was " + row.observation() + ")");
      }
      if (i > 0 && row.time() <= previous) {
        throw new IllegalArgumentException(
            "row times must be strictly ascending (" + row.time() + " follows " + previous + ")");
      }
      previous = row.time();
    }
  }

  /**
   * Returns the number of rows.
   *
   * @return row count
   */
  public int size() {
    return rows.size();
  }

  /**
   * Indicates whether the table has no rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
