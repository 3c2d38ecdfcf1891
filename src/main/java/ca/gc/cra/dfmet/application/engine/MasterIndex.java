package ca.gc.cra.dfmet.application.engine;

import java.util.Arrays;

/**
 * Sorted distinct one-second buckets that define the rows of the output table.
 *
 * @since 0.1.0
 */
public final class MasterIndex {
  private final long[] buckets;

  MasterIndex(long[] sortedDistinctBuckets) {
    this.buckets = sortedDistinctBuckets.clone();
  }

  /**
   * Returns the number of rows.
   *
   * @return bucket count
   */
  public int size() {
    return buckets.length;
  }

  /**
   * Returns the bucket at a row position.
   *
   * @param row 0-based row position
   * @return bucket key
   */
  public long bucket(int row) {
    return buckets[row];
  }

  /**
   * Finds the row of a bucket.
   *
   * @param bucket bucket key
   * @return 0-based row, or {@code -1} when the bucket is not part of the index
   */
  public int rowOf(long bucket) {
    int row = Arrays.binarySearch(buckets, bucket);
    return row >= 0 ? row : -1;
  }

  /**
   * Returns a copy of the bucket keys.
   *
   * @return ascending bucket keys
   */
  public long[] buckets() {
    return buckets.clone();
  }
}
