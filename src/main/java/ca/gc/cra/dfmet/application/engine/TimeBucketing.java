package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.sample.PositionSample;
import java.util.Collection;

/**
 * Second-resolution bucketing of sample timestamps.
 *
 * @since 0.1.0
 */
public final class TimeBucketing {
  private TimeBucketing() {}

  /**
   * Returns the whole-second bucket of a timestamp, rounding toward negative infinity.
   *
   * @param timestamp seconds since the Unix epoch; must be finite
   * @return {@code floor(timestamp)}
   */
  public static long bucketOf(double timestamp) {
    return (long) Math.floor(timestamp);
  }

  /**
   * Builds the master index from the position channel.
   *
   * @param positions position samples in any order
   * @return sorted distinct buckets of the positions
   * @throws NoPositionDataException when {@code positions} is empty
   */
  public static MasterIndex masterIndex(Collection<PositionSample> positions) throws NoPositionDataException {
    if (positions.isEmpty()) {
      throw new NoPositionDataException("No position samples found; cannot build the time index");
    }
    long[] buckets =
        positions.stream().mapToLong(p -> bucketOf(p.timestamp())).distinct().sorted().toArray();
    return new MasterIndex(buckets);
  }
}
