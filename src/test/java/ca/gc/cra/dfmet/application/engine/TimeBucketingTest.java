package ca.gc.cra.dfmet.application.engine;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.dfmet.domain.sample.PositionSample;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeBucketingTest {

  private static PositionSample fix(long seq, double ts) {
    return new PositionSample(seq, ts, 45.0, -75.0, 100.0);
  }

  @Test
  void bucketsRoundTowardNegativeInfinity() {
    assertEquals(10L, TimeBucketing.bucketOf(10.999));
    assertEquals(10L, TimeBucketing.bucketOf(10.0));
    assertEquals(-2L, TimeBucketing.bucketOf(-1.5));
  }

  @Test
  void masterIndexIsSortedAndDistinct() throws Exception {
    MasterIndex index = TimeBucketing.masterIndex(
        List.of(fix(0, 12.4), fix(1, 10.2), fix(2, 10.8), fix(3, 15.0)));

    assertArrayEquals(new long[] {10L, 12L, 15L}, index.buckets());
    assertEquals(1, index.rowOf(12L));
    assertEquals(-1, index.rowOf(11L));
    assertEquals(15L, index.bucket(2));
  }

  @Test
  void emptyPositionsRaiseNoPositionData() {
    NoPositionDataException ex =
        assertThrows(NoPositionDataException.class, () -> TimeBucketing.masterIndex(List.of()));
    assertEquals("No position samples found; cannot build the time index", ex.getMessage());
  }
}
