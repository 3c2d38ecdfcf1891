package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.met.NanMean;
import ca.gc.cra.dfmet.domain.sample.HumiditySample;
import ca.gc.cra.dfmet.domain.sample.PositionSample;
import ca.gc.cra.dfmet.domain.sample.PressureSample;
import ca.gc.cra.dfmet.domain.sample.Sample;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Reduces the samples falling into each master bucket to one value per column.
 * <p><strong>Why:</strong> Sensors report at different, irregular rates; each channel needs its own reduction to land
 * on the one-second grid.</p>
 * <p><strong>Role:</strong> Second stage of the {@link ConversionEngine}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its immutable flag.</p>
 *
 * <p>Policies:
 * <ul>
 *   <li>Position: first sample by decode order; with the range check enabled, an out-of-range first fix blanks the
 *       row's latitude, longitude and altitude.</li>
 *   <li>Pressure and humidity: NaN-ignoring mean.</li>
 *   <li>Air temperature: NaN-ignoring pooled mean over every sample's temperature contribution.</li>
 * </ul>
 * Samples whose bucket is not in the master index are ignored. Buckets without contributions stay NaN.
 *
 * @since 0.1.0
 */
public final class ChannelAggregator {
  private final boolean positionRangeCheck;

  /**
   * Creates an aggregator.
   *
   * @param positionRangeCheck whether out-of-range first fixes blank the position columns
   */
  public ChannelAggregator(boolean positionRangeCheck) {
    this.positionRangeCheck = positionRangeCheck;
  }

  /**
   * Aggregates classified samples onto the master index.
   *
   * @param index master index
   * @param samples classified samples in any order
   * @return aggregated columns aligned with {@code index}
   */
  public AggregatedColumns aggregate(MasterIndex index, List<Sample> samples) {
    int rows = index.size();
    PositionSample[] firstFix = new PositionSample[rows];
    NanMean[] pressure = accumulators(rows);
    NanMean[] humidity = accumulators(rows);
    NanMean[] temperature = accumulators(rows);

    for (Sample sample : samples) {
      int row = index.rowOf(TimeBucketing.bucketOf(sample.timestamp()));
      if (row < 0) {
        continue;
      }
      if (sample instanceof PositionSample position) {
        if (firstFix[row] == null || position.sequence() < firstFix[row].sequence()) {
          firstFix[row] = position;
        }
        continue;
      }
      if (sample instanceof PressureSample p) {
        pressure[row].add(p.pressure());
      } else if (sample instanceof HumiditySample h) {
        humidity[row].add(h.humidity());
      }
      OptionalDouble contribution = sample.airTemperature();
      if (contribution.isPresent()) {
        temperature[row].add(contribution.getAsDouble());
      }
    }

    double[] latitude = nanColumn(rows);
    double[] longitude = nanColumn(rows);
    double[] altitude = nanColumn(rows);
    for (int row = 0; row < rows; row++) {
      PositionSample fix = firstFix[row];
      if (fix == null || (positionRangeCheck && !fix.withinGeographicRange())) {
        continue;
      }
      latitude[row] = fix.latitude();
      longitude[row] = fix.longitude();
      altitude[row] = fix.altitude();
    }
    return new AggregatedColumns(
        latitude, longitude, altitude, means(temperature), means(humidity), means(pressure));
  }

  private static NanMean[] accumulators(int rows) {
    NanMean[] out = new NanMean[rows];
    for (int i = 0; i < rows; i++) {
      out[i] = new NanMean();
    }
    return out;
  }

  private static double[] means(NanMean[] accumulators) {
    double[] out = new double[accumulators.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = accumulators[i].mean();
    }
    return out;
  }

  private static double[] nanColumn(int rows) {
    double[] out = new double[rows];
    Arrays.fill(out, Double.NaN);
    return out;
  }
}
