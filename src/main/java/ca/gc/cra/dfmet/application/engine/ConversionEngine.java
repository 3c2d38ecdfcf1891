package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.met.DewPoint;
import ca.gc.cra.dfmet.domain.met.MovingAverage;
import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import ca.gc.cra.dfmet.domain.sample.Channel;
import ca.gc.cra.dfmet.domain.sample.PositionSample;
import ca.gc.cra.dfmet.domain.sample.Sample;
import ca.gc.cra.dfmet.domain.table.OutputTable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns a decoded record stream into the per-second meteorological table.
 * <p><strong>Why:</strong> Keeps alignment, aggregation and derived quantities free of I/O so they can be tested and
 * reused by any record source or writer.</p>
 * <p><strong>Role:</strong> Application core invoked by the convert use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify records into channels ({@link ChannelClassifier}).</li>
 *   <li>Build the master index from the position channel ({@link TimeBucketing}).</li>
 *   <li>Aggregate each channel per bucket ({@link ChannelAggregator}).</li>
 *   <li>Smooth air temperature, then derive dew point from the smoothed temperature.</li>
 *   <li>Assemble the {@link OutputTable}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no per-run state; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ConversionEngine {
  private final EngineSettings settings;
  private final ChannelClassifier classifier = new ChannelClassifier();

  /**
   * Creates an engine.
   *
   * @param settings engine tunables; must not be {@code null}
   */
  public ConversionEngine(EngineSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Converts a record stream.
   *
   * @param records decoded records in decode order
   * @return table and classification statistics
   * @throws NoPositionDataException when no record classifies as a position fix
   */
  public ConversionResult convert(List<DecodedRecord> records) throws NoPositionDataException {
    Objects.requireNonNull(records, "records");
    List<Sample> samples = new ArrayList<>(records.size());
    List<PositionSample> positions = new ArrayList<>();
    Map<Channel, Long> perChannel = new EnumMap<>(Channel.class);
    long dropped = 0;
    long sequence = 0;
    for (DecodedRecord record : records) {
      Optional<Sample> classified = classifier.classify(sequence++, record);
      if (classified.isEmpty()) {
        dropped++;
        continue;
      }
      Sample sample = classified.get();
      samples.add(sample);
      perChannel.merge(sample.channel(), 1L, Long::sum);
      if (sample instanceof PositionSample position) {
        positions.add(position);
      }
    }
    ClassificationStats stats = new ClassificationStats(records.size(), dropped, perChannel);

    MasterIndex index = TimeBucketing.masterIndex(positions);
    AggregatedColumns columns =
        new ChannelAggregator(settings.positionRangeCheck()).aggregate(index, samples);
    double[] smoothed = MovingAverage.centered(columns.airTemperature(), settings.smoothingWindow());
    System.arraycopy(smoothed, 0, columns.airTemperature(), 0, smoothed.length);
    double[] dewPoint = DewPoint.magnus(columns.airTemperature(), columns.relativeHumidity());
    return new ConversionResult(TableAssembler.assemble(index, columns, dewPoint), stats);
  }
}
