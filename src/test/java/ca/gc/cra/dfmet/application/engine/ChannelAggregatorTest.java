package ca.gc.cra.dfmet.application.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dfmet.domain.sample.HumiditySample;
import ca.gc.cra.dfmet.domain.sample.InertialTemperatureSample;
import ca.gc.cra.dfmet.domain.sample.PositionSample;
import ca.gc.cra.dfmet.domain.sample.PressureSample;
import ca.gc.cra.dfmet.domain.sample.Sample;
import ca.gc.cra.dfmet.domain.sample.TemperatureSample;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class ChannelAggregatorTest {

  private static MasterIndex index(long... buckets) {
    return new MasterIndex(buckets);
  }

  @Test
  void firstPositionByDecodeOrderWinsRegardlessOfListOrder() {
    List<Sample> samples = List.of(
        new PositionSample(5, 10.1, 1.0, 1.0, 1.0),
        new PositionSample(2, 10.9, 2.0, 2.0, 2.0),
        new PositionSample(9, 10.0, 3.0, 3.0, 3.0));

    AggregatedColumns columns = new ChannelAggregator(false).aggregate(index(10), samples);

    assertEquals(2.0, columns.latitude()[0]);
    assertEquals(2.0, columns.altitude()[0]);
  }

  @Test
  void rangeCheckBlanksOutOfRangeFirstFix() {
    List<Sample> samples = List.of(
        new PositionSample(0, 10.1, 95.0, 10.0, 50.0),
        new PositionSample(1, 10.5, 45.0, 10.0, 50.0));

    AggregatedColumns checked = new ChannelAggregator(true).aggregate(index(10), samples);
    AggregatedColumns unchecked = new ChannelAggregator(false).aggregate(index(10), samples);

    assertTrue(Double.isNaN(checked.latitude()[0]));
    assertTrue(Double.isNaN(checked.longitude()[0]));
    assertTrue(Double.isNaN(checked.altitude()[0]));
    assertEquals(95.0, unchecked.latitude()[0]);
  }

  @Test
  void meansIgnoreNanAndEmptyBucketsStayNan() {
    List<Sample> samples = List.of(
        new PressureSample(0, 10.2, 1000.0, OptionalDouble.empty()),
        new PressureSample(1, 10.4, Double.NaN, OptionalDouble.empty()),
        new PressureSample(2, 10.6, 1002.0, OptionalDouble.empty()),
        new HumiditySample(3, 10.3, 40.0, OptionalDouble.empty()),
        new HumiditySample(4, 10.7, 60.0, OptionalDouble.empty()));

    AggregatedColumns columns = new ChannelAggregator(false).aggregate(index(10, 11), samples);

    assertEquals(1001.0, columns.airPressure()[0], 1e-9);
    assertEquals(50.0, columns.relativeHumidity()[0], 1e-9);
    assertTrue(Double.isNaN(columns.airPressure()[1]));
    assertTrue(Double.isNaN(columns.relativeHumidity()[1]));
    assertTrue(Double.isNaN(columns.airTemperature()[0]));
    assertTrue(Double.isNaN(columns.latitude()[1]));
  }

  @Test
  void channelWithNoSamplesYieldsNanColumnOfIndexLength() {
    List<Sample> samples = List.of(
        new PositionSample(0, 10.0, 45.0, -75.0, 100.0),
        new HumiditySample(1, 11.5, 55.0, OptionalDouble.empty()));

    AggregatedColumns columns = new ChannelAggregator(false).aggregate(index(10, 11, 12), samples);

    double[] pressure = columns.airPressure();
    assertEquals(3, pressure.length);
    for (double value : pressure) {
      assertTrue(Double.isNaN(value));
    }
    assertEquals(55.0, columns.relativeHumidity()[1], 1e-9);
  }

  @Test
  void airTemperaturePoolsEveryChannelContribution() {
    List<Sample> samples = List.of(
        new PressureSample(0, 10.1, 1000.0, OptionalDouble.of(20.0)),
        new TemperatureSample(1, 10.2, OptionalDouble.of(22.0), OptionalDouble.of(99.0), OptionalDouble.empty()),
        new HumiditySample(2, 10.3, 50.0, OptionalDouble.of(24.0)),
        new InertialTemperatureSample(3, 10.4, 30.0),
        new InertialTemperatureSample(4, 10.5, Double.NaN));

    AggregatedColumns columns = new ChannelAggregator(false).aggregate(index(10), samples);

    assertEquals(24.0, columns.airTemperature()[0], 1e-9);
  }

  @Test
  void samplesOutsideTheIndexAreIgnored() {
    List<Sample> samples = List.of(
        new PressureSample(0, 9.9, 900.0, OptionalDouble.of(5.0)),
        new PressureSample(1, 10.5, 1000.0, OptionalDouble.of(15.0)),
        new PressureSample(2, 12.0, 1100.0, OptionalDouble.of(25.0)));

    AggregatedColumns columns = new ChannelAggregator(false).aggregate(index(10), samples);

    assertEquals(1, columns.rows());
    assertEquals(1000.0, columns.airPressure()[0]);
    assertEquals(15.0, columns.airTemperature()[0]);
  }
}
