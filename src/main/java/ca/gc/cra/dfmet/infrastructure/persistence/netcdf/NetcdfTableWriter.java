package ca.gc.cra.dfmet.infrastructure.persistence.netcdf;

import ca.gc.cra.dfmet.application.port.ClockPort;
import ca.gc.cra.dfmet.application.port.OutputTarget;
import ca.gc.cra.dfmet.application.port.TableWriter;
import ca.gc.cra.dfmet.domain.table.AggregatedRow;
import ca.gc.cra.dfmet.domain.table.OutputTable;
import ca.gc.cra.dfmet.infrastructure.persistence.OutputFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the observation table as a CF-style NetCDF classic file ({@code <base>.nc}).
 * <p><strong>Layout:</strong> one {@code time} dimension; coordinates {@code time} (double, Unix seconds) and
 * {@code observation} (int); double data variables with {@code units}, {@code long_name}, {@code standard_name} and
 * a NaN {@code _FillValue}.</p>
 * <p><strong>Role:</strong> Optional output: a failure is reported but the text table is kept.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected clock.</p>
 *
 * @since 0.1.0
 */
public final class NetcdfTableWriter implements TableWriter {
  private static final Logger log = LoggerFactory.getLogger(NetcdfTableWriter.class);
  static final String EXTENSION = "nc";
  static final String DIMENSION = "time";
  static final String TIME_UNITS = "seconds since 1970-01-01 00:00:00";

  private final ClockPort clock;

  /**
   * Creates a writer.
   *
   * @param clock clock used for the {@code history} attribute
   */
  public NetcdfTableWriter(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return "netcdf";
  }

  @Override
  public boolean required() {
    return false;
  }

  @Override
  public Path outputFile(OutputTarget target) {
    return target.resolve(EXTENSION);
  }

  @Override
  public Path write(OutputTable table, OutputTarget target) throws IOException {
    Path out = outputFile(target);
    byte[] bytes = encode(table, target.sourceName());
    OutputFiles.write(out, target.allowOverwrite(), stream -> stream.write(bytes));
    log.info("Wrote {} observations ({} bytes) to {}", table.size(), bytes.length, out);
    return out;
  }

  byte[] encode(OutputTable table, String sourceName) throws IOException {
    List<AggregatedRow> rows = table.rows();
    int n = rows.size();
    ClassicNetcdfEncoder nc = new ClassicNetcdfEncoder()
        .dimension(DIMENSION, n)
        .globalAttribute("Conventions", "CF-1.6")
        .globalAttribute("title", "Per-second meteorological observations")
        .globalAttribute("source", sourceName)
        .globalAttribute("history", Instant.ofEpochMilli(clock.nowMillis()) + " created by dfmet");

    nc.doubleVariable("time", DIMENSION, column(rows, row -> row.time()))
        .attribute("units", TIME_UNITS)
        .attribute("long_name", "Time")
        .attribute("standard_name", "time")
        .attribute("comment", "Absolute time in UTC")
        .attribute("calendar", "standard");
    int[] observation = new int[n];
    for (int i = 0; i < n; i++) {
      observation[i] = rows.get(i).observation();
    }
    nc.intVariable("observation", DIMENSION, observation)
        .attribute("long_name", "Observation number");

    data(nc, "latitude", column(rows, AggregatedRow::latitude), "degrees_north", "Latitude");
    data(nc, "longitude", column(rows, AggregatedRow::longitude), "degrees_east", "Longitude");
    data(nc, "altitude", column(rows, AggregatedRow::altitude), "meters", "Altitude above mean sea level")
        .attribute("positive", "up");
    data(nc, "air_temperature", column(rows, AggregatedRow::airTemperature), "degree_Celsius", "Air temperature");
    data(nc, "dew_point_temperature", column(rows, AggregatedRow::dewPoint), "degree_Celsius",
        "Dew point temperature");
    data(nc, "relative_humidity", column(rows, AggregatedRow::relativeHumidity), "percent", "Relative humidity");
    data(nc, "air_pressure", column(rows, AggregatedRow::airPressure), "hPa", "Air pressure");
    return nc.encode();
  }

  private static ClassicNetcdfEncoder.Variable data(
      ClassicNetcdfEncoder nc, String name, double[] values, String units, String longName) {
    return nc.doubleVariable(name, DIMENSION, values)
        .attribute("_FillValue", Double.NaN)
        .attribute("units", units)
        .attribute("long_name", longName)
        .attribute("standard_name", name);
  }

  private static double[] column(List<AggregatedRow> rows, ToDoubleFunction<AggregatedRow> accessor) {
    double[] out = new double[rows.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = accessor.applyAsDouble(rows.get(i));
    }
    return out;
  }
}
