package ca.gc.cra.dfmet.infrastructure.persistence.text;

import ca.gc.cra.dfmet.application.port.OutputTarget;
import ca.gc.cra.dfmet.application.port.TableWriter;
import ca.gc.cra.dfmet.domain.table.AggregatedRow;
import ca.gc.cra.dfmet.domain.table.OutputTable;
import ca.gc.cra.dfmet.infrastructure.persistence.OutputFiles;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the observation table as comma-separated text ({@code <base>.txt}).
 * <p><strong>Format:</strong> one header line, then one line per row; {@code obs} as an integer, latitude and
 * longitude with 7 decimals, altitude and time with 2, every other column with 6; missing values as {@code NaN};
 * {@code \n} line endings; UTF-8.</p>
 * <p><strong>Role:</strong> Required output: a failure aborts the conversion.</p>
 *
 * @since 0.1.0
 */
public final class TextTableWriter implements TableWriter {
  private static final Logger log = LoggerFactory.getLogger(TextTableWriter.class);
  static final String EXTENSION = "txt";
  static final String HEADER =
      "obs,lat,lon,altitude,time,air_temp,dew_point,rel_hum,air_press,gpt,gpt_height,wind_speed,wind_dir";

  @Override
  public String name() {
    return "text";
  }

  @Override
  public boolean required() {
    return true;
  }

  @Override
  public Path outputFile(OutputTarget target) {
    return target.resolve(EXTENSION);
  }

  @Override
  public Path write(OutputTable table, OutputTarget target) throws IOException {
    Path out = outputFile(target);
    OutputFiles.write(out, target.allowOverwrite(), stream -> {
      Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
      writer.write(HEADER);
      writer.write('\n');
      for (AggregatedRow row : table.rows()) {
        writer.write(formatRow(row));
        writer.write('\n');
      }
      writer.flush();
    });
    log.info("Wrote {} rows to {}", table.size(), out);
    return out;
  }

  static String formatRow(AggregatedRow row) {
    StringBuilder sb = new StringBuilder(160);
    sb.append(row.observation());
    sb.append(',').append(FixedDecimal.format(row.latitude(), 7));
    sb.append(',').append(FixedDecimal.format(row.longitude(), 7));
    sb.append(',').append(FixedDecimal.format(row.altitude(), 2));
    sb.append(',').append(FixedDecimal.format(row.time(), 2));
    sb.append(',').append(FixedDecimal.format(row.airTemperature(), 6));
    sb.append(',').append(FixedDecimal.format(row.dewPoint(), 6));
    sb.append(',').append(FixedDecimal.format(row.relativeHumidity(), 6));
    sb.append(',').append(FixedDecimal.format(row.airPressure(), 6));
    sb.append(',').append(FixedDecimal.format(row.gpt(), 6));
    sb.append(',').append(FixedDecimal.format(row.gptHeight(), 6));
    sb.append(',').append(FixedDecimal.format(row.windSpeed(), 6));
    sb.append(',').append(FixedDecimal.format(row.windDirection(), 6));
    return sb.toString();
  }
}
