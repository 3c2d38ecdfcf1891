package ca.gc.cra.dfmet.application.engine;

import ca.gc.cra.dfmet.domain.table.AggregatedRow;
import ca.gc.cra.dfmet.domain.table.OutputTable;
import java.util.ArrayList;
import java.util.List;

/**
 * Zips the master index and the final columns into an {@link OutputTable}.
 *
 * @since 0.1.0
 */
final class TableAssembler {
  private TableAssembler() {}

  static OutputTable assemble(MasterIndex index, AggregatedColumns columns, double[] dewPoint) {
    int rows = index.size();
    if (columns.rows() != rows || dewPoint.length != rows) {
      throw new IllegalStateException("column length does not match master index size " + rows);
    }
    List<AggregatedRow> out = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      out.add(
          new AggregatedRow(
              i + 1,
              index.bucket(i),
              columns.latitude()[i],
              columns.longitude()[i],
              columns.altitude()[i],
              columns.airTemperature()[i],
              dewPoint[i],
              columns.relativeHumidity()[i],
              columns.airPressure()[i]));
    }
    return new OutputTable(out);
  }
}
