package ca.gc.cra.dfmet.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutputTableTest {

  private static AggregatedRow row(int observation, long time) {
    return new AggregatedRow(observation, time, 45.0, -75.0, 100.0, 20.0, 10.0, 50.0, 1000.0);
  }

  @Test
  void acceptsConsecutiveObservationsWithAscendingTimes() {
    OutputTable table = new OutputTable(List.of(row(1, 100), row(2, 101), row(3, 250)));

    assertEquals(3, table.size());
    assertEquals(250L, table.rows().get(2).time());
  }

  @Test
  void rejectsGapsInObservationNumbers() {
    assertThrows(IllegalArgumentException.class, () -> new OutputTable(List.of(row(1, 100), row(3, 101))));
    assertThrows(IllegalArgumentException.class, () -> new OutputTable(List.of(row(0, 100))));
  }

  @Test
  void rejectsRepeatedOrDescendingTimes() {
    assertThrows(IllegalArgumentException.class, () -> new OutputTable(List.of(row(1, 100), row(2, 100))));
    assertThrows(IllegalArgumentException.class, () -> new OutputTable(List.of(row(1, 100), row(2, 99))));
  }

  @Test
  void copiesRowsAndReportsUnavailableColumnsAsNan() {
    List<AggregatedRow> rows = new ArrayList<>(List.of(row(1, 100)));
    OutputTable table = new OutputTable(rows);
    rows.clear();

    assertEquals(1, table.size());
    AggregatedRow only = table.rows().get(0);
    assertTrue(Double.isNaN(only.gpt()));
    assertTrue(Double.isNaN(only.gptHeight()));
    assertTrue(Double.isNaN(only.windSpeed()));
    assertTrue(Double.isNaN(only.windDirection()));
    assertTrue(new OutputTable(List.of()).isEmpty());
  }
}
