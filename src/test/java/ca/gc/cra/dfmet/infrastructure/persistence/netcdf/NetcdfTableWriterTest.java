package ca.gc.cra.dfmet.infrastructure.persistence.netcdf;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dfmet.application.port.OutputTarget;
import ca.gc.cra.dfmet.domain.table.AggregatedRow;
import ca.gc.cra.dfmet.domain.table.OutputTable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetcdfTableWriterTest {
  private static final long FIXED_MILLIS = 1_700_000_000_000L;

  @TempDir Path tempDir;

  private final NetcdfTableWriter writer = new NetcdfTableWriter(() -> FIXED_MILLIS);

  private static OutputTable table() {
    return new OutputTable(List.of(
        new AggregatedRow(1, 1_700_000_000L, 45.0, -75.0, 100.0, 20.0, 9.3, 50.0, 1013.0),
        new AggregatedRow(2, 1_700_000_001L, 45.1, -75.1, 101.0, Double.NaN, Double.NaN, 55.0, 1012.0),
        new AggregatedRow(3, 1_700_000_005L, 45.2, -75.2, 102.0, 21.0, 10.1, Double.NaN, Double.NaN)));
  }

  private static boolean contains(byte[] haystack, String needle) {
    byte[] target = needle.getBytes(StandardCharsets.UTF_8);
    outer:
    for (int i = 0; i + target.length <= haystack.length; i++) {
      for (int j = 0; j < target.length; j++) {
        if (haystack[i + j] != target[j]) {
          continue outer;
        }
      }
      return true;
    }
    return false;
  }

  @Test
  void encodesCfMetadataAndEveryVariable() throws IOException {
    byte[] bytes = writer.encode(table(), "flight.bin");

    assertArrayEquals(ClassicNetcdfEncoder.MAGIC, Arrays.copyOf(bytes, 4));
    ByteBuffer buf = ByteBuffer.wrap(bytes);
    assertEquals(ClassicNetcdfEncoder.NC_DIMENSION, buf.getInt(8));
    assertEquals(1, buf.getInt(12));
    assertEquals(4, buf.getInt(16));
    assertEquals(3, buf.getInt(24));

    for (String name : List.of("time", "observation", "latitude", "longitude", "altitude", "air_temperature",
        "dew_point_temperature", "relative_humidity", "air_pressure")) {
      assertTrue(contains(bytes, name), "missing variable " + name);
    }
    assertTrue(contains(bytes, "CF-1.6"));
    assertTrue(contains(bytes, "flight.bin"));
    assertTrue(contains(bytes, "seconds since 1970-01-01 00:00:00"));
    assertTrue(contains(bytes, "degree_Celsius"));
    assertTrue(contains(bytes, "2023-11-14T22:13:20Z created by dfmet"));
  }

  @Test
  void dataSectionEndsWithLastVariableValues() throws IOException {
    byte[] bytes = writer.encode(table(), "flight.bin");
    ByteBuffer buf = ByteBuffer.wrap(bytes);

    int pressureStart = bytes.length - 3 * Double.BYTES;
    assertEquals(1013.0, buf.getDouble(pressureStart));
    assertEquals(1012.0, buf.getDouble(pressureStart + 8));
    assertTrue(Double.isNaN(buf.getDouble(pressureStart + 16)));
    int humidityStart = pressureStart - 3 * Double.BYTES;
    assertEquals(50.0, buf.getDouble(humidityStart));
    assertEquals(55.0, buf.getDouble(humidityStart + 8));
  }

  @Test
  void writesNcFileAndHonoursOverwritePolicy() throws IOException {
    OutputTarget target = new OutputTarget(tempDir, "flight", "flight.bin", false);

    Path out = writer.write(table(), target);

    assertEquals(tempDir.resolve("flight.nc"), out);
    assertArrayEquals(writer.encode(table(), "flight.bin"), Files.readAllBytes(out));
    assertThrows(FileAlreadyExistsException.class, () -> writer.write(table(), target));
    writer.write(table(), new OutputTarget(tempDir, "flight", "flight.bin", true));
    assertFalse(writer.required());
    assertEquals("netcdf", writer.name());
  }
}
