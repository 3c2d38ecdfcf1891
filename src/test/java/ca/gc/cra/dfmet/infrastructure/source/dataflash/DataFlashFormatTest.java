package ca.gc.cra.dfmet.infrastructure.source.dataflash;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DataFlashFormatTest {

  @Test
  void parsesFmtDeclaration() {
    byte[] log = new DataFlashLogBuilder()
        .fmt(DataFlashLogBuilder.BARO, "BARO", DataFlashLogBuilder.BARO_FORMAT, DataFlashLogBuilder.BARO_COLUMNS)
        .build();

    DataFlashFormat format = DataFlashFormat.parseFmt(log, 0);

    assertEquals(DataFlashLogBuilder.BARO, format.type());
    assertEquals(21, format.length());
    assertEquals("BARO", format.name());
    assertEquals(List.of("TimeUS", "Alt", "Press", "Temp"), format.columns());
  }

  @Test
  void decodesSignedUnsignedAndScaledColumnsSkippingStrings() {
    DataFlashFormat format = new DataFlashFormat(
        200, 3 + 1 + 2 + 4 + 4 + 2 + 4, "MIX", "bHnecL", List.of("S8", "U16", "Label", "Cm", "Cd", "Deg"));
    ByteBuffer payload = DataFlashLogBuilder.le(17)
        .put((byte) -5)
        .putShort((short) 0xFFFF)
        .put(new byte[] {'a', 'b', 'c', 'd'})
        .putInt(-12345)
        .putShort((short) -250)
        .putInt(-1_234_567_890);
    byte[] log = new DataFlashLogBuilder().message(200, payload.array()).build();

    Map<String, Double> fields = format.decode(log, 0);

    assertEquals(-5.0, fields.get("S8"));
    assertEquals(65535.0, fields.get("U16"));
    assertFalse(fields.containsKey("Label"));
    assertEquals(-123.45, fields.get("Cm"), 1e-9);
    assertEquals(-2.5, fields.get("Cd"), 1e-9);
    assertEquals(-123.456789, fields.get("Deg"), 1e-9);
  }

  @Test
  void rejectsInconsistentDeclarations() {
    assertThrows(IllegalArgumentException.class,
        () -> new DataFlashFormat(150, 12, "X", "Q", List.of("TimeUS", "Extra")));
    assertThrows(IllegalArgumentException.class,
        () -> new DataFlashFormat(150, 12, "X", "Q", List.of("TimeUS")));
    assertThrows(IllegalArgumentException.class,
        () -> new DataFlashFormat(150, 4, "X", "?", List.of("Odd")));
  }

  @Test
  void logClockConvertsGpsWeekTime() {
    LogClock clock = LogClock.anchored(2290, 100_000, 5_000_000, 18);

    assertEquals(1_700_956_882.0, clock.anchorUnix(), 1e-6);
    assertEquals(1_700_956_883.5, clock.toUnixSeconds(6_500_000), 1e-6);
    assertEquals(4.0, LogClock.BOOT_RELATIVE.toUnixSeconds(4_000_000), 1e-12);
  }
}
