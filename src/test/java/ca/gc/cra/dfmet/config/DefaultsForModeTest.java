package ca.gc.cra.dfmet.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void convertDefaultsIncludeCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("convert");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("AUTO", defaults.get("inputFormat"));
    assertEquals("9", defaults.get("smoothingWindow"));
    assertEquals("18", defaults.get("gpsLeapSeconds"));
    assertEquals("false", defaults.get("positionRangeCheck"));
    assertEquals("true", defaults.get("textOutput"));
    assertEquals("true", defaults.get("netcdfOutput"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
