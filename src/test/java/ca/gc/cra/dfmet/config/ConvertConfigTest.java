package ca.gc.cra.dfmet.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dfmet.application.port.OutputTarget;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConvertConfigTest {
  @TempDir Path tempDir;

  private Map<String, String> options(String... keyValues) {
    Map<String, String> map = new HashMap<>(DefaultsForMode.asFlatMap("convert"));
    map.put("in", tempDir.resolve("logs/00000042.BIN").toString());
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put(keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  @Test
  void derivesOutputPlacementFromInput() {
    ConvertConfig config = ConvertConfig.fromMap(options());

    assertEquals(tempDir.resolve("logs").toAbsolutePath().normalize(), config.outputDirectory());
    assertEquals("00000042", config.baseName());
    assertEquals(InputFormat.DATAFLASH, config.resolvedInputFormat());
    assertEquals(9, config.smoothingWindow());
    assertEquals(18, config.gpsLeapSeconds());
    assertTrue(config.textOutput());
    assertTrue(config.netcdfOutput());
    assertFalse(config.allowOverwrite());

    OutputTarget target = config.outputTarget();
    assertEquals("00000042.BIN", target.sourceName());
    assertEquals(tempDir.resolve("logs/00000042.txt").toAbsolutePath().normalize(), target.resolve("txt"));
  }

  @Test
  void explicitValuesOverrideDerivedOnes() {
    ConvertConfig config = ConvertConfig.fromMap(options(
        "outDir", tempDir.resolve("out").toString(),
        "baseName", "sortie-3",
        "inputFormat", "ndjson",
        "positionRangeCheck", "TRUE",
        "smoothingWindow", "5",
        "gpsLeapSeconds", "0",
        "netcdfOutput", "false"));

    assertEquals(tempDir.resolve("out").toAbsolutePath().normalize(), config.outputDirectory());
    assertEquals("sortie-3", config.baseName());
    assertEquals(InputFormat.NDJSON, config.resolvedInputFormat());
    assertTrue(config.engineSettings().positionRangeCheck());
    assertEquals(5, config.engineSettings().smoothingWindow());
    assertEquals(0, config.gpsLeapSeconds());
    assertFalse(config.netcdfOutput());
  }

  @Test
  void withSwitchesReplacesOnlyTheSwitches() {
    ConvertConfig config = ConvertConfig.fromMap(options("smoothingWindow", "3")).withSwitches(true, true);

    assertTrue(config.allowOverwrite());
    assertTrue(config.dryRun());
    assertEquals(3, config.smoothingWindow());
  }

  @Test
  void rejectsInvalidValues() {
    Map<String, String> missingInput = options();
    missingInput.put("in", " ");

    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(missingInput));
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(options("smoothingWindow", "4")));
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(options("smoothingWindow", "nine")));
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(options("gpsLeapSeconds", "-1")));
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(options("textOutput", "yes")));
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(options("inputFormat", "csv")));
    assertThrows(IllegalArgumentException.class, () -> ConvertConfig.fromMap(options("baseName", "a/b")));
    assertThrows(IllegalArgumentException.class,
        () -> ConvertConfig.fromMap(options("textOutput", "false", "netcdfOutput", "false")));
  }
}
