package ca.gc.cra.dfmet.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PathUtilsTest {

  @Test
  void splitsBaseNameAndExtension() {
    Path log = Path.of("logs", "00000042.BIN");

    assertEquals(Optional.of("00000042.BIN"), PathUtils.fileName(log));
    assertEquals(Optional.of("00000042"), PathUtils.baseName(log));
    assertEquals(Optional.of("bin"), PathUtils.extension(log));
  }

  @Test
  void handlesDotFilesAndMissingExtensions() {
    assertEquals(Optional.of(".hidden"), PathUtils.baseName(Path.of(".hidden")));
    assertTrue(PathUtils.extension(Path.of(".hidden")).isEmpty());
    assertTrue(PathUtils.extension(Path.of("flight.")).isEmpty());
    assertEquals(Optional.of("archive.tar"), PathUtils.baseName(Path.of("archive.tar.gz")));
    assertTrue(PathUtils.fileName(null).isEmpty());
  }
}
