package ca.gc.cra.dfmet.infrastructure.source.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonRecordSourceTest {
  @TempDir Path tempDir;

  private static List<DecodedRecord> readAll(NdjsonRecordSource source) throws IOException {
    List<DecodedRecord> records = new ArrayList<>();
    source.open();
    DecodedRecord record;
    while ((record = source.next()) != null) {
      records.add(record);
    }
    return records;
  }

  @Test
  void readsFixtureSkippingBlankAndMalformedLines() throws IOException, URISyntaxException {
    Path fixture = Path.of(getClass().getResource("/fixtures/flight.ndjson").toURI());

    try (NdjsonRecordSource source = new NdjsonRecordSource(fixture)) {
      List<DecodedRecord> records = readAll(source);

      assertEquals(7, records.size());
      assertEquals(1L, source.skipped());
      DecodedRecord first = records.get(0);
      assertEquals("GPS", first.type());
      assertEquals(1_700_000_000.2, first.timestamp(), 1e-9);
      assertEquals(45.4215, first.field("Lat").getAsDouble(), 1e-12);
    }
  }

  @Test
  void keepsNumericDataMembersOnly() throws IOException {
    NdjsonRecordSource source = new NdjsonRecordSource(tempDir.resolve("unused.ndjson"));

    DecodedRecord record = source.parseLine(
        "{\"meta\":{\"type\":\"BARO\",\"timestamp\":12.5,\"seq\":[1,2]},"
            + "\"data\":{\"Press\":1000,\"Temp\":NaN,\"Label\":\"x\",\"Nested\":{\"a\":1},\"Flag\":true},"
            + "\"extra\":[1,{\"b\":2}]}");

    assertEquals("BARO", record.type());
    assertEquals(12.5, record.timestamp());
    assertEquals(1000.0, record.field("Press").getAsDouble());
    assertTrue(Double.isNaN(record.field("Temp").getAsDouble()));
    assertFalse(record.field("Label").isPresent());
    assertFalse(record.field("Nested").isPresent());
    assertFalse(record.field("Flag").isPresent());
  }

  @Test
  void recordsWithoutDataHaveNoFields() throws IOException {
    NdjsonRecordSource source = new NdjsonRecordSource(tempDir.resolve("unused.ndjson"));

    DecodedRecord record = source.parseLine("{\"meta\":{\"type\":\"MSG\",\"timestamp\":1}}");

    assertTrue(record.fields().isEmpty());
  }

  @Test
  void rejectsMissingMetaAndTrailingContent() {
    NdjsonRecordSource source = new NdjsonRecordSource(tempDir.resolve("unused.ndjson"));

    assertThrows(IllegalArgumentException.class,
        () -> source.parseLine("{\"meta\":{\"timestamp\":1},\"data\":{}}"));
    assertThrows(IllegalArgumentException.class,
        () -> source.parseLine("{\"meta\":{\"type\":\"GPS\",\"timestamp\":\"soon\"}}"));
    assertThrows(IllegalArgumentException.class,
        () -> source.parseLine("{\"meta\":{\"type\":\"GPS\",\"timestamp\":1}} {\"meta\":{}}"));
    assertThrows(IllegalArgumentException.class, () -> source.parseLine("[1,2,3]"));
  }

  @Test
  void truncatedLinesAreSkippedAndCounted() throws IOException {
    Path file = tempDir.resolve("cut.ndjson");
    Files.writeString(file,
        "{\"meta\":{\"type\":\"GPS\",\"timestamp\":1},\"data\":{\"Lat\":1,\"Lng\":2,\"Alt\":3}}\n"
            + "{\"meta\":{\"type\":\"GPS\",\"timest\n"
            + "   \n",
        StandardCharsets.UTF_8);

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      List<DecodedRecord> records = readAll(source);

      assertEquals(1, records.size());
      assertEquals(1L, source.skipped());
    }
  }

  @Test
  void invalidUtf8LineIsSkippedAndReadingContinues() throws IOException {
    byte[] gps = "{\"meta\":{\"type\":\"GPS\",\"timestamp\":1},\"data\":{\"Lat\":1,\"Lng\":2,\"Alt\":3}}"
        .getBytes(StandardCharsets.UTF_8);
    ByteArrayOutputStream content = new ByteArrayOutputStream();
    content.write(gps);
    content.write('\n');
    content.write(new byte[] {'{', '"', (byte) 0xC3, 0x28, '"', '}', '\r', '\n'});
    content.write(gps);
    Path file = tempDir.resolve("latin.ndjson");
    Files.write(file, content.toByteArray());

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      List<DecodedRecord> records = readAll(source);

      assertEquals(2, records.size());
      assertEquals(1L, source.skipped());
      assertEquals(1.0, records.get(1).field("Lat").getAsDouble());
    }
  }

  @Test
  void crlfLineEndingsAreAccepted() throws IOException {
    Path file = tempDir.resolve("windows.ndjson");
    Files.writeString(file,
        "{\"meta\":{\"type\":\"BARO\",\"timestamp\":2},\"data\":{\"Press\":1000}}\r\n\r\n",
        StandardCharsets.UTF_8);

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      List<DecodedRecord> records = readAll(source);

      assertEquals(1, records.size());
      assertEquals(0L, source.skipped());
    }
  }

  @Test
  void nextBeforeOpenFails() {
    NdjsonRecordSource source = new NdjsonRecordSource(tempDir.resolve("unused.ndjson"));
    assertThrows(IllegalStateException.class, source::next);
  }
}
