package ca.gc.cra.dfmet.infrastructure.source.dataflash;

import ca.gc.cra.dfmet.application.port.RecordSource;
import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import ca.gc.cra.dfmet.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RecordSource} that decodes ArduPilot DataFlash binary logs ({@code .bin}).
 * <p><strong>Why:</strong> Lets the converter read autopilot logs directly instead of depending on an external dump
 * tool.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the record-source port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Frame messages on the {@code 0xA3 0x95} header and decode them with the layouts declared by {@code FMT}.</li>
 *   <li>Anchor the log clock on the first GPS message with a valid week and stamp every record in Unix seconds.</li>
 *   <li>Skip garbage, unknown ids, truncated messages and untimed messages, counting each.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single consumer.</p>
 * <p><strong>Performance:</strong> Reads the whole file into memory and makes two passes: the first registers formats
 * and finds the clock anchor, the second yields records.</p>
 *
 * @implNote Formats are registered in the first pass, so the second pass can decode a message that precedes its
 *     {@code FMT}.
 * @since 0.1.0
 */
public final class DataFlashLogReader implements RecordSource {
  private static final Logger log = LoggerFactory.getLogger(DataFlashLogReader.class);
  static final int HEAD1 = 0xA3;
  static final int HEAD2 = 0x95;
  private static final int PREVIEW_BYTES = 16;

  private final Path file;
  private final int leapSeconds;
  private final Map<Integer, DataFlashFormat> formats = new HashMap<>();
  private byte[] data;
  private LogClock clock;
  private int position;
  private long skipped;
  private long emitted;

  /**
   * Creates a reader.
   *
   * @param file DataFlash log; must not be {@code null}
   * @param leapSeconds GPS minus UTC offset applied to the clock anchor
   */
  public DataFlashLogReader(Path file, int leapSeconds) {
    this.file = Objects.requireNonNull(file, "file");
    this.leapSeconds = leapSeconds;
  }

  @Override
  public void open() throws IOException {
    data = Files.readAllBytes(file);
    formats.clear();
    formats.put(DataFlashFormat.FMT_TYPE, DataFlashFormat.FMT);
    position = 0;
    skipped = 0;
    emitted = 0;
    clock = scan();
    if (clock.absolute()) {
      log.info("Opened DataFlash log {} ({} bytes, {} formats); clock anchored at Unix {}",
          file, data.length, formats.size(), clock.anchorUnix());
    } else {
      log.warn("DataFlash log {} has no GPS message with a valid week; timestamps are seconds since boot", file);
    }
  }

  @Override
  public DecodedRecord next() throws IOException {
    if (data == null) {
      throw new IllegalStateException("DataFlash reader not opened");
    }
    while (position + DataFlashFormat.HEADER_LENGTH <= data.length) {
      if (!isHeader(position)) {
        int start = position;
        position = nextHeader(position + 1);
        skipped++;
        log.warn("Skipped {} unframed bytes at offset {} in {}: {}",
            position - start, start, file, Logs.hexPreview(data, start, PREVIEW_BYTES));
        continue;
      }
      int id = Byte.toUnsignedInt(data[position + 2]);
      DataFlashFormat format = formats.get(id);
      if (format == null) {
        skipped++;
        log.warn("Unknown DataFlash message id {} at offset {} in {}; resynchronising", id, position, file);
        position++;
        continue;
      }
      if (position + format.length() > data.length) {
        skipped++;
        log.warn("Truncated {} message at offset {} in {} ({} of {} bytes)",
            format.name(), position, file, data.length - position, format.length());
        position = data.length;
        break;
      }
      int offset = position;
      position += format.length();
      if (id == DataFlashFormat.FMT_TYPE) {
        continue;
      }
      Map<String, Double> fields = format.decode(data, offset);
      OptionalDouble micros = timeMicros(fields);
      if (micros.isEmpty()) {
        skipped++;
        log.debug("Skipping {} message at offset {} without a time field", format.name(), offset);
        continue;
      }
      emitted++;
      return new DecodedRecord(clock.toUnixSeconds(micros.getAsDouble()), format.name(), fields);
    }
    return null;
  }

  @Override
  public long skipped() {
    return skipped;
  }

  /**
   * Returns whether record timestamps are GPS-anchored Unix seconds.
   *
   * @return {@code true} once opened on a log with a usable GPS week
   */
  public boolean clockAnchored() {
    return clock != null && clock.absolute();
  }

  @Override
  public void close() {
    if (data != null) {
      log.debug("Closed DataFlash log {} after {} records ({} skipped)", file, emitted, skipped);
    }
    data = null;
  }

  private LogClock scan() {
    LogClock anchor = null;
    int p = 0;
    while (p + DataFlashFormat.HEADER_LENGTH <= data.length) {
      if (!isHeader(p)) {
        p++;
        continue;
      }
      int id = Byte.toUnsignedInt(data[p + 2]);
      DataFlashFormat format = formats.get(id);
      if (format == null || p + format.length() > data.length) {
        p++;
        continue;
      }
      if (id == DataFlashFormat.FMT_TYPE) {
        register(p);
      } else if (anchor == null && "GPS".equals(format.name())) {
        anchor = anchorFrom(format.decode(data, p));
      }
      p += format.length();
    }
    return anchor == null ? LogClock.BOOT_RELATIVE : anchor;
  }

  private void register(int offset) {
    DataFlashFormat declared;
    try {
      declared = DataFlashFormat.parseFmt(data, offset);
    } catch (IllegalArgumentException ex) {
      skipped++;
      log.warn("Rejected FMT message at offset {} in {}: {}", offset, file, ex.getMessage());
      return;
    }
    if (declared.type() == DataFlashFormat.FMT_TYPE) {
      return;
    }
    DataFlashFormat previous = formats.put(declared.type(), declared);
    if (previous != null && !previous.equals(declared)) {
      log.warn("FMT for message id {} redefined from {} to {}", declared.type(), previous.name(), declared.name());
    }
  }

  private LogClock anchorFrom(Map<String, Double> gps) {
    Double week = gps.get("GWk");
    Double millis = gps.get("GMS");
    OptionalDouble micros = timeMicros(gps);
    if (week == null || millis == null || micros.isEmpty() || !(week > 0)) {
      return null;
    }
    return LogClock.anchored(week, millis, micros.getAsDouble(), leapSeconds);
  }

  private static OptionalDouble timeMicros(Map<String, Double> fields) {
    Double micros = fields.get("TimeUS");
    if (micros != null) {
      return OptionalDouble.of(micros);
    }
    Double millis = fields.get("TimeMS");
    return millis == null ? OptionalDouble.empty() : OptionalDouble.of(millis * 1000.0);
  }

  private boolean isHeader(int offset) {
    return Byte.toUnsignedInt(data[offset]) == HEAD1 && Byte.toUnsignedInt(data[offset + 1]) == HEAD2;
  }

  private int nextHeader(int from) {
    int p = from;
    while (p + 1 < data.length && !isHeader(p)) {
      p++;
    }
    return p + 1 < data.length ? p : data.length;
  }
}
