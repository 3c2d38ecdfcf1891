package ca.gc.cra.dfmet.infrastructure.source.json;

import ca.gc.cra.dfmet.application.port.RecordSource;
import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import ca.gc.cra.dfmet.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RecordSource} reading newline-delimited JSON dumps of decoded DataFlash messages.
 * <p><strong>Why:</strong> Common log tools export {@code {"meta":{"type":..,"timestamp":..},"data":{..}}} per line;
 * accepting that form lets already-decoded logs be converted.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stream lines with the Jackson streaming parser (NaN and Infinity literals allowed).</li>
 *   <li>Keep numeric {@code data} members; ignore strings, booleans, nested values and unknown top-level members.</li>
 *   <li>Skip blank lines silently; skip malformed JSON and lines that are not valid UTF-8 with a warning.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single consumer.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordSource implements RecordSource {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordSource.class);
  private static final int MAX_LOGGED_LINE_BYTES = 200;

  private final Path file;
  private final JsonFactory factory =
      JsonFactory.builder().enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS).build();
  private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(256);
  private InputStream in;
  private long lineNumber;
  private long skipped;

  /**
   * Creates a source.
   *
   * @param file NDJSON file; must not be {@code null}
   */
  public NdjsonRecordSource(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public void open() throws IOException {
    in = new BufferedInputStream(Files.newInputStream(file));
    lineNumber = 0;
    skipped = 0;
    log.info("Opened NDJSON record file {}", file);
  }

  @Override
  public DecodedRecord next() throws IOException {
    if (in == null) {
      throw new IllegalStateException("NDJSON source not opened");
    }
    byte[] raw;
    while ((raw = readLineBytes()) != null) {
      lineNumber++;
      String line;
      try {
        line = decodeUtf8(raw);
      } catch (CharacterCodingException ex) {
        skipped++;
        log.warn("Skipping line {} of {}: not valid UTF-8 ({})",
            lineNumber, file, Logs.hexPreview(raw, 0, MAX_LOGGED_LINE_BYTES / 2));
        continue;
      }
      if (line.isBlank()) {
        continue;
      }
      try {
        return parseLine(line);
      } catch (JsonParseException | IllegalArgumentException ex) {
        skipped++;
        log.warn("Skipping malformed line {} of {}: {} ({})",
            lineNumber, file, describe(ex), Logs.truncate(line, MAX_LOGGED_LINE_BYTES));
      }
    }
    return null;
  }

  @Override
  public long skipped() {
    return skipped;
  }

  @Override
  public void close() throws IOException {
    if (in != null) {
      try {
        in.close();
      } finally {
        in = null;
        log.debug("Closed NDJSON record file {} after {} lines ({} skipped)", file, lineNumber, skipped);
      }
    }
  }

  DecodedRecord parseLine(String line) throws IOException {
    try (JsonParser parser = factory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("line is not a JSON object");
      }
      String type = null;
      Double timestamp = null;
      Map<String, Double> fields = null;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String member = parser.currentName();
        JsonToken value = parser.nextToken();
        if ("meta".equals(member) && value == JsonToken.START_OBJECT) {
          while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String key = parser.currentName();
            JsonToken metaValue = parser.nextToken();
            if ("type".equals(key) && metaValue == JsonToken.VALUE_STRING) {
              type = parser.getText();
            } else if ("timestamp".equals(key) && metaValue.isNumeric()) {
              timestamp = parser.getDoubleValue();
            } else {
              parser.skipChildren();
            }
          }
        } else if ("data".equals(member) && value == JsonToken.START_OBJECT) {
          fields = readNumericMembers(parser);
        } else {
          parser.skipChildren();
        }
      }
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("trailing content after JSON object");
      }
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("missing meta.type");
      }
      if (timestamp == null) {
        throw new IllegalArgumentException("missing numeric meta.timestamp");
      }
      return new DecodedRecord(timestamp, type, fields == null ? Map.of() : fields);
    }
  }

  /** Returns the next line without its terminator, or {@code null} at end of file. */
  private byte[] readLineBytes() throws IOException {
    lineBuffer.reset();
    int b;
    boolean any = false;
    while ((b = in.read()) != -1) {
      any = true;
      if (b == '\n') {
        break;
      }
      lineBuffer.write(b);
    }
    if (!any) {
      return null;
    }
    byte[] line = lineBuffer.toByteArray();
    int length = line.length;
    if (length > 0 && line[length - 1] == '\r') {
      byte[] trimmed = new byte[length - 1];
      System.arraycopy(line, 0, trimmed, 0, length - 1);
      return trimmed;
    }
    return line;
  }

  // Strict decoder: malformed input is reported rather than replaced.
  private static String decodeUtf8(byte[] raw) throws CharacterCodingException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
    return decoder.decode(ByteBuffer.wrap(raw)).toString();
  }

  private static String describe(Exception ex) {
    if (ex instanceof JsonParseException parse) {
      return parse.getOriginalMessage();
    }
    return ex.getMessage();
  }

  private static Map<String, Double> readNumericMembers(JsonParser parser) throws IOException {
    Map<String, Double> fields = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String key = parser.currentName();
      JsonToken value = parser.nextToken();
      if (value.isNumeric()) {
        fields.put(key, parser.getDoubleValue());
      } else {
        parser.skipChildren();
      }
    }
    return fields;
  }
}
