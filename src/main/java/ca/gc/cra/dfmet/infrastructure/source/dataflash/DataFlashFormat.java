package ca.gc.cra.dfmet.infrastructure.source.dataflash;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Message layout declared by a DataFlash {@code FMT} message.
 *
 * <p>Each character of {@code format} describes one little-endian payload column:
 * <ul>
 *   <li>{@code b B M} 8-bit, {@code h H} 16-bit, {@code i I f} 32-bit, {@code q Q d} 64-bit integers and floats</li>
 *   <li>{@code c C} 16-bit and {@code e E} 32-bit integers scaled by 0.01</li>
 *   <li>{@code L} 32-bit latitude/longitude scaled by 1e-7</li>
 *   <li>{@code n N Z a} 4, 16 and 64 byte strings and a 64 byte array, skipped</li>
 * </ul>
 *
 * @param type message id
 * @param length total message length including the three header bytes
 * @param name message name (e.g., {@code GPS})
 * @param format column format characters
 * @param columns column names, one per format character
 * @since 0.1.0
 */
record DataFlashFormat(int type, int length, String name, String format, List<String> columns) {
  static final int HEADER_LENGTH = 3;
  static final int FMT_TYPE = 128;
  static final int FMT_LENGTH = 89;

  /** Layout of the {@code FMT} message itself. */
  static final DataFlashFormat FMT =
      new DataFlashFormat(FMT_TYPE, FMT_LENGTH, "FMT", "BBnNZ", List.of("Type", "Length", "Name", "Format", "Columns"));

  DataFlashFormat {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(format, "format");
    columns = List.copyOf(columns);
    if (columns.size() != format.length()) {
      throw new IllegalArgumentException(
          name + ": " + columns.size() + " columns for " + format.length() + " format characters");
    }
    int payload = 0;
    for (int i = 0; i < format.length(); i++) {
      int size = sizeOf(format.charAt(i));
      if (size < 0) {
        throw new IllegalArgumentException(name + ": unsupported format character '" + format.charAt(i) + "'");
      }
      payload += size;
    }
    if (payload + HEADER_LENGTH != length) {
      throw new IllegalArgumentException(
          name + ": declared length " + length + " does not match format size " + (payload + HEADER_LENGTH));
    }
  }

  /**
   * Decodes the numeric columns of one message.
   *
   * @param data log bytes
   * @param messageOffset offset of the message header
   * @return numeric fields in column order
   */
  Map<String, Double> decode(byte[] data, int messageOffset) {
    ByteBuffer buf = ByteBuffer.wrap(data, messageOffset + HEADER_LENGTH, length - HEADER_LENGTH)
        .order(ByteOrder.LITTLE_ENDIAN);
    Map<String, Double> fields = new LinkedHashMap<>();
    for (int i = 0; i < format.length(); i++) {
      char c = format.charAt(i);
      String column = columns.get(i);
      switch (c) {
        case 'b' -> fields.put(column, (double) buf.get());
        case 'B', 'M' -> fields.put(column, (double) Byte.toUnsignedInt(buf.get()));
        case 'h' -> fields.put(column, (double) buf.getShort());
        case 'H' -> fields.put(column, (double) Short.toUnsignedInt(buf.getShort()));
        case 'i' -> fields.put(column, (double) buf.getInt());
        case 'I' -> fields.put(column, (double) Integer.toUnsignedLong(buf.getInt()));
        case 'f' -> fields.put(column, (double) buf.getFloat());
        case 'd' -> fields.put(column, buf.getDouble());
        case 'q' -> fields.put(column, (double) buf.getLong());
        case 'Q' -> fields.put(column, unsignedToDouble(buf.getLong()));
        case 'c' -> fields.put(column, buf.getShort() * 0.01);
        case 'C' -> fields.put(column, Short.toUnsignedInt(buf.getShort()) * 0.01);
        case 'e' -> fields.put(column, buf.getInt() * 0.01);
        case 'E' -> fields.put(column, Integer.toUnsignedLong(buf.getInt()) * 0.01);
        case 'L' -> fields.put(column, buf.getInt() * 1e-7);
        default -> buf.position(buf.position() + sizeOf(c));
      }
    }
    return fields;
  }

  /**
   * Reads a NUL-padded ASCII string column.
   *
   * @param data log bytes
   * @param offset first byte
   * @param width column width
   * @return string up to the first NUL, trimmed
   */
  static String readString(byte[] data, int offset, int width) {
    int end = offset;
    while (end < offset + width && data[end] != 0) {
      end++;
    }
    return new String(data, offset, end - offset, StandardCharsets.US_ASCII).trim();
  }

  /**
   * Parses the payload of an {@code FMT} message.
   *
   * @param data log bytes
   * @param messageOffset offset of the {@code FMT} header
   * @return declared format
   * @throws IllegalArgumentException when the declaration is inconsistent
   */
  static DataFlashFormat parseFmt(byte[] data, int messageOffset) {
    int p = messageOffset + HEADER_LENGTH;
    int type = Byte.toUnsignedInt(data[p]);
    int length = Byte.toUnsignedInt(data[p + 1]);
    String name = readString(data, p + 2, 4);
    String format = readString(data, p + 6, 16);
    String columns = readString(data, p + 22, 64);
    List<String> names = columns.isEmpty() ? List.of() : List.of(columns.split(",", -1));
    return new DataFlashFormat(type, length, name, format, names);
  }

  static int sizeOf(char c) {
    return switch (c) {
      case 'b', 'B', 'M' -> 1;
      case 'h', 'H', 'c', 'C' -> 2;
      case 'i', 'I', 'f', 'e', 'E', 'L', 'n' -> 4;
      case 'd', 'q', 'Q' -> 8;
      case 'N' -> 16;
      case 'Z', 'a' -> 64;
      default -> -1;
    };
  }

  private static double unsignedToDouble(long value) {
    if (value >= 0) {
      return value;
    }
    return ((value >>> 1) | (value & 1)) * 2.0;
  }
}
