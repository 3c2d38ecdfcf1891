package ca.gc.cra.dfmet.infrastructure.source.dataflash;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Builds DataFlash log images for reader tests.
 */
final class DataFlashLogBuilder {
  static final int GPS = 130;
  static final int BARO = 131;
  static final int MODE = 132;
  static final String GPS_FORMAT = "QBIHLLf";
  static final String GPS_COLUMNS = "TimeUS,Status,GMS,GWk,Lat,Lng,Alt";
  static final String BARO_FORMAT = "Qffc";
  static final String BARO_COLUMNS = "TimeUS,Alt,Press,Temp";

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  DataFlashLogBuilder fmt(int type, String name, String format, String columns) {
    int length = DataFlashFormat.HEADER_LENGTH;
    for (char c : format.toCharArray()) {
      length += DataFlashFormat.sizeOf(c);
    }
    return fmtWithLength(type, length, name, format, columns);
  }

  DataFlashLogBuilder fmtWithLength(int type, int length, String name, String format, String columns) {
    ByteBuffer payload = ByteBuffer.allocate(DataFlashFormat.FMT_LENGTH - DataFlashFormat.HEADER_LENGTH);
    payload.put((byte) type).put((byte) length);
    putPadded(payload, name, 4);
    putPadded(payload, format, 16);
    putPadded(payload, columns, 64);
    return message(DataFlashFormat.FMT_TYPE, payload.array());
  }

  DataFlashLogBuilder standardFormats() {
    return fmt(GPS, "GPS", GPS_FORMAT, GPS_COLUMNS).fmt(BARO, "BARO", BARO_FORMAT, BARO_COLUMNS);
  }

  DataFlashLogBuilder gps(long timeUs, int gpsMillis, int week, double lat, double lng, float alt) {
    ByteBuffer payload = le(27)
        .putLong(timeUs)
        .put((byte) 3)
        .putInt(gpsMillis)
        .putShort((short) week)
        .putInt((int) Math.round(lat * 1e7))
        .putInt((int) Math.round(lng * 1e7))
        .putFloat(alt);
    return message(GPS, payload.array());
  }

  DataFlashLogBuilder baro(long timeUs, float press, int tempCentidegrees) {
    ByteBuffer payload = le(18)
        .putLong(timeUs)
        .putFloat(12.5f)
        .putFloat(press)
        .putShort((short) tempCentidegrees);
    return message(BARO, payload.array());
  }

  DataFlashLogBuilder message(int type, byte[] payload) {
    out.write(DataFlashLogReader.HEAD1);
    out.write(DataFlashLogReader.HEAD2);
    out.write(type);
    out.writeBytes(payload);
    return this;
  }

  DataFlashLogBuilder raw(int... bytes) {
    for (int b : bytes) {
      out.write(b);
    }
    return this;
  }

  byte[] build() {
    return out.toByteArray();
  }

  static ByteBuffer le(int size) {
    return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
  }

  private static void putPadded(ByteBuffer buffer, String text, int width) {
    byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
    buffer.put(bytes, 0, Math.min(bytes.length, width));
    for (int i = bytes.length; i < width; i++) {
      buffer.put((byte) 0);
    }
  }
}
