package ca.gc.cra.dfmet.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers.
 * <p><strong>Why:</strong> Malformed NDJSON lines and garbage in binary logs can be arbitrarily long; warnings quote
 * only a bounded prefix.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Renders up to {@code maxBytes} bytes as lowercase hex for diagnostics.
   *
   * @param data source bytes
   * @param offset first byte
   * @param maxBytes maximum number of bytes rendered
   * @return hex string, suffixed with {@code ...} when shortened
   */
  public static String hexPreview(byte[] data, int offset, int maxBytes) {
    int end = Math.min(data.length, offset + Math.max(0, maxBytes));
    StringBuilder sb = new StringBuilder((end - offset) * 2 + 3);
    for (int i = offset; i < end; i++) {
      sb.append(HEX[(data[i] >> 4) & 0xF]).append(HEX[data[i] & 0xF]);
    }
    if (end < data.length) {
      sb.append("...");
    }
    return sb.toString();
  }
}
