package ca.gc.cra.dfmet.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Minimal console output helper for usage text, dry-run plans and the final status line.
 *
 * <p>Writes straight to stdout so output stays separate from the Logback console appender.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines to stdout using the shared CLI writer.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints an aligned {@code label : value} block under a title.
   *
   * @param title first line
   * @param entries labels and values in display order
   */
  public static void printKeyValues(String title, Map<String, ?> entries) {
    int width = 0;
    for (String label : entries.keySet()) {
      width = Math.max(width, label.length());
    }
    PrintWriter writer = writer();
    writer.println(title);
    for (Map.Entry<String, ?> entry : entries.entrySet()) {
      writer.println(" " + padRight(entry.getKey(), width) + " : " + entry.getValue());
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static String padRight(String value, int width) {
    StringBuilder sb = new StringBuilder(value);
    while (sb.length() < width) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
