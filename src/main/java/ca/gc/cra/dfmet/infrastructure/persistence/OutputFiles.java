package ca.gc.cra.dfmet.infrastructure.persistence;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes table outputs so that a reader never sees a half-written file.
 *
 * <p>Content goes to a hidden sibling {@code .<name>.*.tmp} file which is moved onto the target only after it has been
 * written and closed. On failure the temporary file is deleted and the target is left as it was.
 *
 * @since 0.1.0
 */
public final class OutputFiles {
  private static final Logger log = LoggerFactory.getLogger(OutputFiles.class);

  private OutputFiles() {}

  /** Produces the content of one output file. */
  @FunctionalInterface
  public interface Content {
    /**
     * Writes the full content.
     *
     * @param out destination stream; closed by the caller
     * @throws IOException when writing fails
     */
    void writeTo(OutputStream out) throws IOException;
  }

  /**
   * Writes {@code target} through a temporary sibling file.
   *
   * @param target final output file
   * @param allowOverwrite whether an existing {@code target} may be replaced
   * @param content content producer
   * @throws FileAlreadyExistsException if {@code target} exists and {@code allowOverwrite} is {@code false}
   * @throws IOException when writing or moving fails; no partial {@code target} is left behind
   */
  public static void write(Path target, boolean allowOverwrite, Content content) throws IOException {
    if (!allowOverwrite && Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
      throw new FileAlreadyExistsException(target.toString());
    }
    Path directory = target.toAbsolutePath().getParent();
    Path tmp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
        content.writeTo(out);
      }
      if (allowOverwrite) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      } else {
        Files.move(tmp, target);
      }
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
        log.warn("Unable to delete temporary output {}", tmp, cleanup);
      }
      throw ex;
    }
  }
}
