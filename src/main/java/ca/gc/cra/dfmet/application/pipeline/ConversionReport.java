package ca.gc.cra.dfmet.application.pipeline;

import ca.gc.cra.dfmet.application.engine.ClassificationStats;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of one conversion run.
 *
 * @param outcome terminal status
 * @param recordsRead records delivered by the source
 * @param recordsSkipped malformed or unusable records skipped by the source
 * @param rows rows in the produced table
 * @param stats classification counts
 * @param written files written, in write order
 * @param failures optional writers that failed, keyed by writer name, with the failure message
 * @since 0.1.0
 */
public record ConversionReport(
    ConversionOutcome outcome,
    long recordsRead,
    long recordsSkipped,
    int rows,
    ClassificationStats stats,
    List<Path> written,
    Map<String, String> failures) {

  /** Copies collections. */
  public ConversionReport {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(stats, "stats");
    written = List.copyOf(written);
    failures = Map.copyOf(failures);
  }
}
