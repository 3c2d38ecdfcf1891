package ca.gc.cra.dfmet.application.pipeline;

import ca.gc.cra.dfmet.application.engine.ClassificationStats;
import ca.gc.cra.dfmet.application.engine.ConversionEngine;
import ca.gc.cra.dfmet.application.engine.ConversionResult;
import ca.gc.cra.dfmet.application.engine.NoPositionDataException;
import ca.gc.cra.dfmet.application.port.MetricsPort;
import ca.gc.cra.dfmet.application.port.OutputTarget;
import ca.gc.cra.dfmet.application.port.RecordSource;
import ca.gc.cra.dfmet.application.port.TableWriter;
import ca.gc.cra.dfmet.domain.record.DecodedRecord;
import ca.gc.cra.dfmet.domain.sample.Channel;
import ca.gc.cra.dfmet.domain.table.OutputTable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Converts one flight log into its output files.
 * <p><strong>Why:</strong> Keeps reading, conversion and output policy in one place so the CLI only maps outcomes to
 * exit codes.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the record source, engine and table writers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read every record of the input into memory.</li>
 *   <li>Run the {@link ConversionEngine}; a log without position fixes produces no files.</li>
 *   <li>Run writers in order. A required writer's failure propagates; an optional writer's failure is logged,
 *       counted and reported as {@link ConversionOutcome#COMPLETED_WITH_OUTPUT_ERRORS}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 * <p><strong>Observability:</strong> MDC key {@code convert.in}; {@code convert.*} counters and the
 * {@code convert.latencyMillis} histogram.</p>
 *
 * @since 0.1.0
 */
public final class ConvertUseCase {
  private static final Logger log = LoggerFactory.getLogger(ConvertUseCase.class);
  static final String MDC_INPUT = "convert.in";

  private final RecordSourceFactory sourceFactory;
  private final ConversionEngine engine;
  private final List<TableWriter> writers;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param sourceFactory factory for the input record source; must not be {@code null}
   * @param engine conversion engine; must not be {@code null}
   * @param writers enabled writers in write order; must not be {@code null} or empty
   * @param metrics metrics port; must not be {@code null}
   */
  public ConvertUseCase(
      RecordSourceFactory sourceFactory, ConversionEngine engine, List<TableWriter> writers, MetricsPort metrics) {
    this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.writers = List.copyOf(Objects.requireNonNull(writers, "writers"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (this.writers.isEmpty()) {
      throw new IllegalArgumentException("at least one output writer must be enabled");
    }
  }

  /**
   * Runs the conversion.
   *
   * @param input input log
   * @param target output placement
   * @return run summary
   * @throws IOException if the input cannot be read or a required output cannot be written
   * @throws NoPositionDataException when the log has no position fixes; no file is written
   */
  public ConversionReport convert(Path input, OutputTarget target) throws IOException, NoPositionDataException {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(target, "target");
    long started = System.nanoTime();
    MDC.put(MDC_INPUT, input.toString());
    try {
      List<DecodedRecord> records = new ArrayList<>();
      long skipped;
      try (RecordSource source = sourceFactory.create(input)) {
        source.open();
        DecodedRecord record;
        while ((record = source.next()) != null) {
          records.add(record);
        }
        skipped = source.skipped();
      }
      metrics.add("convert.records.read", records.size());
      metrics.add("convert.records.skipped", skipped);
      log.info("Read {} records from {} ({} skipped)", records.size(), input, skipped);

      ConversionResult result;
      try {
        result = engine.convert(records);
      } catch (NoPositionDataException ex) {
        metrics.increment("convert.noPositionData");
        log.error("No position data in {}; no output written", input);
        throw ex;
      }
      recordStats(result.stats());
      OutputTable table = result.table();
      metrics.add("convert.rows", table.size());
      log.info("Assembled {} per-second observations", table.size());

      List<Path> written = new ArrayList<>();
      Map<String, String> failures = new LinkedHashMap<>();
      for (TableWriter writer : writers) {
        try {
          written.add(writer.write(table, target));
          metrics.increment("convert.output." + writer.name() + ".written");
        } catch (IOException | RuntimeException ex) {
          metrics.increment("convert.output." + writer.name() + ".failed");
          if (writer.required()) {
            log.error("Required {} output failed for {}", writer.name(), input, ex);
            throw ex;
          }
          log.error("Optional {} output failed for {}; continuing", writer.name(), input, ex);
          failures.put(writer.name(), String.valueOf(ex.getMessage()));
        }
      }
      ConversionOutcome outcome =
          failures.isEmpty() ? ConversionOutcome.COMPLETED : ConversionOutcome.COMPLETED_WITH_OUTPUT_ERRORS;
      log.info("{} ({} files written)", outcome.statusMessage(), written.size());
      return new ConversionReport(
          outcome, records.size(), skipped, table.size(), result.stats(), written, failures);
    } finally {
      metrics.observe("convert.latencyMillis", (System.nanoTime() - started) / 1_000_000L);
      MDC.remove(MDC_INPUT);
    }
  }

  private void recordStats(ClassificationStats stats) {
    for (Channel channel : Channel.values()) {
      metrics.add("convert.samples." + channel.metricName(), stats.samples(channel));
    }
    log.debug("Classified {} of {} records: {}",
        stats.recordsSeen() - stats.recordsDropped(), stats.recordsSeen(), stats.samplesPerChannel());
  }
}
