package ca.gc.cra.dfmet.config;

import ca.gc.cra.dfmet.application.engine.ConversionEngine;
import ca.gc.cra.dfmet.application.pipeline.ConvertUseCase;
import ca.gc.cra.dfmet.application.pipeline.RecordSourceFactory;
import ca.gc.cra.dfmet.application.port.ClockPort;
import ca.gc.cra.dfmet.application.port.MetricsPort;
import ca.gc.cra.dfmet.application.port.TableWriter;
import ca.gc.cra.dfmet.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dfmet.infrastructure.persistence.netcdf.NetcdfTableWriter;
import ca.gc.cra.dfmet.infrastructure.persistence.text.TextTableWriter;
import ca.gc.cra.dfmet.infrastructure.source.dataflash.DataFlashLogReader;
import ca.gc.cra.dfmet.infrastructure.source.json.NdjsonRecordSource;
import ca.gc.cra.dfmet.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the convert use case to its concrete adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the record source from the configured input format.</li>
 *   <li>Assemble the enabled writers, text table first.</li>
 *   <li>Own the metrics adapter and release it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Create and use on one thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final ConvertConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AutoCloseable metricsLifecycle;

  /**
   * Creates a root with OpenTelemetry metrics and the system clock.
   *
   * @param config validated configuration
   */
  public CompositionRoot(ConvertConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit metrics and clock, used by tests.
   *
   * @param config validated configuration
   * @param metrics metrics port; closed with the root when it is {@link AutoCloseable}
   * @param clock clock port
   */
  public CompositionRoot(ConvertConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metricsLifecycle = metrics instanceof AutoCloseable closeable ? closeable : null;
  }

  /**
   * Builds the convert use case.
   *
   * @return use case wired for {@link #config}
   */
  public ConvertUseCase convertUseCase() {
    return new ConvertUseCase(
        recordSourceFactory(), new ConversionEngine(config.engineSettings()), writers(), metrics);
  }

  RecordSourceFactory recordSourceFactory() {
    InputFormat format = config.resolvedInputFormat();
    int leapSeconds = config.gpsLeapSeconds();
    return switch (format) {
      case NDJSON -> NdjsonRecordSource::new;
      case DATAFLASH, AUTO -> input -> new DataFlashLogReader(input, leapSeconds);
    };
  }

  /**
   * Returns the enabled writers in write order.
   *
   * @return writers, text table first
   */
  public List<TableWriter> writers() {
    List<TableWriter> writers = new ArrayList<>(2);
    if (config.textOutput()) {
      writers.add(new TextTableWriter());
    }
    if (config.netcdfOutput()) {
      writers.add(new NetcdfTableWriter(clock));
    }
    return writers;
  }

  @Override
  public void close() throws Exception {
    if (metricsLifecycle != null) {
      metricsLifecycle.close();
    }
  }
}
