package ca.gc.cra.dfmet.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dfmet.application.port.ClockPort;
import ca.gc.cra.dfmet.application.port.MetricsPort;
import ca.gc.cra.dfmet.application.port.TableWriter;
import ca.gc.cra.dfmet.infrastructure.persistence.netcdf.NetcdfTableWriter;
import ca.gc.cra.dfmet.infrastructure.persistence.text.TextTableWriter;
import ca.gc.cra.dfmet.infrastructure.source.dataflash.DataFlashLogReader;
import ca.gc.cra.dfmet.infrastructure.source.json.NdjsonRecordSource;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  private static ConvertConfig config(String input, InputFormat format, boolean netcdf) {
    return new ConvertConfig(Path.of(input), null, null, format, false, 9, 18, true, netcdf, false, false);
  }

  @Test
  void writersFollowEnabledOutputsTextFirst() throws Exception {
    try (CompositionRoot root = new CompositionRoot(
        config("flight.bin", InputFormat.AUTO, true), MetricsPort.NO_OP, ClockPort.SYSTEM)) {
      List<TableWriter> writers = root.writers();

      assertEquals(2, writers.size());
      assertInstanceOf(TextTableWriter.class, writers.get(0));
      assertInstanceOf(NetcdfTableWriter.class, writers.get(1));
    }
    try (CompositionRoot root = new CompositionRoot(
        config("flight.bin", InputFormat.AUTO, false), MetricsPort.NO_OP, ClockPort.SYSTEM)) {
      assertEquals(1, root.writers().size());
    }
  }

  @Test
  void recordSourceMatchesResolvedFormat() throws Exception {
    try (CompositionRoot dataflash = new CompositionRoot(
            config("flight.bin", InputFormat.AUTO, true), MetricsPort.NO_OP, ClockPort.SYSTEM);
        CompositionRoot ndjson = new CompositionRoot(
            config("flight.bin", InputFormat.NDJSON, true), MetricsPort.NO_OP, ClockPort.SYSTEM)) {
      assertInstanceOf(DataFlashLogReader.class, dataflash.recordSourceFactory().create(Path.of("flight.bin")));
      assertInstanceOf(NdjsonRecordSource.class, ndjson.recordSourceFactory().create(Path.of("flight.bin")));
    }
  }

  @Test
  void closeReleasesCloseableMetrics() throws Exception {
    AtomicBoolean closed = new AtomicBoolean();
    CloseableMetrics metrics = new CloseableMetrics(closed);

    try (CompositionRoot root = new CompositionRoot(
        config("flight.bin", InputFormat.AUTO, true), metrics, ClockPort.SYSTEM)) {
      root.convertUseCase();
    }

    assertTrue(closed.get());
  }

  private static final class CloseableMetrics implements MetricsPort, AutoCloseable {
    private final AtomicBoolean closed;

    CloseableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void increment(String key) {}

    @Override
    public void observe(String key, long value) {}

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
