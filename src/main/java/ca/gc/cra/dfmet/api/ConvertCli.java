package ca.gc.cra.dfmet.api;

import ca.gc.cra.dfmet.application.engine.NoPositionDataException;
import ca.gc.cra.dfmet.application.pipeline.ConversionReport;
import ca.gc.cra.dfmet.application.port.OutputTarget;
import ca.gc.cra.dfmet.application.port.TableWriter;
import ca.gc.cra.dfmet.config.CompositionRoot;
import ca.gc.cra.dfmet.config.ConfigMerger;
import ca.gc.cra.dfmet.config.ConvertConfig;
import ca.gc.cra.dfmet.config.DefaultsForMode;
import ca.gc.cra.dfmet.config.YamlConfigLoader;
import ca.gc.cra.dfmet.logging.LoggingConfigurator;
import ca.gc.cra.dfmet.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for converting one flight log into its per-second meteorological table.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final String MODE = "convert";
  private static final String SUMMARY_USAGE =
      "usage: convert in=PATH [outDir=PATH] [baseName=NAME] [inputFormat=AUTO|DATAFLASH|NDJSON] "
          + "[positionRangeCheck=true|false] [smoothingWindow=N] [gpsLeapSeconds=N] "
          + "[textOutput=true|false] [netcdfOutput=true|false] [config=PATH] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      DFMET convert

      Usage:
        convert in=./flight.bin [options]

      Required:
        in=PATH                    DataFlash (.bin) or NDJSON (.json/.jsonl/.ndjson) flight log

      Optional (validated):
        outDir=PATH                Output directory (default: the input's directory)
        baseName=NAME              Output file name without extension (default: the input's base name)
        inputFormat=AUTO|DATAFLASH|NDJSON
                                   Input encoding; AUTO picks from the file extension (default AUTO)
        positionRangeCheck=true|false
                                   Blank position fixes outside lat [-90,90] / lon [-180,180] (default false)
        smoothingWindow=N          Odd centered moving-average width for air temperature (default 9)
        gpsLeapSeconds=N           GPS minus UTC seconds used to anchor DataFlash clocks (default 18)
        textOutput=true|false      Write <baseName>.txt (default true)
        netcdfOutput=true|false    Write <baseName>.nc (default true)
        config=PATH                YAML file with common/convert sections; CLI values win
        --dry-run                  Validate inputs and print the plan without converting
        --allow-overwrite          Replace existing output files
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit codes:
        0 success (including a failed NetCDF output), 2 invalid arguments, 3 I/O error,
        4 configuration error, 5 unexpected failure, 6 no position data in the log
      """;

  private ConvertCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the convert CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for convert CLI");
    }

    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown option(s): {}", String.join(", ", input.unknownFlags()));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean dryRunFlag = input.has(CliInput.Flag.DRY_RUN);
    boolean allowOverwriteFlag = input.has(CliInput.Flag.ALLOW_OVERWRITE);

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArray()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> defaults = DefaultsForMode.asFlatMap(MODE);
    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(MODE, yamlConfig, kv, defaults, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled from configuration");
    }
    boolean dryRun = dryRunFlag || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = allowOverwriteFlag || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    configInputs.remove("verbose");
    String metricsExporter;
    ConvertConfig config;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = ConvertConfig.fromMap(configInputs).withSwitches(allowOverwrite, dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<Path> plannedOutputs;
    try (CompositionRoot root = new CompositionRoot(config)) {
      try {
        plannedOutputs = validatePaths(config, root.writers());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid convert path configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }

      if (config.dryRun()) {
        printDryRunPlan(config, plannedOutputs, metricsExporter);
        return ExitCode.SUCCESS;
      }

      log.info(
          "Configured convert: input={}, format={}, outDir={}, outputs={}, metricsExporter={}",
          config.input(),
          config.resolvedInputFormat(),
          config.outputDirectory(),
          plannedOutputs.size(),
          metricsExporter);
      ConversionReport report = root.convertUseCase().convert(config.input(), config.outputTarget());
      for (Map.Entry<String, String> failure : report.failures().entrySet()) {
        log.warn("{} output was not written: {}", failure.getKey(), failure.getValue());
      }
      CliPrinter.println(report.outcome().statusMessage());
      return ExitCode.SUCCESS;
    } catch (NoPositionDataException ex) {
      log.error("Conversion aborted for {}: {}", config.input(), ex.getMessage());
      return ExitCode.NO_DATA;
    } catch (IllegalArgumentException ex) {
      log.error("Convert configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Convert I/O failure while processing {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in convert", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in convert", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static List<Path> validatePaths(ConvertConfig config, List<TableWriter> writers) {
    Paths.validateReadableFile(config.input());
    Paths.validateWritableDir(config.outputDirectory(), !config.dryRun());
    OutputTarget target = config.outputTarget();
    List<Path> outputs = new ArrayList<>(writers.size());
    for (TableWriter writer : writers) {
      outputs.add(Paths.requireAbsentOrOverwritable(writer.outputFile(target), config.allowOverwrite()));
    }
    return outputs;
  }

  private static void printDryRunPlan(ConvertConfig config, List<Path> outputs, String metricsExporter) {
    Map<String, Object> plan = new LinkedHashMap<>();
    plan.put("Input", config.input());
    plan.put("Input format", config.resolvedInputFormat());
    plan.put("Output directory", config.outputDirectory());
    for (int i = 0; i < outputs.size(); i++) {
      plan.put("Output " + (i + 1), outputs.get(i));
    }
    plan.put("Smoothing window", config.smoothingWindow());
    plan.put("Position range check", config.positionRangeCheck());
    plan.put("GPS leap seconds", config.gpsLeapSeconds());
    plan.put("Allow overwrite", config.allowOverwrite());
    plan.put("Metrics exporter", metricsExporter);
    CliPrinter.printKeyValues("Convert dry-run plan:", plan);
  }
}
