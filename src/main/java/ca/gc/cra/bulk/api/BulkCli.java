package ca.gc.cra.bulk.api;

import ca.gc.cra.bulk.application.pipeline.BulkSessions;
import ca.gc.cra.bulk.application.pipeline.SessionHandle;
import ca.gc.cra.bulk.application.pipeline.UnbalancedBlockException;
import ca.gc.cra.bulk.config.BulkConfig;
import ca.gc.cra.bulk.config.BulkDefaults;
import ca.gc.cra.bulk.config.CompositionRoot;
import ca.gc.cra.bulk.config.ConfigMerger;
import ca.gc.cra.bulk.config.OutputKind;
import ca.gc.cra.bulk.config.YamlConfigLoader;
import ca.gc.cra.bulk.logging.LoggingConfigurator;
import ca.gc.cra.bulk.validation.Paths;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: reads commands from stdin or files and batches them into bulks.
 *
 * <p>All inputs feed one session in order. The session is closed at end of input, which flushes the
 * trailing partial bulk unless a block is still open.</p>
 *
 * @since 0.1.0
 */
public final class BulkCli {
  private static final Logger log = LoggerFactory.getLogger(BulkCli.class);
  private static final String SUMMARY_USAGE =
      "usage: bulk bulk=N [in=PATH[,PATH]] [outputs=console,file,kafka] [out=DIR] "
          + "[kafkaBootstrap=HOST:PORT] [kafkaTopic=TOPIC] [dispatchWorkers=N] "
          + "[unbalancedBlocks=IGNORE|REJECT] [config=YAML] [--dry-run]";
  private static final String HELP_TEXT = """
      bulk: batch commands into bulks of N, or into explicit { ... } blocks

      Usage:
        bulk bulk=N [options]

      Input:
        bulk=N                      Commands per bulk outside blocks (required, >= 1)
        in=PATH[,PATH]              Read these files in order instead of stdin
        A line containing only { opens a block and } closes it. Blocks nest; only the
        outermost pair delimits a bulk, whatever its size. Empty lines are ignored.

      Outputs:
        outputs=console,file,kafka  Consumers to attach (default console,file)
        out=DIR                     Directory for bulk<seconds>_<n>.log files (default bulk-logs)
        kafkaBootstrap=HOST:PORT    Required when outputs include kafka
        kafkaTopic=TOPIC            Kafka topic (default bulk.batches.v1)

      Engine:
        dispatchWorkers=N           Threads running consumers in parallel (default 4)
        unbalancedBlocks=IGNORE|REJECT
                                    Handling of } without a matching { (default IGNORE)

      Global options:
        config=PATH                 YAML file with common and bulk sections
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate settings and print the plan without reading input
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Notes:
        Precedence is CLI > YAML > defaults.
        An unterminated block at end of input is discarded.
        Report files are added to the output directory; existing files are never overwritten.
      """;

  private BulkCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args, System.in);
    System.exit(exit.code());
  }

  /**
   * Runs the CLI against {@code stdin} and returns the exit code.
   *
   * @param args raw CLI arguments
   * @param stdin stream read when no {@code in=} files are given
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, InputStream stdin) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for bulk CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> cliKv;
    try {
      cliKv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml;
    String configPath = cliKv.remove("config");
    try {
      yaml = loadYaml(configPath);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    Map<String, String> effective;
    String metricsExporter;
    BulkConfig config;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(yaml, cliKv, BulkDefaults.asFlatMap(), log::warn));
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = BulkConfig.fromMap(effective);
      validatePaths(config, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid bulk configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.info("Configured bulk pipeline: bulk={}, outputs={}, workers={}, unbalancedBlocks={}, metricsExporter={}",
        config.bulkSize(), config.outputs(), config.dispatchWorkers(), config.unbalancedBlocks(), metricsExporter);
    if (dryRun) {
      printDryRunPlan(config, metricsExporter);
      return ExitCode.SUCCESS;
    }
    return execute(config, metricsExporter, stdin);
  }

  private static ExitCode execute(BulkConfig config, String metricsExporter, InputStream stdin) {
    try (CompositionRoot root = new CompositionRoot(config, CliPrinter.writer(), metricsExporter)) {
      BulkSessions sessions = root.sessions();
      SessionHandle handle = sessions.connect(config.bulkSize());
      long routed = 0;
      if (config.readsStdin()) {
        routed += feed(sessions, handle, new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8)));
      } else {
        for (Path path : config.inputs()) {
          try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            routed += feed(sessions, handle, reader);
          }
        }
      }
      sessions.disconnect(handle);
      log.info("Bulk run completed; {} lines routed", routed);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read bulk input", ex);
      return ExitCode.IO_ERROR;
    } catch (UnbalancedBlockException ex) {
      log.error("Rejected input: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      if (Thread.currentThread().isInterrupted()) {
        log.error("Bulk run interrupted", ex);
        return ExitCode.INTERRUPTED;
      }
      log.error("Unexpected runtime failure in bulk run", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static long feed(BulkSessions sessions, SessionHandle handle, BufferedReader reader)
      throws IOException {
    long routed = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      routed += sessions.receive(handle, line);
    }
    return routed;
  }

  private static Optional<Map<String, String>> loadYaml(String configPath) throws IOException {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath.trim());
    if (!Files.exists(yamlPath)) {
      throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
    }
    return YamlConfigLoader.load(yamlPath);
  }

  private static void validatePaths(BulkConfig config, boolean createIfMissing) {
    config.inputs().forEach(Paths::validateReadableFile);
    if (config.hasOutput(OutputKind.FILE)) {
      Paths.validateWritableDir(config.outputDirectory(), createIfMissing);
    }
  }

  private static void printDryRunPlan(BulkConfig config, String metricsExporter) {
    CliPrinter.printLines(
        "Bulk dry-run: no input will be read.",
        " Bulk size        : " + config.bulkSize(),
        " Input            : " + (config.readsStdin() ? "<stdin>" : config.inputs().toString()),
        " Outputs          : " + config.outputs(),
        " Output directory : " + (config.hasOutput(OutputKind.FILE)
            ? config.outputDirectory().toAbsolutePath().normalize() : "<unused>"),
        " Kafka            : " + (config.hasOutput(OutputKind.KAFKA)
            ? config.kafkaBootstrap().orElse("<none>") + " -> " + config.kafkaTopic() : "<unused>"),
        " Dispatch workers : " + config.dispatchWorkers(),
        " Unbalanced blocks: " + config.unbalancedBlocks(),
        " Metrics exporter : " + metricsExporter);
  }
}
