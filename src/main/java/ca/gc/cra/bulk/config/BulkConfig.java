package ca.gc.cra.bulk.config;

import ca.gc.cra.bulk.application.pipeline.UnbalancedBlockPolicy;
import ca.gc.cra.bulk.validation.Net;
import ca.gc.cra.bulk.validation.Numbers;
import ca.gc.cra.bulk.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable settings for one bulk CLI run.
 * <p><strong>Why:</strong> Turns loosely typed key/value input (CLI, YAML, defaults) into validated values
 * before any engine or output is created.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the bulk size, worker count, and block policy.</li>
 *   <li>Resolve input files and the file output directory.</li>
 *   <li>Require Kafka bootstrap servers whenever the Kafka output is selected.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public final class BulkConfig {
  /** Directory receiving report files when {@code out} is not set. */
  public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("bulk-logs");
  /** Topic used by the Kafka output when {@code kafkaTopic} is not set. */
  public static final String DEFAULT_KAFKA_TOPIC = "bulk.batches.v1";
  /** Dispatch workers shared by all sessions when {@code dispatchWorkers} is not set. */
  public static final int DEFAULT_DISPATCH_WORKERS = 4;

  private static final int MAX_DISPATCH_WORKERS = 256;

  private final int bulkSize;
  private final List<Path> inputs;
  private final Set<OutputKind> outputs;
  private final Path outputDirectory;
  private final Optional<String> kafkaBootstrap;
  private final String kafkaTopic;
  private final int dispatchWorkers;
  private final UnbalancedBlockPolicy unbalancedBlocks;

  private BulkConfig(
      int bulkSize,
      List<Path> inputs,
      Set<OutputKind> outputs,
      Path outputDirectory,
      Optional<String> kafkaBootstrap,
      String kafkaTopic,
      int dispatchWorkers,
      UnbalancedBlockPolicy unbalancedBlocks) {
    this.bulkSize = bulkSize;
    this.inputs = List.copyOf(inputs);
    this.outputs = Set.copyOf(outputs);
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.kafkaBootstrap = kafkaBootstrap;
    this.kafkaTopic = kafkaTopic;
    this.dispatchWorkers = dispatchWorkers;
    this.unbalancedBlocks = unbalancedBlocks;
    if (this.outputs.contains(OutputKind.KAFKA) && this.kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when outputs include kafka");
    }
  }

  /**
   * Builds a configuration from flat key/value pairs.
   *
   * @param args merged settings; must contain {@code bulk}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static BulkConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    int bulkSize = Numbers.parseIntInRange("bulk", args.get("bulk"), 1, Integer.MAX_VALUE);
    List<Path> inputs = parseInputs(args.get("in"));
    Set<OutputKind> outputs = OutputKind.parseList(args.getOrDefault("outputs", "console,file"));
    Path outputDirectory = optional(args.get("out"))
        .map(value -> toPath("out", value))
        .orElse(DEFAULT_OUTPUT_DIRECTORY);
    Optional<String> kafkaBootstrap = optional(args.get("kafkaBootstrap")).map(Net::validateBootstrapServers);
    String kafkaTopic = Strings.sanitizeTopic("kafkaTopic",
        optional(args.get("kafkaTopic")).orElse(DEFAULT_KAFKA_TOPIC));
    int workers = optional(args.get("dispatchWorkers"))
        .map(value -> Numbers.parseIntInRange("dispatchWorkers", value, 1, MAX_DISPATCH_WORKERS))
        .orElse(DEFAULT_DISPATCH_WORKERS);
    UnbalancedBlockPolicy policy = UnbalancedBlockPolicy.fromString(args.get("unbalancedBlocks"));
    return new BulkConfig(
        bulkSize, inputs, outputs, outputDirectory, kafkaBootstrap, kafkaTopic, workers, policy);
  }

  public int bulkSize() {
    return bulkSize;
  }

  /**
   * Input files read in order; empty means stdin.
   *
   * @return immutable list of input paths
   */
  public List<Path> inputs() {
    return inputs;
  }

  public boolean readsStdin() {
    return inputs.isEmpty();
  }

  public Set<OutputKind> outputs() {
    Set<OutputKind> copy = EnumSet.noneOf(OutputKind.class);
    copy.addAll(outputs);
    return copy;
  }

  public boolean hasOutput(OutputKind kind) {
    return outputs.contains(kind);
  }

  public Path outputDirectory() {
    return outputDirectory;
  }

  public Optional<String> kafkaBootstrap() {
    return kafkaBootstrap;
  }

  public String kafkaTopic() {
    return kafkaTopic;
  }

  public int dispatchWorkers() {
    return dispatchWorkers;
  }

  public UnbalancedBlockPolicy unbalancedBlocks() {
    return unbalancedBlocks;
  }

  private static List<Path> parseInputs(String raw) {
    List<Path> paths = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return paths;
    }
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        paths.add(toPath("in", token.trim()));
      }
    }
    return paths;
  }

  private static Path toPath(String key, String value) {
    try {
      return Path.of(Strings.requireNonBlank(key, value));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  private static Optional<String> optional(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }
}
