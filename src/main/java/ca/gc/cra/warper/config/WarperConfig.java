package ca.gc.cra.warper.config;

import ca.gc.cra.warper.domain.warp.ToolOption;
import ca.gc.cra.warper.infrastructure.exec.QueuePolicy;
import ca.gc.cra.warper.validation.Net;
import ca.gc.cra.warper.validation.Numbers;
import ca.gc.cra.warper.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one warper process.
 * <p><strong>Why:</strong> Normalizes the loosely-typed YAML document once at start-up so the loop and workers
 * only see typed, immutable values.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the projection option mapping named by {@code target_projection}.</li>
 *   <li>Convert list-valued options to repeated flags and scalar options to tokenized flags.</li>
 *   <li>Apply defaults for worker count, queue policy, and tool names.</li>
 *   <li>Validate Kafka subscriber and publisher connection settings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since WARPER 0.1
 */
public final class WarperConfig {
  /** Default reprojection tool. */
  public static final String DEFAULT_WARP_COMMAND = "gdalwarp";
  /** Default overview tool. */
  public static final String DEFAULT_OVERVIEW_COMMAND = "gdaladdo";
  private static final int MAX_WORKERS = 256;
  private static final int MAX_QUEUE_CAPACITY = 1_000_000;

  private final Path targetDir;
  private final String targetProjection;
  private final List<ToolOption> projectionOptions;
  private final List<Integer> overviews;
  private final int numWorkers;
  private final int queueCapacity;
  private final QueuePolicy queuePolicy;
  private final Optional<Duration> restartTimeout;
  private final Optional<Duration> commandTimeout;
  private final Optional<Duration> shutdownGrace;
  private final String warpCommand;
  private final String overviewCommand;
  private final SubscriberSettings subscriber;
  private final PublisherSettings publisher;

  private WarperConfig(Builder b) {
    this.targetDir = b.targetDir;
    this.targetProjection = b.targetProjection;
    this.projectionOptions = List.copyOf(b.projectionOptions);
    this.overviews = List.copyOf(b.overviews);
    this.numWorkers = b.numWorkers;
    this.queueCapacity = b.queueCapacity;
    this.queuePolicy = b.queuePolicy;
    this.restartTimeout = b.restartTimeout;
    this.commandTimeout = b.commandTimeout;
    this.shutdownGrace = b.shutdownGrace;
    this.warpCommand = b.warpCommand;
    this.overviewCommand = b.overviewCommand;
    this.subscriber = b.subscriber;
    this.publisher = b.publisher;
  }

  /**
   * Builds a configuration from a parsed YAML document.
   *
   * @param document root mapping of the YAML file
   * @param projectionFallback projection name used when the document has no {@code target_projection}
   * @return validated configuration
   * @throws IllegalArgumentException when required keys are missing or values are malformed
   */
  public static WarperConfig fromDocument(Map<String, Object> document, Optional<String> projectionFallback) {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(projectionFallback, "projectionFallback");
    Builder b = new Builder();
    b.targetDir = parsePath("target_dir", requireString(document, "target_dir"));

    Optional<String> configured = optionalString(document, "target_projection");
    b.targetProjection = configured
        .or(() -> projectionFallback.map(p -> Strings.requireNonBlank("projection", p)))
        .orElseThrow(() -> new IllegalArgumentException(
            "target_projection must be configured or supplied with projection=NAME"));
    Object projection = document.get(b.targetProjection);
    if (!(projection instanceof Map<?, ?> projectionMap)) {
      throw new IllegalArgumentException(
          "projection '" + b.targetProjection + "' must be a mapping of tool options");
    }
    b.projectionOptions = parseOptions(b.targetProjection, projectionMap);

    b.overviews = parseOverviews(document.get("overviews"));
    b.numWorkers = (int) Numbers.requireRange("num_workers", optionalLong(document, "num_workers").orElse(1L), 1, MAX_WORKERS);
    b.queueCapacity = (int) Numbers.requireRange(
        "queue_capacity", optionalLong(document, "queue_capacity").orElse(0L), 0, MAX_QUEUE_CAPACITY);
    b.queuePolicy = QueuePolicy.fromString(optionalString(document, "queue_policy").orElse(null));
    b.restartTimeout = optionalDuration(document, "restart_timeout", 60_000d);
    b.commandTimeout = optionalDuration(document, "command_timeout", 1_000d);
    b.shutdownGrace = optionalDuration(document, "shutdown_grace", 1_000d);
    b.warpCommand = optionalString(document, "warp_command").orElse(DEFAULT_WARP_COMMAND);
    b.overviewCommand = optionalString(document, "overview_command").orElse(DEFAULT_OVERVIEW_COMMAND);
    b.subscriber = SubscriberSettings.from(section(document, "subscriber"));
    b.publisher = PublisherSettings.from(section(document, "publisher"));
    return new WarperConfig(b);
  }

  /** @return directory receiving reprojected files */
  public Path targetDir() {
    return targetDir;
  }

  /** @return name of the selected projection */
  public String targetProjection() {
    return targetProjection;
  }

  /** @return ordered tool options of the selected projection */
  public List<ToolOption> projectionOptions() {
    return projectionOptions;
  }

  /** @return overview levels; empty disables overview generation */
  public List<Integer> overviews() {
    return overviews;
  }

  /** @return size of the worker pool */
  public int numWorkers() {
    return numWorkers;
  }

  /** @return worker queue capacity; {@code 0} means unbounded */
  public int queueCapacity() {
    return queueCapacity;
  }

  /** @return policy applied when a bounded queue is full */
  public QueuePolicy queuePolicy() {
    return queuePolicy;
  }

  /** @return idle period after which the subscription is recycled, when configured */
  public Optional<Duration> restartTimeout() {
    return restartTimeout;
  }

  /** @return per-command time limit, when configured */
  public Optional<Duration> commandTimeout() {
    return commandTimeout;
  }

  /** @return maximum time the shutdown hook waits for draining, when configured */
  public Optional<Duration> shutdownGrace() {
    return shutdownGrace;
  }

  /** @return reprojection tool executable */
  public String warpCommand() {
    return warpCommand;
  }

  /** @return overview tool executable */
  public String overviewCommand() {
    return overviewCommand;
  }

  /** @return inbound subscription settings */
  public SubscriberSettings subscriber() {
    return subscriber;
  }

  /** @return outbound publication settings */
  public PublisherSettings publisher() {
    return publisher;
  }

  private static List<ToolOption> parseOptions(String projection, Map<?, ?> raw) {
    List<ToolOption> options = new ArrayList<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("projection '" + projection + "' contains a non-string option name");
      }
      Object value = entry.getValue();
      if (value instanceof List<?> list) {
        List<String> values = new ArrayList<>(list.size());
        for (Object element : list) {
          if (element == null || element instanceof Map<?, ?> || element instanceof List<?>) {
            throw new IllegalArgumentException(
                "option " + projection + "." + name + " list elements must be scalars");
          }
          values.add(element.toString());
        }
        options.add(ToolOption.repeated(name, values));
      } else if (value == null || value instanceof Map<?, ?>) {
        throw new IllegalArgumentException("option " + projection + "." + name + " must be a string or a list");
      } else {
        options.add(ToolOption.tokens(name, value.toString()));
      }
    }
    return options;
  }

  private static List<Integer> parseOverviews(Object raw) {
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> list)) {
      throw new IllegalArgumentException("overviews must be a list of integers");
    }
    List<Integer> levels = new ArrayList<>(list.size());
    for (Object element : list) {
      if (!(element instanceof Number number) || number.longValue() != number.doubleValue()) {
        throw new IllegalArgumentException("overviews must only contain integers (was " + element + ")");
      }
      levels.add((int) Numbers.requireRange("overview level", number.longValue(), 2, 65_536));
    }
    return levels;
  }

  static Map<String, Object> section(Map<String, Object> document, String key) {
    Object value = document.get(key);
    if (!(value instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(key + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((k, v) -> map.put(String.valueOf(k), v));
    return map;
  }

  static String requireString(Map<String, Object> document, String key) {
    return optionalString(document, key)
        .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  static Optional<String> optionalString(Map<String, Object> document, String key) {
    Object value = document.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new IllegalArgumentException(key + " must be a scalar value");
    }
    return Optional.of(Strings.requireNonBlank(key, value.toString()));
  }

  private static Optional<Long> optionalLong(Map<String, Object> document, String key) {
    Object value = document.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Number number && number.longValue() == number.doubleValue()) {
      return Optional.of(number.longValue());
    }
    try {
      return Optional.of(Long.parseLong(value.toString().trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }

  private static Optional<Duration> optionalDuration(Map<String, Object> document, String key, double unitMillis) {
    Object value = document.get(key);
    if (value == null) {
      return Optional.empty();
    }
    double amount;
    if (value instanceof Number number) {
      amount = number.doubleValue();
    } else {
      try {
        amount = Double.parseDouble(value.toString().trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be numeric (was " + value + ")", ex);
      }
    }
    if (!(amount > 0) || Double.isInfinite(amount)) {
      throw new IllegalArgumentException(key + " must be positive (was " + value + ")");
    }
    return Optional.of(Duration.ofMillis(Math.round(amount * unitMillis)));
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  /**
   * Kafka consumer settings for inbound events.
   *
   * @param bootstrap bootstrap server list
   * @param topic topic carrying inbound file events
   * @param groupId consumer group; when absent each subscription uses a fresh group
   * @param autoOffsetReset offset reset policy ({@code latest} or {@code earliest})
   */
  public record SubscriberSettings(String bootstrap, String topic, Optional<String> groupId, String autoOffsetReset) {
    static SubscriberSettings from(Map<String, Object> section) {
      String bootstrap = Net.validateBootstrapServers(requireString(section, "bootstrap"));
      String topic = Strings.sanitizeTopic("subscriber.topic", requireString(section, "topic"));
      Optional<String> groupId = optionalString(section, "group_id")
          .map(id -> Strings.requirePrintableAscii("subscriber.group_id", id, 249));
      String reset = optionalString(section, "auto_offset_reset").orElse("latest").toLowerCase(Locale.ROOT);
      if (!reset.equals("latest") && !reset.equals("earliest")) {
        throw new IllegalArgumentException("subscriber.auto_offset_reset must be latest or earliest");
      }
      return new SubscriberSettings(bootstrap, topic, groupId, reset);
    }
  }

  /**
   * Kafka producer settings for completion notifications.
   *
   * @param bootstrap bootstrap server list
   * @param topic topic receiving notifications
   */
  public record PublisherSettings(String bootstrap, String topic) {
    static PublisherSettings from(Map<String, Object> section) {
      String bootstrap = Net.validateBootstrapServers(requireString(section, "bootstrap"));
      String topic = Strings.sanitizeTopic("publisher.pub_topic", requireString(section, "pub_topic"));
      return new PublisherSettings(bootstrap, topic);
    }
  }

  private static final class Builder {
    private Path targetDir;
    private String targetProjection;
    private List<ToolOption> projectionOptions;
    private List<Integer> overviews;
    private int numWorkers;
    private int queueCapacity;
    private QueuePolicy queuePolicy;
    private Optional<Duration> restartTimeout;
    private Optional<Duration> commandTimeout;
    private Optional<Duration> shutdownGrace;
    private String warpCommand;
    private String overviewCommand;
    private SubscriberSettings subscriber;
    private PublisherSettings publisher;
  }
}
