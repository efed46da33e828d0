package ca.gc.cra.warper.adapter.kafka;

import ca.gc.cra.warper.application.port.EventSource;
import ca.gc.cra.warper.application.port.EventSubscription;
import ca.gc.cra.warper.domain.warp.InboundEvent;
import ca.gc.cra.warper.validation.Strings;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link EventSource} yielding one {@link InboundEvent} per record.
 * <p><strong>Why:</strong> Receives file-arrival messages for the dispatch loop.</p>
 * <p><strong>Role:</strong> Inbound adapter; every {@link #subscribe()} opens a fresh consumer so idle restarts
 * recycle the broker connection.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode record values as JSON objects.</li>
 *   <li>Report empty polls, null or blank values and malformed JSON as heartbeats.</li>
 *   <li>Commit only offsets of records already handed to the caller; buffered records are redelivered
 *   after a restart.</li>
 *   <li>Close the consumer when the subscription ends.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each subscription is confined to the thread that polls it.</p>
 *
 * @since WARPER 0.1
 */
public final class KafkaEventSource implements EventSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventSource.class);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Supplier<Consumer<String, String>> consumers;
  private final String topic;
  private final JsonPayloads json = new JsonPayloads();

  /**
   * Creates a source that connects on every subscription.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic topic carrying inbound file events
   * @param groupId consumer group; {@code null} selects a process-unique group
   * @param autoOffsetReset {@code latest} or {@code earliest}
   */
  public KafkaEventSource(String bootstrapServers, String topic, String groupId, String autoOffsetReset) {
    this(
        consumerFactory(
            Strings.requireNonBlank("bootstrapServers", bootstrapServers),
            groupId == null ? "warper-" + UUID.randomUUID() : groupId,
            Strings.requireNonBlank("autoOffsetReset", autoOffsetReset)),
        topic);
  }

  KafkaEventSource(Supplier<Consumer<String, String>> consumers, String topic) {
    this.consumers = Objects.requireNonNull(consumers, "consumers");
    this.topic = Strings.sanitizeTopic("topic", topic);
  }

  @Override
  public EventSubscription subscribe() {
    Consumer<String, String> consumer = consumers.get();
    consumer.subscribe(List.of(topic));
    log.info("Subscribed to topic {}", topic);
    return new KafkaSubscription(consumer);
  }

  private static Supplier<Consumer<String, String>> consumerFactory(
      String bootstrapServers, String groupId, String autoOffsetReset) {
    return () -> {
      Properties props = new Properties();
      props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers.trim());
      props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
      props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
      props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
      props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
      props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
      props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
      return new KafkaConsumer<>(props);
    };
  }

  private final class KafkaSubscription implements EventSubscription {
    private final Consumer<String, String> consumer;
    private final Deque<ConsumerRecord<String, String>> buffered = new ArrayDeque<>();
    private final Map<TopicPartition, OffsetAndMetadata> delivered = new HashMap<>();

    private KafkaSubscription(Consumer<String, String> consumer) {
      this.consumer = consumer;
    }

    @Override
    public InboundEvent next(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      if (buffered.isEmpty()) {
        commitDelivered();
        for (ConsumerRecord<String, String> record : consumer.poll(timeout)) {
          buffered.add(record);
        }
      }
      ConsumerRecord<String, String> record = buffered.poll();
      if (record == null) {
        return InboundEvent.heartbeat();
      }
      delivered.put(
          new TopicPartition(record.topic(), record.partition()), new OffsetAndMetadata(record.offset() + 1));
      String value = record.value();
      if (value == null || value.isBlank()) {
        log.debug("Empty record at {}-{}@{}", record.topic(), record.partition(), record.offset());
        return InboundEvent.heartbeat();
      }
      try {
        return InboundEvent.of(json.parseObject(value));
      } catch (IllegalArgumentException ex) {
        log.warn(
            "Skipping malformed record at {}-{}@{}: {}",
            record.topic(),
            record.partition(),
            record.offset(),
            ex.getMessage());
        return InboundEvent.heartbeat();
      }
    }

    @Override
    public void close() {
      if (!buffered.isEmpty()) {
        log.info("Leaving {} buffered record(s) uncommitted for redelivery", buffered.size());
        buffered.clear();
      }
      commitDelivered();
      consumer.close(CLOSE_TIMEOUT);
      log.info("Unsubscribed from topic {}", topic);
    }

    private void commitDelivered() {
      if (delivered.isEmpty()) {
        return;
      }
      try {
        consumer.commitSync(Map.copyOf(delivered));
        delivered.clear();
      } catch (KafkaException ex) {
        log.warn("Failed to commit offsets {}: {}", delivered, ex.getMessage());
      }
    }
  }
}
