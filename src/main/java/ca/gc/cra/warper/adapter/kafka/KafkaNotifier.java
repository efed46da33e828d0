package ca.gc.cra.warper.adapter.kafka;

import ca.gc.cra.warper.application.port.Notifier;
import ca.gc.cra.warper.domain.warp.Notification;
import ca.gc.cra.warper.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka notifier that publishes completion messages as JSON.
 * <p>The record key is the notification {@code uid}, the value is the payload object and the message type
 * travels in the {@value #TYPE_HEADER} header. Sends are asynchronous; delivery failures are logged from the
 * producer callback.</p>
 *
 * @implNote Invoke {@link #close()} to flush buffered records before shutting down.
 * @since WARPER 0.1
 */
public final class KafkaNotifier implements Notifier {
  /** Header carrying the notification type. */
  public static final String TYPE_HEADER = "type";
  private static final Logger log = LoggerFactory.getLogger(KafkaNotifier.class);

  private final Producer<String, String> producer;
  private final JsonPayloads json = new JsonPayloads();

  /**
   * Creates a notifier backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   */
  public KafkaNotifier(String bootstrapServers) {
    this(createProducer(bootstrapServers));
  }

  KafkaNotifier(Producer<String, String> producer) {
    this.producer = Objects.requireNonNull(producer, "producer");
  }

  @Override
  public void publish(Notification notification) {
    Objects.requireNonNull(notification, "notification");
    ProducerRecord<String, String> record =
        new ProducerRecord<>(notification.topic(), notification.uid(), json.write(notification.payload()));
    record.headers().add(TYPE_HEADER, notification.type().getBytes(StandardCharsets.UTF_8));
    producer.send(record, (metadata, exception) -> {
      if (exception != null) {
        log.error("Failed to deliver notification {} to {}", notification.uid(), notification.topic(), exception);
      }
    });
  }

  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    String trimmed = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
