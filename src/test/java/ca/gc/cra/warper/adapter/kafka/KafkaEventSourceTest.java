package ca.gc.cra.warper.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warper.application.port.EventSubscription;
import ca.gc.cra.warper.domain.warp.InboundEvent;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

class KafkaEventSourceTest {
  private static final String TOPIC = "raster.incoming";

  @Test
  void decodesJsonRecordsAndReportsEmptyPollsAsHeartbeats() {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    KafkaEventSource source = new KafkaEventSource(() -> consumer, TOPIC);

    try (EventSubscription subscription = source.subscribe()) {
      TopicPartition partition = new TopicPartition(TOPIC, 0);
      consumer.rebalance(List.of(partition));
      consumer.updateBeginningOffsets(Map.of(partition, 0L));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null,
          "{\"uri\":\"/in/a.tif\",\"orbit_number\":4711,\"sensor\":[\"viirs\"]}"));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, null, "{\"uri\":\"/in/b.tif\"}"));

      InboundEvent first = subscription.next(Duration.ofMillis(10));
      InboundEvent second = subscription.next(Duration.ofMillis(10));
      InboundEvent third = subscription.next(Duration.ofMillis(10));

      Map<String, Object> payload = first.payload().orElseThrow();
      assertEquals("/in/a.tif", payload.get("uri"));
      assertEquals(4711, ((Number) payload.get("orbit_number")).intValue());
      assertEquals(List.of("viirs"), payload.get("sensor"));
      assertEquals("/in/b.tif", second.payload().orElseThrow().get("uri"));
      assertTrue(third.isHeartbeat());
    }
    assertTrue(consumer.closed());
  }

  @Test
  void blankAndMalformedValuesBecomeHeartbeats() {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    KafkaEventSource source = new KafkaEventSource(() -> consumer, TOPIC);

    try (EventSubscription subscription = source.subscribe()) {
      TopicPartition partition = new TopicPartition(TOPIC, 0);
      consumer.rebalance(List.of(partition));
      consumer.updateBeginningOffsets(Map.of(partition, 0L));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null, " "));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, null, "{not json"));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 2L, null, "[1,2,3]"));

      assertTrue(subscription.next(Duration.ofMillis(10)).isHeartbeat());
      assertTrue(subscription.next(Duration.ofMillis(10)).isHeartbeat());
      assertTrue(subscription.next(Duration.ofMillis(10)).isHeartbeat());
    }
  }

  @Test
  void everySubscriptionUsesAFreshConsumer() {
    int[] created = new int[1];
    KafkaEventSource source = new KafkaEventSource(() -> {
      created[0]++;
      return new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    }, TOPIC);

    source.subscribe().close();
    source.subscribe().close();

    assertEquals(2, created[0]);
  }

  @Test
  void closeCommitsOnlyRecordsHandedOut() {
    CommitRecordingConsumer consumer = new CommitRecordingConsumer();
    KafkaEventSource source = new KafkaEventSource(() -> consumer, TOPIC);
    TopicPartition partition = new TopicPartition(TOPIC, 0);

    try (EventSubscription subscription = source.subscribe()) {
      consumer.rebalance(List.of(partition));
      consumer.updateBeginningOffsets(Map.of(partition, 0L));
      for (long offset = 0; offset < 3; offset++) {
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, null, "{\"uri\":\"/in/" + offset + ".tif\"}"));
      }

      assertEquals("/in/0.tif", subscription.next(Duration.ofMillis(10)).payload().orElseThrow().get("uri"));
    }

    assertEquals(1L, consumer.committedOffsets.get(partition).offset());
  }

  @Test
  void deliveredRecordsAreCommittedBeforeTheNextPoll() {
    CommitRecordingConsumer consumer = new CommitRecordingConsumer();
    KafkaEventSource source = new KafkaEventSource(() -> consumer, TOPIC);
    TopicPartition partition = new TopicPartition(TOPIC, 0);

    try (EventSubscription subscription = source.subscribe()) {
      consumer.rebalance(List.of(partition));
      consumer.updateBeginningOffsets(Map.of(partition, 0L));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null, "{\"uri\":\"/in/a.tif\"}"));
      consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, null, "{\"uri\":\"/in/b.tif\"}"));

      subscription.next(Duration.ofMillis(10));
      subscription.next(Duration.ofMillis(10));
      assertTrue(consumer.committedOffsets.isEmpty());

      assertTrue(subscription.next(Duration.ofMillis(10)).isHeartbeat());
      assertEquals(2L, consumer.committedOffsets.get(partition).offset());
    }
  }

  private static final class CommitRecordingConsumer extends MockConsumer<String, String> {
    private final Map<TopicPartition, OffsetAndMetadata> committedOffsets = new HashMap<>();

    private CommitRecordingConsumer() {
      super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
      committedOffsets.putAll(offsets);
      super.commitSync(offsets);
    }
  }
}
