package ca.gc.cra.bulk.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bulk.domain.command.Bulk;
import ca.gc.cra.bulk.domain.command.Command;
import java.util.List;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaBulkConsumerTest {
  private static final Bulk BULK = Bulk.of(List.of(new Command("cmd1", 10L), new Command("say \"hi\"", 20L)));

  @Test
  void publishesJsonDocumentKeyedBySession() throws Exception {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    KafkaBulkConsumer consumer = new KafkaBulkConsumer(producer, "bulk.batches.v1", "session-3");

    consumer.update(BULK);
    consumer.process();
    consumer.close();

    assertEquals(1, producer.history().size());
    ProducerRecord<String, String> record = producer.history().get(0);
    assertEquals("bulk.batches.v1", record.topic());
    assertEquals("session-3", record.key());
    assertEquals(
        "{\"session\":\"session-3\",\"size\":2,\"firstTimestampMillis\":10,\"commands\":["
            + "{\"text\":\"cmd1\",\"timestampMillis\":10},"
            + "{\"text\":\"say \\\"hi\\\"\",\"timestampMillis\":20}]}",
        record.value());
    assertTrue(producer.closed());
  }

  @Test
  void brokerFailureSurfacesFromProcess() {
    MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
    KafkaBulkConsumer consumer = new KafkaBulkConsumer(producer, "bulk.batches.v1", "session-1");
    consumer.update(BULK);

    Thread failer = new Thread(() -> {
      while (!producer.errorNext(new IllegalStateException("broker down"))) {
        Thread.onSpinWait();
      }
    });
    failer.start();

    assertThrows(ExecutionException.class, consumer::process);
  }

  @Test
  void invalidTopicIsRejected() {
    MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
    assertThrows(IllegalArgumentException.class, () -> new KafkaBulkConsumer(producer, "bad topic", "s"));
  }
}
