package ca.gc.cra.bulk.infrastructure.output;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.domain.command.Bulk;
import ca.gc.cra.bulk.domain.command.Command;
import ca.gc.cra.bulk.validation.Net;
import ca.gc.cra.bulk.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Publishes each bulk as a JSON document to a Kafka topic.
 *
 * <p>Payload shape:
 * {@code {"session":"session-1","size":2,"firstTimestampMillis":t,"commands":[{"text":"a","timestampMillis":t},...]}}.
 * The record key is the session label so all bulks of one session land on the same partition in order.</p>
 *
 * @implNote {@link #process()} waits for the broker acknowledgement so a failed send is reported as a
 * consumer failure for that bulk; {@link #close()} flushes and closes the producer.
 * @since 0.1.0
 */
public final class KafkaBulkConsumer implements BulkConsumer {
  private static final JsonFactory JSON = new JsonFactory();
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Producer<String, String> producer;
  private final String topic;
  private final String sessionKey;
  private volatile Bulk current = Bulk.empty();

  /**
   * Creates a consumer backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated {@code host:port} list
   * @param topic destination topic
   * @param sessionKey record key and {@code session} field value
   * @throws IllegalArgumentException if the bootstrap list or topic is invalid
   */
  public KafkaBulkConsumer(String bootstrapServers, String topic, String sessionKey) {
    this(createProducer(bootstrapServers), topic, sessionKey);
  }

  KafkaBulkConsumer(Producer<String, String> producer, String topic, String sessionKey) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
    this.sessionKey = Strings.requireNonBlank("sessionKey", sessionKey);
  }

  @Override
  public void update(Bulk bulk) {
    current = Objects.requireNonNull(bulk, "bulk");
  }

  /**
   * Sends the recorded bulk and waits for the acknowledgement.
   *
   * @throws IOException if the payload cannot be serialized
   * @throws ExecutionException if the broker rejects the record
   * @throws InterruptedException if interrupted while waiting for the acknowledgement
   */
  @Override
  public void process() throws IOException, ExecutionException, InterruptedException {
    Bulk bulk = current;
    if (bulk.isEmpty()) {
      return;
    }
    producer.send(new ProducerRecord<>(topic, sessionKey, toJson(sessionKey, bulk))).get();
  }

  /**
   * Flushes pending records and closes the producer.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(CLOSE_TIMEOUT);
  }

  @Override
  public String name() {
    return "kafka";
  }

  static String toJson(String session, Bulk bulk) throws IOException {
    StringWriter writer = new StringWriter(64 + bulk.size() * 32);
    try (JsonGenerator gen = JSON.createGenerator(writer)) {
      gen.writeStartObject();
      gen.writeStringField("session", session);
      gen.writeNumberField("size", bulk.size());
      gen.writeNumberField("firstTimestampMillis", bulk.firstTimestampMillis());
      gen.writeArrayFieldStart("commands");
      for (Command command : bulk.commands()) {
        gen.writeStartObject();
        gen.writeStringField("text", command.text());
        gen.writeNumberField("timestampMillis", command.timestampMillis());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return writer.toString();
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, Net.validateBootstrapServers(bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
