package ca.gc.cra.continuum.infrastructure.store;

import ca.gc.cra.continuum.application.port.EventStorePort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Publishes audit events to a Kafka topic, one record per event.
 *
 * <p>The record key is the event id taken from the object name ({@code analysis_<id>.json}); the store path travels
 * in the {@code continuum.path} header. Each write waits for the broker acknowledgement so the caller's write
 * receipt reflects the real outcome.</p>
 *
 * @since 0.1.0
 */
public final class KafkaEventStore implements EventStorePort {
  static final String PATH_HEADER = "continuum.path";

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final Duration sendTimeout;

  /**
   * Creates a store backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @param sendTimeout how long a single write waits for acknowledgement
   */
  public KafkaEventStore(String bootstrapServers, String topic, Duration sendTimeout) {
    this(createProducer(bootstrapServers, sendTimeout), topic, sendTimeout);
  }

  KafkaEventStore(Producer<String, byte[]> producer, String topic, Duration sendTimeout) {
    this.producer = Objects.requireNonNull(producer, "producer");
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    this.topic = topic.trim();
    this.sendTimeout = sendTimeout == null ? Duration.ofSeconds(10) : sendTimeout;
  }

  @Override
  public void write(String path, byte[] payload) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(payload, "payload");
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, eventKey(path), payload);
    record.headers().add(PATH_HEADER, path.getBytes(StandardCharsets.UTF_8));
    try {
      producer.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while publishing " + path, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new IOException("Kafka rejected " + path + ": " + cause.getMessage(), cause);
    } catch (TimeoutException ex) {
      throw new IOException("Timed out publishing " + path + " to " + topic, ex);
    } catch (RuntimeException ex) {
      throw new IOException("Kafka producer failed for " + path + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public String kind() {
    return "kafka";
  }

  /**
   * Flushes pending records and closes the producer, waiting up to five seconds.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  static String eventKey(String path) {
    String name = path.substring(path.lastIndexOf('/') + 1);
    if (name.endsWith(".json")) {
      name = name.substring(0, name.length() - ".json".length());
    }
    int underscore = name.indexOf('_');
    return underscore >= 0 ? name.substring(underscore + 1) : name;
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers, Duration sendTimeout) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    int timeoutMs = (int) Math.min(Integer.MAX_VALUE,
        sendTimeout == null ? 10_000L : Math.max(1_000L, sendTimeout.toMillis()));
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    props.put(ProducerConfig.RETRIES_CONFIG, 0);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, timeoutMs);
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
