package ca.gc.cra.continuum.infrastructure.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.Test;

class KafkaEventStoreTest {

  @Test
  void publishesEventKeyedById() throws Exception {
    MockProducer<String, byte[]> producer = MockProducerFactory.eventProducer();
    KafkaEventStore store = new KafkaEventStore(producer, "continuum.audit.events", Duration.ofSeconds(1));
    byte[] payload = "{\"id\":\"01JX\"}".getBytes(StandardCharsets.UTF_8);

    store.write("events/2025/01/02/analysis_01JX.json", payload);

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    assertEquals("continuum.audit.events", record.topic());
    assertEquals("01JX", record.key());
    assertArrayEquals(payload, record.value());
    assertEquals("events/2025/01/02/analysis_01JX.json",
        new String(record.headers().lastHeader(KafkaEventStore.PATH_HEADER).value(), StandardCharsets.UTF_8));
    assertEquals("kafka", store.kind());
  }

  @Test
  void eventKeyStripsPrefixAndExtension() {
    assertEquals("ABC", KafkaEventStore.eventKey("feedback/2025/01/02/feedback_ABC.json"));
    assertEquals("plain", KafkaEventStore.eventKey("plain"));
  }

  @Test
  void producerFailureSurfacesAsIoException() {
    MockProducer<String, byte[]> producer = MockProducerFactory.eventProducer();
    KafkaEventStore store = new KafkaEventStore(producer, "topic", Duration.ofSeconds(1));
    producer.close();

    assertThrows(IOException.class, () -> store.write("events/x/analysis_1.json", new byte[] {1}));
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<String, byte[]> producer = MockProducerFactory.eventProducer();
    KafkaEventStore store = new KafkaEventStore(producer, "topic", null);

    store.close();

    assertTrue(producer.closed());
  }

  @Test
  void blankTopicIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaEventStore(MockProducerFactory.eventProducer(), " ", null));
  }
}
