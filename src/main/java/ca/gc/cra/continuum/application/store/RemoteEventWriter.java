package ca.gc.cra.continuum.application.store;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.port.EventStorePort;
import ca.gc.cra.continuum.domain.evidence.AnalysisEvent;
import ca.gc.cra.continuum.domain.evidence.FeedbackEvent;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes each audit event as its own immutable object in the remote store.
 * <p><strong>Why:</strong> Remote durability is best effort. A failed write is logged and reported through a
 * {@link WriteReceipt}; it never fails the request that produced the event.</p>
 * <p><strong>Behaviour:</strong> one attempt per event, no retry, no cross-event ordering.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent writers; counters are atomic.</p>
 *
 * @since 0.1.0
 */
public final class RemoteEventWriter {
  private static final Logger log = LoggerFactory.getLogger(RemoteEventWriter.class);

  private final EventStorePort store;
  private final JsonSupport json;
  private final AtomicLong successes = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();

  /**
   * Creates a writer.
   *
   * @param store target store; {@code null} disables writing and every call returns a skipped receipt
   * @param json serializer
   */
  public RemoteEventWriter(EventStorePort store, JsonSupport json) {
    this.store = store;
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Writer that skips every event.
   *
   * @return disabled writer
   */
  public static RemoteEventWriter disabled() {
    return new RemoteEventWriter(null, new JsonSupport());
  }

  public WriteReceipt writeAnalysis(AnalysisEvent event) {
    Objects.requireNonNull(event, "event");
    return write(EventPaths.analysis(event.timestamp(), event.id()), event.toWireMap());
  }

  public WriteReceipt writeFeedback(FeedbackEvent event) {
    Objects.requireNonNull(event, "event");
    return write(EventPaths.feedback(event.timestamp(), event.id()), event.toWireMap());
  }

  public boolean enabled() {
    return store != null;
  }

  /**
   * Backend kind for health and stats.
   *
   * @return store kind, or {@code none} when disabled
   */
  public String kind() {
    return store == null ? "none" : store.kind();
  }

  public long successes() {
    return successes.get();
  }

  public long failures() {
    return failures.get();
  }

  private WriteReceipt write(String path, Map<String, Object> wire) {
    if (store == null) {
      return WriteReceipt.skipped("store disabled");
    }
    try {
      byte[] payload = json.writeBytes(wire);
      store.write(path, payload);
      successes.incrementAndGet();
      log.debug("Wrote {} ({} bytes) to {} store", path, payload.length, store.kind());
      return WriteReceipt.written(path);
    } catch (IOException | RuntimeException ex) {
      failures.incrementAndGet();
      String detail = ex.getClass().getSimpleName() + (ex.getMessage() == null ? "" : ": " + ex.getMessage());
      log.warn("Event write to {} store failed for {}: {}", store.kind(), path, detail);
      return WriteReceipt.failed(path, detail);
    }
  }
}
