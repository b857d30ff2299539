package ca.gc.cra.continuum.application.pipeline;

import ca.gc.cra.continuum.application.port.ClockPort;
import ca.gc.cra.continuum.application.store.RemoteEventWriter;
import ca.gc.cra.continuum.application.store.WriteReceipt;
import ca.gc.cra.continuum.domain.evidence.EventId;
import ca.gc.cra.continuum.domain.evidence.FeedbackEvent;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts feedback keyed by an opaque analysis id and writes it as its own event.
 *
 * <p>The referenced analysis is never looked up; the store is append-only and not queried back.</p>
 *
 * @since 0.1.0
 */
public final class FeedbackUseCase {
  private static final Logger log = LoggerFactory.getLogger(FeedbackUseCase.class);
  private static final int MAX_LOG_ID_LENGTH = 128;

  private final RemoteEventWriter writer;
  private final ClockPort clock;
  private final AtomicLong submitted = new AtomicLong();

  public FeedbackUseCase(RemoteEventWriter writer, ClockPort clock) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records feedback.
   *
   * @param logId analysis id returned by a previous analysis
   * @param accuracy accuracy score in {@code [0, 5]}
   * @param helpful helpfulness score in {@code [0, 5]}
   * @param accepted whether the output was accepted
   * @return opaque feedback id and write outcome
   * @throws InvalidRequestException when the id is blank or a score is out of range
   */
  public FeedbackResult submit(String logId, int accuracy, int helpful, boolean accepted) {
    if (logId == null || logId.isBlank()) {
      throw new InvalidRequestException("log_id must not be blank");
    }
    String target = logId.trim();
    if (target.length() > MAX_LOG_ID_LENGTH) {
      throw new InvalidRequestException("log_id must be at most " + MAX_LOG_ID_LENGTH + " characters");
    }
    Instant now = clock.now();
    FeedbackEvent event;
    try {
      event = new FeedbackEvent(EventId.newId(now.toEpochMilli()), now, target, accuracy, helpful, accepted);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRequestException(ex.getMessage());
    }
    WriteReceipt receipt = writer.writeFeedback(event);
    submitted.incrementAndGet();
    log.info("Feedback {} recorded for analysis {} (write={})", event.id(), target, receipt.status());
    return new FeedbackResult(event.id(), receipt);
  }

  /**
   * Feedback submissions accepted since startup.
   *
   * @return monotonic count
   */
  public long feedbackCount() {
    return submitted.get();
  }
}
