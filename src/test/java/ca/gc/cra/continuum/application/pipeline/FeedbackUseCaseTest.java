package ca.gc.cra.continuum.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.store.RemoteEventWriter;
import ca.gc.cra.continuum.testing.InMemoryEventStore;
import ca.gc.cra.continuum.testing.MutableClock;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeedbackUseCaseTest {
  private final InMemoryEventStore store = new InMemoryEventStore();
  private final FeedbackUseCase useCase = new FeedbackUseCase(
      new RemoteEventWriter(store, new JsonSupport()), new MutableClock(Instant.parse("2025-02-10T08:00:00Z")));

  @Test
  void recordsFeedbackAgainstLogId() {
    FeedbackResult result = useCase.submit(" 01JABCDEF ", 4, 5, true);

    Map<String, Object> response = result.toResponseMap();
    assertEquals("success", response.get("status"));
    assertEquals("written", response.get("write_status"));
    assertEquals(1L, useCase.feedbackCount());

    String path = "feedback/2025/02/10/feedback_" + result.feedbackId() + ".json";
    Map<String, Object> wire = new JsonSupport().parseObject(store.objects().get(path));
    assertEquals("01JABCDEF", wire.get("target_log_id"));
    assertEquals(Map.of("accuracy", 4, "helpful", 5, "accepted", true), wire.get("feedback"));
  }

  @Test
  void rejectsBlankIdsAndBadScores() {
    assertThrows(InvalidRequestException.class, () -> useCase.submit(" ", 1, 1, false));
    assertThrows(InvalidRequestException.class, () -> useCase.submit("x".repeat(129), 1, 1, false));
    assertThrows(InvalidRequestException.class, () -> useCase.submit("id", 9, 1, false));
    assertEquals(0L, useCase.feedbackCount());
    assertEquals(0, store.objects().size());
  }

  @Test
  void storeFailureStillAcceptsFeedback() {
    store.failWrites(true);

    FeedbackResult result = useCase.submit("id", 0, 0, false);

    assertEquals("failed", result.toResponseMap().get("write_status"));
    assertEquals(1L, useCase.feedbackCount());
  }
}
