package ca.gc.cra.continuum.application.decision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.continuum.domain.decision.DecisionState;
import ca.gc.cra.continuum.domain.decision.Verdict;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DecisionNormalizerTest {
  private final DecisionNormalizer normalizer = new DecisionNormalizer();

  @Test
  void modeMapsToState() {
    assertEquals(DecisionState.ALLOW, normalizer.normalize("no-op", "Neutral", "general"));
    assertEquals(DecisionState.BLOCK, normalizer.normalize("block", "Neutral", null));
    assertEquals(DecisionState.GUIDE, normalizer.normalize("guide", "Neutral", null));
    assertEquals(DecisionState.GUIDE, normalizer.normalize(null, null, null));
    assertEquals(DecisionState.GUIDE, normalizer.normalize("rewrite", null, null));
  }

  @Test
  void outOfScopeAndCrisisOverrideMode() {
    assertEquals(DecisionState.BLOCK, normalizer.normalize("no-op", "OutOfScope", null));
    assertEquals(DecisionState.BLOCK, normalizer.normalize("guide", "Neutral", "Crisis_Escalation"));
    assertEquals(DecisionState.BLOCK, normalizer.normalize("no-op", null, "topic_out_of_scope"));
  }

  @Test
  void mismatchIsCorrectedAndLogged() {
    Logger logger = (Logger) LoggerFactory.getLogger(DecisionNormalizer.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      Verdict verdict = Verdict.builder()
          .freqType("OutOfScope")
          .mode("guide")
          .metrics(Map.of("decision_state", "GUIDE"))
          .build();

      DecisionOutcome outcome = normalizer.resolve(verdict);

      assertEquals(DecisionState.BLOCK, outcome.state());
      assertTrue(outcome.assertedMismatch());
      assertTrue(outcome.modeMismatch());
      assertEquals(DecisionState.GUIDE, outcome.modeImpliedState());
      assertEquals(2, appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count());
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void agreeingAssertionIsQuiet() {
    Logger logger = (Logger) LoggerFactory.getLogger(DecisionNormalizer.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      Verdict verdict = Verdict.builder().mode("no-op").metrics(Map.of("decision_state", "allow")).build();

      DecisionOutcome outcome = normalizer.resolve(verdict);

      assertEquals(DecisionState.ALLOW, outcome.state());
      assertFalse(outcome.assertedMismatch());
      assertTrue(appender.list.isEmpty());
    } finally {
      logger.detachAppender(appender);
    }
  }
}
