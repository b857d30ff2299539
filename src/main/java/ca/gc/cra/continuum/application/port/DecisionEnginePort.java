package ca.gc.cra.continuum.application.port;

import ca.gc.cra.continuum.domain.decision.Verdict;

/**
 * <strong>What:</strong> Port to the external Decision Engine that classifies request text.
 * <p><strong>Why:</strong> Classification, scoring and repair live outside this service; the audit pipeline only
 * records and normalizes what the engine decides.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent evaluations.</p>
 *
 * @since 0.1.0
 */
public interface DecisionEnginePort {
  /**
   * Evaluates request text.
   *
   * @param text raw request text; never persisted by callers
   * @return engine verdict; an engine-side refusal is reported through {@link Verdict#error()}
   * @throws DecisionEngineException when the engine is unreachable or its answer cannot be read
   */
  Verdict evaluate(String text) throws DecisionEngineException;
}
