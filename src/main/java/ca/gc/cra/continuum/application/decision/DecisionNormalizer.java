package ca.gc.cra.continuum.application.decision;

import ca.gc.cra.continuum.domain.decision.DecisionState;
import ca.gc.cra.continuum.domain.decision.Verdict;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps engine verdict fields onto the closed {@link DecisionState} vocabulary.
 * <p><strong>Priority:</strong>
 * <ol>
 *   <li>{@code freqType == "OutOfScope"} yields {@link DecisionState#BLOCK}.</li>
 *   <li>A scenario containing {@code out_of_scope} or {@code crisis} (any case) yields {@link DecisionState#BLOCK}.</li>
 *   <li>Mode {@code no-op} yields {@link DecisionState#ALLOW}, {@code block} yields {@link DecisionState#BLOCK},
 *   anything else {@link DecisionState#GUIDE}.</li>
 * </ol>
 * <p>The computed state always wins. Disagreement with an engine-asserted {@code metrics.decision_state} or with
 * the mode-implied state is logged at WARN and never fails the request.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DecisionNormalizer {
  private static final Logger log = LoggerFactory.getLogger(DecisionNormalizer.class);

  /** Engine classification label that always blocks. */
  public static final String OUT_OF_SCOPE = "OutOfScope";

  /**
   * Computes the decision state.
   *
   * @param mode engine mode; may be {@code null}
   * @param freqType engine classification; may be {@code null}
   * @param scenario output scenario; may be {@code null}
   * @return authoritative decision state
   */
  public DecisionState normalize(String mode, String freqType, String scenario) {
    if (OUT_OF_SCOPE.equals(freqType)) {
      return DecisionState.BLOCK;
    }
    if (scenario != null) {
      String lower = scenario.toLowerCase(Locale.ROOT);
      if (lower.contains("out_of_scope") || lower.contains("crisis")) {
        return DecisionState.BLOCK;
      }
    }
    return fromMode(mode);
  }

  /**
   * Resolves a verdict and reports disagreements.
   *
   * @param verdict engine verdict; must not be {@code null}
   * @return authoritative outcome
   */
  public DecisionOutcome resolve(Verdict verdict) {
    Objects.requireNonNull(verdict, "verdict");
    DecisionState state = normalize(verdict.mode(), verdict.freqType(), verdict.scenario());

    String asserted = verdict.assertedDecisionState();
    boolean assertedMismatch = false;
    if (asserted != null) {
      Optional<DecisionState> parsed = DecisionState.parse(asserted);
      if (parsed.isEmpty() || parsed.get() != state) {
        assertedMismatch = true;
        log.warn("Decision state mismatch: engine asserted {} but authoritative state is {}", asserted, state);
      }
    }

    DecisionState implied = fromMode(verdict.mode());
    if (implied != state) {
      log.warn(
          "Decision state mismatch: mode {} implies {} but authoritative state is {} (freq_type={})",
          verdict.mode(),
          implied,
          state,
          verdict.freqType());
    }
    return new DecisionOutcome(state, asserted, assertedMismatch, implied);
  }

  private static DecisionState fromMode(String mode) {
    String normalized = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "no-op" -> DecisionState.ALLOW;
      case "block" -> DecisionState.BLOCK;
      default -> DecisionState.GUIDE;
    };
  }
}
