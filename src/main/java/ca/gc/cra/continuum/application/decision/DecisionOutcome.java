package ca.gc.cra.continuum.application.decision;

import ca.gc.cra.continuum.domain.decision.DecisionState;
import java.util.Objects;

/**
 * Authoritative decision for one verdict together with the disagreements observed while resolving it.
 *
 * @param state authoritative decision state
 * @param assertedState raw state asserted by the engine in its metrics; {@code null} when absent
 * @param assertedMismatch whether the asserted state differed from {@code state}
 * @param modeImpliedState state implied by the engine mode alone
 * @since 0.1.0
 */
public record DecisionOutcome(
    DecisionState state,
    String assertedState,
    boolean assertedMismatch,
    DecisionState modeImpliedState) {

  public DecisionOutcome {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(modeImpliedState, "modeImpliedState");
  }

  /**
   * Indicates whether the mode alone would have produced a different state.
   *
   * @return {@code true} when an override such as OutOfScope changed the outcome
   */
  public boolean modeMismatch() {
    return modeImpliedState != state;
  }
}
