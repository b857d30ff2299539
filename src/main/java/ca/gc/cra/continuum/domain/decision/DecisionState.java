package ca.gc.cra.continuum.domain.decision;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabulary of decisions reported for every analyzed request.
 *
 * @since 0.1.0
 */
public enum DecisionState {
  /** Request passes unchanged. */
  ALLOW,
  /** Request passes with guidance attached. */
  GUIDE,
  /** Request is refused; no output is produced. */
  BLOCK;

  /**
   * Lower-case label used in metrics keys and event metadata.
   *
   * @return label such as {@code block}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses an upstream-asserted state without failing on unknown values.
   *
   * @param raw asserted value, any case; may be {@code null}
   * @return matching state, or empty when {@code raw} is blank or not a known state
   */
  public static Optional<DecisionState> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (DecisionState state : values()) {
      if (state.name().equals(normalized)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }
}
