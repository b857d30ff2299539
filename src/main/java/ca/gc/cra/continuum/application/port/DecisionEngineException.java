package ca.gc.cra.continuum.application.port;

/**
 * Raised when the Decision Engine cannot be reached or returns an unreadable verdict.
 *
 * @since 0.1.0
 */
public class DecisionEngineException extends Exception {
  private static final long serialVersionUID = 1L;

  public DecisionEngineException(String message) {
    super(message);
  }

  public DecisionEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
