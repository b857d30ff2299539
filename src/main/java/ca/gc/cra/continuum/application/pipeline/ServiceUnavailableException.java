package ca.gc.cra.continuum.application.pipeline;

/**
 * Raised when a required collaborator, such as the Decision Engine, is not configured (503-equivalent).
 *
 * @since 0.1.0
 */
public class ServiceUnavailableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ServiceUnavailableException(String message) {
    super(message);
  }
}
