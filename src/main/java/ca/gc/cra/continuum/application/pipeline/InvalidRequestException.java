package ca.gc.cra.continuum.application.pipeline;

/**
 * Raised when a request is malformed or the Decision Engine refuses it (400-equivalent).
 *
 * @since 0.1.0
 */
public class InvalidRequestException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public InvalidRequestException(String message) {
    super(message);
  }
}
