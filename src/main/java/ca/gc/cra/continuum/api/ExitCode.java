package ca.gc.cra.continuum.api;

/**
 * <strong>What:</strong> Process exit codes shared by the {@code continuum} commands.
 * <p><strong>Why:</strong> Scripts wrapping the CLI tell a rejected license apart from bad input or an unreachable
 * backend without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or request values were invalid. */
  INVALID_ARGS(2),
  /** Store, engine or file IO failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** License rejected in stop mode. */
  LICENSE_INVALID(6),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status passed to {@link System#exit(int)}
   */
  public int code() {
    return code;
  }
}
