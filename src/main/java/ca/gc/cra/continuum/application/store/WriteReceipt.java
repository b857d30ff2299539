package ca.gc.cra.continuum.application.store;

import java.util.Objects;

/**
 * Outcome of one best-effort event write.
 *
 * @param status write outcome
 * @param path store path attempted; {@code null} when skipped
 * @param detail failure or skip detail; {@code null} when written
 * @since 0.1.0
 */
public record WriteReceipt(Status status, String path, String detail) {

  /** Write outcomes. */
  public enum Status {
    /** Object accepted by the store. */
    WRITTEN,
    /** The single attempt failed. */
    FAILED,
    /** No store configured. */
    SKIPPED
  }

  public WriteReceipt {
    Objects.requireNonNull(status, "status");
  }

  public static WriteReceipt written(String path) {
    return new WriteReceipt(Status.WRITTEN, path, null);
  }

  public static WriteReceipt failed(String path, String detail) {
    return new WriteReceipt(Status.FAILED, path, detail);
  }

  public static WriteReceipt skipped(String detail) {
    return new WriteReceipt(Status.SKIPPED, null, detail);
  }

  public boolean written() {
    return status == Status.WRITTEN;
  }
}
