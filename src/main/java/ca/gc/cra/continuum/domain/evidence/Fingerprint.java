package ca.gc.cra.continuum.domain.evidence;

import java.util.Objects;

/**
 * <strong>What:</strong> One-way stand-in for a piece of text: SHA-256 digest plus character length.
 * <p><strong>Why:</strong> The only representation of request or response content allowed in persisted state.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param sha256Hex lower-case hexadecimal SHA-256 digest; never {@code null}
 * @param length number of UTF-16 characters in the fingerprinted text; never negative
 * @since 0.1.0
 */
public record Fingerprint(String sha256Hex, int length) {

  /**
   * Validates the digest and length.
   */
  public Fingerprint {
    Objects.requireNonNull(sha256Hex, "sha256Hex");
    if (length < 0) {
      throw new IllegalArgumentException("length must be >= 0");
    }
  }
}
