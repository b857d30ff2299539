package ca.gc.cra.continuum.domain.evidence;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * <strong>What:</strong> Deterministic, optionally salted SHA-256 fingerprinting for text.
 * <p><strong>Why:</strong> Evidence must prove which text was evaluated without ever storing it.</p>
 * <p><strong>Role:</strong> Domain utility used by the evidence builder and by analysis event assembly.</p>
 * <p><strong>Thread-safety:</strong> Immutable; a fresh {@link MessageDigest} is created per call.</p>
 * <p><strong>Performance:</strong> O(n) in the UTF-8 length of salt plus text.</p>
 *
 * @implNote Input is hashed exactly as supplied; whitespace and case are significant.
 * @since 0.1.0
 */
public final class Fingerprinter {
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final String salt;

  /**
   * Creates a fingerprinter using the process-wide salt.
   *
   * @param salt salt prefixed to every input; {@code null} or empty means unsalted
   */
  public Fingerprinter(String salt) {
    this.salt = salt == null ? "" : salt;
  }

  /**
   * Creates an unsalted fingerprinter.
   *
   * @return fingerprinter with an empty salt
   */
  public static Fingerprinter unsalted() {
    return new Fingerprinter("");
  }

  /**
   * Fingerprints the supplied text.
   *
   * @param text text to fingerprint; {@code null} is treated as the empty string
   * @return digest and length pair
   */
  public Fingerprint fingerprint(String text) {
    return fingerprint(text, salt);
  }

  /**
   * Fingerprints {@code text} with an explicit salt.
   *
   * @param text text to fingerprint; {@code null} is treated as the empty string
   * @param salt salt prefixed before hashing; {@code null} is treated as the empty string
   * @return digest and length pair
   */
  public static Fingerprint fingerprint(String text, String salt) {
    String value = text == null ? "" : text;
    String prefix = salt == null ? "" : salt;
    MessageDigest digest = sha256();
    digest.update(prefix.getBytes(StandardCharsets.UTF_8));
    digest.update(value.getBytes(StandardCharsets.UTF_8));
    return new Fingerprint(toHex(digest.digest()), value.length());
  }

  /**
   * Indicates whether fingerprints from this instance are salted.
   *
   * @return {@code true} when a non-empty salt is configured
   */
  public boolean salted() {
    return !salt.isEmpty();
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      // Every JRE ships SHA-256.
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  private static String toHex(byte[] bytes) {
    char[] out = new char[bytes.length * 2];
    for (int i = 0; i < bytes.length; i++) {
      int v = bytes[i] & 0xFF;
      out[i * 2] = HEX[v >>> 4];
      out[i * 2 + 1] = HEX[v & 0x0F];
    }
    return new String(out);
  }
}
