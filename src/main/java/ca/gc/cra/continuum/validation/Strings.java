package ca.gc.cra.continuum.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String checks applied to configuration and CLI values before adapters are built.
 * <p><strong>Why:</strong> Store, license and engine adapters open network connections with these values;
 * rejecting blank or control-character input early keeps failures at startup instead of mid-request.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Pattern REPO_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims a value and rejects blanks and control characters.
   *
   * @param name parameter name used in messages
   * @param value candidate; must not be {@code null}
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Returns the trimmed value, or {@code null} when it is {@code null} or blank.
   *
   * @param value candidate
   * @return trimmed value or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name parameter name used in messages
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore, or hyphen");
    }
    return sanitized;
  }

  /**
   * Validates a GitHub repository slug.
   *
   * @param name parameter name used in messages
   * @param repo candidate in {@code owner/name} form
   * @return trimmed slug
   */
  public static String requireRepoSlug(String name, String repo) {
    String sanitized = requireNonBlank(name, repo);
    if (!REPO_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(label(name) + " must be owner/name (was " + sanitized + ")");
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
