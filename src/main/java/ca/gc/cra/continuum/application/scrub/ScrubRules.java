package ca.gc.cra.continuum.application.scrub;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Declarative rule table deciding which keys the content scrubber removes and how large
 * collections may grow.
 * <p><strong>Why:</strong> Keeping the privacy rules as data lets them be tested and reviewed apart from the
 * traversal that applies them.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Raw-text keys and content-derived keys (exact names or prefixes) are always dropped.</li>
 *   <li>Keys containing a substring signal are dropped when their value is oversized.</li>
 *   <li>Any other oversized collection is truncated to the size caps.</li>
 * </ul>
 * <p>Keys are compared after {@link #normalizeKey(String) normalization} and also in their underscore-free
 * form, so {@code RepairedText}, {@code repaired-text} and {@code repairedtext} all match {@code repaired_text}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ScrubRules {
  /** Marker written in place of structures nested beyond {@link #maxDepth()}. */
  public static final String DEPTH_MARKER = "[depth_limit]";

  private static final List<String> DEFAULT_RAW_TEXT_KEYS = List.of(
      "text",
      "input_text",
      "original",
      "normalized",
      "repaired_text",
      "raw_ai_output",
      "llm_raw_output",
      "llm_raw_response",
      "prompt",
      "messages",
      "completion",
      "response_text",
      "content");

  private static final List<String> DEFAULT_CONTENT_DERIVED_KEYS = List.of(
      "oos_matched",
      "lexicon_hits",
      "pattern_hits",
      "spans",
      "entities",
      "phrases");

  private static final List<String> DEFAULT_CONTENT_DERIVED_PREFIXES = List.of(
      "matched",
      "keywords",
      "trigger",
      "detected_");

  private static final List<String> DEFAULT_SUBSTRING_SIGNALS = List.of(
      "text",
      "content",
      "message",
      "prompt",
      "completion",
      "response",
      "utterance",
      "transcript",
      "input",
      "output",
      "matched",
      "keyword",
      "trigger",
      "lexicon",
      "pattern",
      "phrase");

  private static final ScrubRules DEFAULTS = new ScrubRules(
      DEFAULT_RAW_TEXT_KEYS,
      DEFAULT_CONTENT_DERIVED_KEYS,
      DEFAULT_CONTENT_DERIVED_PREFIXES,
      DEFAULT_SUBSTRING_SIGNALS,
      600,
      80,
      120,
      32);

  private final Set<String> exactKeys;
  private final Set<String> compactExactKeys;
  private final List<String> prefixes;
  private final List<String> compactPrefixes;
  private final List<String> substringSignals;
  private final int maxStringLength;
  private final int maxListItems;
  private final int maxMapKeys;
  private final int maxDepth;

  /**
   * Creates a rule table.
   *
   * @param rawTextKeys keys that hold raw request or response text
   * @param contentDerivedKeys keys that hold fragments derived from content
   * @param contentDerivedPrefixes key prefixes that denote content-derived fields
   * @param substringSignals substrings that mark a key as possibly content-bearing
   * @param maxStringLength strings longer than this under a signalled key cause a drop
   * @param maxListItems list size cap
   * @param maxMapKeys map size cap
   * @param maxDepth deepest nesting level kept before the depth marker is substituted
   */
  public ScrubRules(
      List<String> rawTextKeys,
      List<String> contentDerivedKeys,
      List<String> contentDerivedPrefixes,
      List<String> substringSignals,
      int maxStringLength,
      int maxListItems,
      int maxMapKeys,
      int maxDepth) {
    Set<String> exact = new LinkedHashSet<>();
    for (String key : Objects.requireNonNull(rawTextKeys, "rawTextKeys")) {
      exact.add(normalizeKey(key));
    }
    for (String key : Objects.requireNonNull(contentDerivedKeys, "contentDerivedKeys")) {
      exact.add(normalizeKey(key));
    }
    Set<String> compact = new LinkedHashSet<>();
    for (String key : exact) {
      compact.add(compact(key));
    }
    this.exactKeys = Set.copyOf(exact);
    this.compactExactKeys = Set.copyOf(compact);
    this.prefixes = List.copyOf(Objects.requireNonNull(contentDerivedPrefixes, "contentDerivedPrefixes"));
    this.compactPrefixes = this.prefixes.stream().map(ScrubRules::compact).toList();
    this.substringSignals = List.copyOf(Objects.requireNonNull(substringSignals, "substringSignals"));
    if (maxStringLength <= 0 || maxListItems <= 0 || maxMapKeys <= 0 || maxDepth <= 0) {
      throw new IllegalArgumentException("scrub limits must be positive");
    }
    this.maxStringLength = maxStringLength;
    this.maxListItems = maxListItems;
    this.maxMapKeys = maxMapKeys;
    this.maxDepth = maxDepth;
  }

  /**
   * Returns the production rule table.
   *
   * @return shared default rules
   */
  public static ScrubRules defaults() {
    return DEFAULTS;
  }

  /**
   * Indicates whether a key must always be removed.
   *
   * @param key raw key
   * @return {@code true} for raw-text and content-derived keys
   */
  public boolean alwaysDrop(String key) {
    String normalized = normalizeKey(key);
    String compact = compact(normalized);
    if (exactKeys.contains(normalized) || compactExactKeys.contains(compact)) {
      return true;
    }
    for (int i = 0; i < prefixes.size(); i++) {
      if (normalized.startsWith(prefixes.get(i)) || compact.startsWith(compactPrefixes.get(i))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Indicates whether a key carries a substring signal.
   *
   * @param key raw key
   * @return {@code true} when any signal occurs anywhere in the normalized key
   */
  public boolean hasSubstringSignal(String key) {
    String compact = compact(normalizeKey(key));
    for (String signal : substringSignals) {
      if (compact.contains(signal)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Indicates whether a value exceeds the size caps.
   *
   * @param value candidate value
   * @return {@code true} for long strings and oversized lists, arrays or maps
   */
  public boolean oversized(Object value) {
    if (value instanceof CharSequence text) {
      return text.length() > maxStringLength;
    }
    if (value instanceof Collection<?> collection) {
      return collection.size() > maxListItems;
    }
    if (value instanceof Object[] array) {
      return array.length > maxListItems;
    }
    if (value instanceof Map<?, ?> map) {
      return map.size() > maxMapKeys;
    }
    return false;
  }

  public int maxStringLength() {
    return maxStringLength;
  }

  public int maxListItems() {
    return maxListItems;
  }

  public int maxMapKeys() {
    return maxMapKeys;
  }

  public int maxDepth() {
    return maxDepth;
  }

  /**
   * Normalizes a key: camelCase boundaries and {@code - . space} become underscores, then lower-case.
   *
   * @param key raw key; {@code null} becomes {@code "null"}
   * @return normalized key
   */
  public static String normalizeKey(String key) {
    String raw = key == null ? "null" : key;
    StringBuilder out = new StringBuilder(raw.length() + 8);
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == '-' || c == '.' || c == ' ') {
        out.append('_');
        continue;
      }
      if (Character.isUpperCase(c) && i > 0) {
        char prev = raw.charAt(i - 1);
        boolean nextLower = i + 1 < raw.length() && Character.isLowerCase(raw.charAt(i + 1));
        if (Character.isLowerCase(prev) || Character.isDigit(prev)
            || (Character.isUpperCase(prev) && nextLower)) {
          out.append('_');
        }
      }
      out.append(c);
    }
    return out.toString().toLowerCase(Locale.ROOT);
  }

  private static String compact(String normalized) {
    return normalized.replace("_", "");
  }
}
