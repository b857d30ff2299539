package ca.gc.cra.continuum.application.scrub;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Recursive sanitizer that removes raw-text and content-derived keys from arbitrary nested
 * maps and lists.
 * <p><strong>Why:</strong> Everything that reaches the audit trail passes through here, so no text or text fragment
 * leaves the process even when the Decision Engine adds new fields.</p>
 * <p><strong>Role:</strong> Application service used by the evidence builder on {@code audit}, {@code metrics} and
 * the assembled record.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>Total: never throws, whatever the input shape.</li>
 *   <li>Idempotent: {@code scrub(scrub(x)).equals(scrub(x))}.</li>
 *   <li>Drop decisions look at the original value size; truncation applies after children are scrubbed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable {@link ScrubRules}; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(n) in the number of visited nodes; depth is bounded by
 * {@link ScrubRules#maxDepth()}. A container that contains itself is replaced by
 * {@link ScrubRules#DEPTH_MARKER} where it recurs.</p>
 *
 * @since 0.1.0
 */
public final class ContentScrubber {
  private static final Logger log = LoggerFactory.getLogger(ContentScrubber.class);

  private final ScrubRules rules;

  /**
   * Creates a scrubber with the default rule table.
   */
  public ContentScrubber() {
    this(ScrubRules.defaults());
  }

  /**
   * Creates a scrubber with an explicit rule table.
   *
   * @param rules rule table; must not be {@code null}
   */
  public ContentScrubber(ScrubRules rules) {
    this.rules = Objects.requireNonNull(rules, "rules");
  }

  /**
   * Scrubs any value.
   *
   * @param value map, list, array or scalar; may be {@code null}
   * @return scrubbed copy; maps become ordered maps, collections and object arrays become lists, scalars are
   *     returned as-is
   */
  public Object scrub(Object value) {
    try {
      return scrubValue(value, 0, newPath());
    } catch (RuntimeException ex) {
      // Concurrent mutation of the caller's structure is the only way to get here.
      log.warn("Scrub aborted ({}); substituting empty structure", ex.getClass().getSimpleName());
      return value instanceof Map<?, ?> ? new LinkedHashMap<String, Object>() : List.of();
    }
  }

  /**
   * Scrubs a map, the common case for engine {@code audit} and {@code metrics} objects.
   *
   * @param value map to scrub; {@code null} yields an empty map
   * @return scrubbed, mutable ordered map owned by the caller
   */
  public Map<String, Object> scrubMap(Map<?, ?> value) {
    if (value == null) {
      return new LinkedHashMap<>();
    }
    Set<Object> path = newPath();
    path.add(value);
    try {
      return scrubEntries(value, 0, path);
    } catch (RuntimeException ex) {
      log.warn("Scrub aborted ({}); substituting empty structure", ex.getClass().getSimpleName());
      return new LinkedHashMap<>();
    }
  }

  /**
   * Returns the active rule table.
   *
   * @return rules applied by this scrubber
   */
  public ScrubRules rules() {
    return rules;
  }

  private static Set<Object> newPath() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }

  private Object scrubValue(Object value, int depth, Set<Object> path) {
    boolean container = value instanceof Map<?, ?>
        || value instanceof Collection<?>
        || value instanceof Object[];
    if (!container) {
      return value;
    }
    // path holds the containers between the root and this node, by identity.
    if (depth > rules.maxDepth() || !path.add(value)) {
      return ScrubRules.DEPTH_MARKER;
    }
    try {
      if (value instanceof Map<?, ?> map) {
        return scrubEntries(map, depth, path);
      }
      if (value instanceof Collection<?> collection) {
        return scrubElements(collection, depth, path);
      }
      return scrubElements(Arrays.asList((Object[]) value), depth, path);
    } finally {
      path.remove(value);
    }
  }

  private Map<String, Object> scrubEntries(Map<?, ?> map, int depth, Set<Object> path) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (rules.alwaysDrop(key)) {
        continue;
      }
      if (rules.hasSubstringSignal(key) && rules.oversized(value)) {
        continue;
      }
      if (out.size() >= rules.maxMapKeys()) {
        // Later keys would be truncated anyway.
        continue;
      }
      out.put(key, scrubValue(value, depth + 1, path));
    }
    return out;
  }

  private List<Object> scrubElements(Collection<?> collection, int depth, Set<Object> path) {
    List<Object> out = new ArrayList<>(Math.min(collection.size(), rules.maxListItems()));
    for (Object element : collection) {
      if (out.size() >= rules.maxListItems()) {
        break;
      }
      out.add(scrubValue(element, depth + 1, path));
    }
    return out;
  }
}
