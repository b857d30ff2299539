package ca.gc.cra.continuum.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a map, splitting on the first {@code '='}.
 *
 * <p>Keys are trimmed and restricted to {@code [A-Za-z0-9._-]}. Values are trimmed except for {@code text}, whose
 * exact characters are analyzed and fingerprinted.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  static final String VERBATIM_KEY = "text";

  private CliArgsParser() {}

  /**
   * Parses arguments.
   *
   * @param args arguments; {@code null} yields an empty map
   * @return mutable ordered map
   * @throws IllegalArgumentException for tokens without {@code '='}, invalid keys, or control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int idx = raw.indexOf('=');
      if (idx < 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw.trim() + "')");
      }
      String key = raw.substring(0, idx).trim();
      if (key.isEmpty() || !KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: '" + key + "'");
      }
      String value = raw.substring(idx + 1);
      if (!VERBATIM_KEY.equals(key)) {
        value = value.trim();
        if (containsControl(value)) {
          throw new IllegalArgumentException("argument " + key + " must not contain control characters");
        }
      } else if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument text must not contain null bytes");
      }
      map.put(key, value);
    }
    return map;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
