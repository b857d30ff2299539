package ca.gc.cra.continuum.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CLI arguments split into {@code --flags} and {@code key=value} tokens.
 *
 * @param tokens raw {@code key=value} tokens in command-line order
 * @param flags lowercase flags; help and verbose aliases are folded to {@code --help} and {@code --verbose}
 */
public record CliInput(List<String> tokens, Set<String> flags) {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "--help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "--verbose", "--verbose");

  public CliInput {
    tokens = List.copyOf(tokens);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Tokens starting with {@code -} and containing no {@code =} are flags; everything else is
   * kept for key/value parsing.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> tokens = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String lower = raw.trim().toLowerCase(Locale.ROOT);
        String alias = ALIASES.get(lower);
        if (alias != null) {
          flags.add(alias);
        } else if (lower.startsWith("-") && lower.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          // text= values may carry meaningful surrounding whitespace
          tokens.add(raw);
        }
      }
    }
    return new CliInput(tokens, flags);
  }

  public String[] keyValueArgs() {
    return tokens.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag such as {@code --pretty}.
   *
   * @param flag flag to query, case-insensitive
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && !flag.isBlank() && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
