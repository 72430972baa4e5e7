package io.lapse.cli;

import io.lapse.LapseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits positional command-line tokens into codes.
 *
 * <p>A single token is taken as-is. Several codes must be comma-separated ({@code "A, B, C"} or
 * {@code A, B, C}); several tokens with no comma at all are rejected, since a code never contains
 * a space.
 */
final class CodeArguments {
  private CodeArguments() {}

  /**
   * Parses positional tokens.
   *
   * @param tokens the positional arguments, in order
   * @return the trimmed codes, in order; empty if none were given
   * @throws LapseException if multiple codes are not comma-separated, or tokens were given but
   *     none of them names a code
   */
  static List<String> parse(List<String> tokens) throws LapseException {
    if (tokens.isEmpty()) {
      return List.of();
    }
    String raw = String.join(" ", tokens);
    if (tokens.size() > 1 && raw.indexOf(',') < 0) {
      throw LapseException.input(
          "When passing multiple codes, separate them with commas, e.g. CODE1, CODE2, CODE3",
          raw,
          null);
    }

    List<String> codes = new ArrayList<>();
    for (String part : raw.split(",")) {
      String code = part.strip();
      if (code.isEmpty()) {
        continue;
      }
      if (code.indexOf(' ') >= 0) {
        throw LapseException.input(
            "Invalid code token with spaces. Separate multiple codes with commas, e.g. CODE1, CODE2",
            code,
            null);
      }
      codes.add(code);
    }
    if (codes.isEmpty()) {
      throw LapseException.input("no code(s) provided", raw, "pass CODE1, CODE2, ...");
    }
    return codes;
  }
}
