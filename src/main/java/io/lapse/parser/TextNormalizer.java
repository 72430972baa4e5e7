package io.lapse.parser;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites free-form expiry text into the shape the free-text grammars expect.
 *
 * <p>Rules run in declaration order:
 *
 * <ol>
 *   <li>{@link Rule#ORDINAL_SUFFIX} - "3rd" becomes "3"
 *   <li>{@link Rule#SEPT_ABBREVIATION} - "Sept" becomes "Sep"
 *   <li>{@link Rule#TRAILING_UTC} - a trailing "UTC" label is dropped
 *   <li>{@link Rule#COLLAPSE_WHITESPACE} - whitespace runs become one space
 * </ol>
 */
public final class TextNormalizer {
  private TextNormalizer() {}

  /** A single normalization rule. */
  public enum Rule {
    /** Strips st/nd/rd/th from one- or two-digit day numbers. */
    ORDINAL_SUFFIX("\\b(\\d{1,2})(st|nd|rd|th)\\b", "$1"),
    /** Rewrites the four-letter September abbreviation. */
    SEPT_ABBREVIATION("\\bSept\\b", "Sep"),
    /**
     * Drops a trailing UTC label. The remaining text is still read as civil-local time, so a value
     * that really was stamped in UTC is read with the civil offset.
     */
    TRAILING_UTC("\\s*\\bUTC\\s*$", ""),
    /** Collapses whitespace runs to single spaces. */
    COLLAPSE_WHITESPACE("\\s+", " ");

    private final Pattern pattern;
    private final String replacement;

    Rule(String regex, String replacement) {
      this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
      this.replacement = replacement;
    }

    /**
     * Applies this rule alone.
     *
     * @param text the input text
     * @return the rewritten text
     */
    public String apply(String text) {
      Matcher m = pattern.matcher(text);
      return m.replaceAll(replacement);
    }
  }

  private static final List<Rule> ORDER = List.of(Rule.values());

  /**
   * Applies every rule in order and trims the result.
   *
   * @param text the raw expiry text
   * @return the normalized text
   */
  public static String normalize(String text) {
    String s = text.strip();
    for (Rule rule : ORDER) {
      s = rule.apply(s);
    }
    return s.strip();
  }
}
