package io.lapse.model;

import java.time.Instant;

/**
 * The outcome of parsing one expiry value.
 *
 * @param kind the type of outcome
 * @param instant the resolved UTC instant (for RESOLVED)
 * @param unknownToken true when an INDETERMINATE value was the literal "unknown" token
 */
public record ParsedExpiry(Kind kind, Instant instant, boolean unknownToken) {

  /** The type of parse outcome. */
  public enum Kind {
    /** The value resolved to an unambiguous instant. */
    RESOLVED,
    /** The value is absent, empty, or marked unknown. */
    INDETERMINATE,
    /** The value is present but matched no known date grammar. */
    UNPARSABLE
  }

  private static final ParsedExpiry MISSING = new ParsedExpiry(Kind.INDETERMINATE, null, false);
  private static final ParsedExpiry UNKNOWN = new ParsedExpiry(Kind.INDETERMINATE, null, true);
  private static final ParsedExpiry GARBLED = new ParsedExpiry(Kind.UNPARSABLE, null, false);

  /**
   * Creates a resolved outcome.
   *
   * @param instant the UTC instant
   * @return a new resolved outcome
   */
  public static ParsedExpiry resolved(Instant instant) {
    return new ParsedExpiry(Kind.RESOLVED, instant, false);
  }

  /**
   * Returns the outcome for an absent or empty value.
   *
   * @return the missing outcome
   */
  public static ParsedExpiry missing() {
    return MISSING;
  }

  /**
   * Returns the outcome for the literal "unknown" token.
   *
   * @return the unknown outcome
   */
  public static ParsedExpiry unknown() {
    return UNKNOWN;
  }

  /**
   * Returns the outcome for a value no grammar accepted.
   *
   * @return the unparsable outcome
   */
  public static ParsedExpiry unparsable() {
    return GARBLED;
  }

  /**
   * Returns whether this outcome carries an instant.
   *
   * @return true for RESOLVED
   */
  public boolean isResolved() {
    return kind == Kind.RESOLVED;
  }
}
