package io.lapse.model;

/** Classification of a record's expiry relative to the reference instant. */
public enum Verdict {
  /** Expiry absent, empty, or "unknown". */
  INDETERMINATE("NA"),
  /** Expiry present but not a recognized date. */
  UNPARSABLE("NA"),
  /** Expiry is strictly before the reference instant. */
  WILL_EXPIRE("YES"),
  /** Expiry is at or after the reference instant. */
  NOT_YET("NO");

  private final String token;

  Verdict(String token) {
    this.token = token;
  }

  /**
   * Returns the report token: YES, NO, or NA.
   *
   * @return the token
   */
  public String token() {
    return token;
  }
}
