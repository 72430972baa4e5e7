package io.lapse;

/** The category of a fatal error raised while running an expiry update. */
public enum ErrorKind {
  /** Input error - bad target codes or an invalid reference timestamp. */
  INPUT("input"),
  /** Document error - the code collection is missing or has an unexpected shape. */
  DOCUMENT("document"),
  /** Storage error - the updated collection could not be written. */
  STORAGE("storage"),
  /** Publish error - the updated collection could not be pushed to the remote repository. */
  PUBLISH("publish");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
