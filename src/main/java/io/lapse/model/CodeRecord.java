package io.lapse.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;

/**
 * One promotional code inside a {@link CodeDocument}.
 *
 * <p>The record is a live view over its JSON object: setters write through, and fields this class
 * does not know about (reward, platform, link...) are kept as they are.
 */
public final class CodeRecord {
  static final String CODE = "code";
  static final String EXPIRES = "expires";
  static final String EXPIRED = "expired";
  static final String ARCHIVED = "archived";

  private final ObjectNode node;

  CodeRecord(ObjectNode node) {
    this.node = node;
  }

  /**
   * Wraps a JSON object as a record.
   *
   * @param node the record object
   * @return the record view
   */
  public static CodeRecord of(ObjectNode node) {
    return new CodeRecord(node);
  }

  /**
   * Returns the trimmed code, or an empty string if absent.
   *
   * @return the code
   */
  public String code() {
    JsonNode v = node.get(CODE);
    return v != null && v.isTextual() ? v.asText().trim() : "";
  }

  /**
   * Returns the key used to match this record against requested codes.
   *
   * @return the trimmed, upper-cased code
   */
  public String matchKey() {
    return normalizeCode(code());
  }

  /**
   * Returns the raw expires node, which may be null, a JSON null, a string or any other value.
   *
   * @return the raw node, or null if the field is absent
   */
  public JsonNode expiresNode() {
    return node.get(EXPIRES);
  }

  /**
   * Returns the expires value when it is a string.
   *
   * @return the raw string, or null when absent, null, or not a string
   */
  public String expires() {
    JsonNode v = node.get(EXPIRES);
    return v != null && v.isTextual() ? v.asText() : null;
  }

  /**
   * Overwrites the expires field.
   *
   * @param value the new value
   */
  public void setExpires(String value) {
    node.put(EXPIRES, value);
  }

  /**
   * Returns whether the record is flagged expired. Only a JSON {@code true} counts.
   *
   * @return true if expired is the boolean true
   */
  public boolean isExpired() {
    JsonNode v = node.get(EXPIRED);
    return v != null && v.isBoolean() && v.booleanValue();
  }

  /**
   * Sets the expired flag.
   *
   * @param expired the new flag
   */
  public void setExpired(boolean expired) {
    node.put(EXPIRED, expired);
  }

  /**
   * Returns the archived hint when it is a non-blank string.
   *
   * @return the raw archived timestamp, or null
   */
  public String archived() {
    JsonNode v = node.get(ARCHIVED);
    if (v == null || !v.isTextual() || v.asText().isBlank()) {
      return null;
    }
    return v.asText();
  }

  /**
   * Returns the underlying JSON object.
   *
   * @return the object node
   */
  public ObjectNode node() {
    return node;
  }

  /**
   * Normalizes a code for case-insensitive matching.
   *
   * @param code the raw code, may be null
   * @return the trimmed, upper-cased code
   */
  public static String normalizeCode(String code) {
    return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return node.toString();
  }
}
