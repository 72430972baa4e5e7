package io.lapse.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lapse.LapseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The code collection document: a JSON array whose first element is an object holding a {@code
 * codes} array of records.
 *
 * <pre>{@code
 * [ { "meta": {...}, "codes": [ {"code": "...", "expires": "...", "expired": false}, ... ] } ]
 * }</pre>
 *
 * <p>Records are views over the document tree, so mutating a record mutates the document.
 */
public final class CodeDocument {
  private static final String SHAPE_HINT =
      "expected a JSON array whose first element is an object with a \"codes\" array";

  private final JsonNode root;
  private final List<CodeRecord> records;

  private CodeDocument(JsonNode root, List<CodeRecord> records) {
    this.root = root;
    this.records = Collections.unmodifiableList(records);
  }

  /**
   * Validates a parsed JSON tree and wraps it.
   *
   * @param root the parsed document
   * @return the document view
   * @throws LapseException if the tree does not have the expected shape
   */
  public static CodeDocument from(JsonNode root) throws LapseException {
    if (root == null || !root.isArray() || root.isEmpty()) {
      throw LapseException.document("unexpected code collection format", SHAPE_HINT, null);
    }
    JsonNode head = root.get(0);
    if (!head.isObject() || !head.has("codes") || !head.get("codes").isArray()) {
      throw LapseException.document("unexpected code collection format", SHAPE_HINT, null);
    }

    List<CodeRecord> records = new ArrayList<>();
    int index = 0;
    for (JsonNode entry : head.get("codes")) {
      if (!entry.isObject()) {
        throw LapseException.document(
            "code entry #" + index + " is not an object", SHAPE_HINT, null);
      }
      records.add(new CodeRecord((ObjectNode) entry));
      index++;
    }
    return new CodeDocument(root, records);
  }

  /**
   * Returns the records in document order.
   *
   * @return an unmodifiable list of live record views
   */
  public List<CodeRecord> records() {
    return records;
  }

  /**
   * Returns the document tree for serialization.
   *
   * @return the root node
   */
  public JsonNode root() {
    return root;
  }
}
