package io.lapse.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.lapse.display.ExpiryDisplay;
import io.lapse.model.CodeRecord;
import io.lapse.model.ParsedExpiry;
import io.lapse.model.Verdict;
import io.lapse.parser.ExpiryParser;
import java.time.Instant;

/**
 * Decides where a record's stored expiry stands relative to a reference instant. Both engines use
 * this class so sweep and targeted reports agree. Never mutates the record.
 */
public final class RecordClassifier {
  static final String NOT_FOUND = "Not Found";
  static final String UNKNOWN = "Unknown";

  private final ExpiryParser parser;
  private final ExpiryDisplay display;

  /**
   * Creates a classifier.
   *
   * @param parser the expiry parser
   * @param display the formatter for resolved instants
   */
  public RecordClassifier(ExpiryParser parser, ExpiryDisplay display) {
    this.parser = parser;
    this.display = display;
  }

  /**
   * Classifies one record.
   *
   * @param record the record
   * @param ref the reference instant
   * @return the classification
   */
  public Classification classify(CodeRecord record, Instant ref) {
    ParsedExpiry parsed = parse(record, ref);
    return switch (parsed.kind()) {
      case INDETERMINATE -> new Classification(
          parsed, Verdict.INDETERMINATE, parsed.unknownToken() ? UNKNOWN : NOT_FOUND);
      case UNPARSABLE -> new Classification(parsed, Verdict.UNPARSABLE, NOT_FOUND);
      case RESOLVED -> new Classification(
          parsed,
          parsed.instant().isBefore(ref) ? Verdict.WILL_EXPIRE : Verdict.NOT_YET,
          display.format(parsed.instant()));
    };
  }

  private ParsedExpiry parse(CodeRecord record, Instant ref) {
    JsonNode raw = record.expiresNode();
    if (raw == null || raw.isNull()) {
      return ParsedExpiry.missing();
    }
    if (!raw.isTextual()) {
      return ParsedExpiry.unparsable();
    }
    return parser.parse(raw.asText(), ref, record.archived());
  }
}
