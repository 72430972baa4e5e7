package io.lapse.parser;

import io.lapse.CivilZone;
import io.lapse.model.ParsedExpiry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns free-form expiry text into an unambiguous instant.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ExpiryParser parser = new ExpiryParser(CivilZone.CENTRAL);
 * ParsedExpiry p = parser.parse("Sept 3rd", ref, "2024-11-01T00:00:00Z");
 * if (p.isResolved()) {
 *     System.out.println(p.instant()); // 2024-09-03T05:00:00Z
 * }
 * }</pre>
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>Absent, blank or "unknown" (any case) is INDETERMINATE.
 *   <li>ISO date, then ISO date-time, on the trimmed text.
 *   <li>The text is normalized by {@link TextNormalizer}.
 *   <li>Numeric slash dates, then named-month dates, on the normalized text.
 *   <li>A month/day without year goes through {@link YearDisambiguator}, anchored on the archived
 *       hint when it is a valid ISO timestamp.
 *   <li>Anything else is UNPARSABLE.
 * </ol>
 *
 * <p>Every naive value is read in the parser's civil zone. The parser has no state beyond the zone
 * and is safe to share.
 */
public final class ExpiryParser {
  private static final Logger log = LoggerFactory.getLogger(ExpiryParser.class);

  /** Grammars applied to the raw trimmed text. */
  static final List<DateGrammar> STRICT_GRAMMARS =
      List.of(IsoDateGrammar.INSTANCE, IsoTimestampGrammar.INSTANCE);

  /** Grammars applied to normalized text. */
  static final List<DateGrammar> FREE_TEXT_GRAMMARS =
      List.of(NumericSlashGrammar.INSTANCE, NamedMonthGrammar.INSTANCE);

  private static final String UNKNOWN_TOKEN = "unknown";

  private final CivilZone zone;
  private final YearDisambiguator disambiguator;

  /**
   * Creates a parser for the given civil zone.
   *
   * @param zone the zone used for values without an explicit offset
   */
  public ExpiryParser(CivilZone zone) {
    this.zone = zone;
    this.disambiguator = new YearDisambiguator(zone);
  }

  /**
   * Returns the civil zone of this parser.
   *
   * @return the zone
   */
  public CivilZone zone() {
    return zone;
  }

  /**
   * Parses an expiry value.
   *
   * @param raw the raw expiry text, may be null
   * @param ref the reference instant, anchor for yearless dates without an archived hint
   * @param archivedHint the raw archived timestamp, may be null
   * @return the parse outcome, never null
   */
  public ParsedExpiry parse(String raw, Instant ref, String archivedHint) {
    if (raw == null) {
      return ParsedExpiry.missing();
    }
    String s = raw.strip();
    if (s.isEmpty()) {
      return ParsedExpiry.missing();
    }
    if (s.equalsIgnoreCase(UNKNOWN_TOKEN)) {
      return ParsedExpiry.unknown();
    }

    Optional<DateMatch> strict = firstMatch(STRICT_GRAMMARS, s);
    if (strict.isPresent()) {
      return ParsedExpiry.resolved(strict.get().instant());
    }

    String normalized = TextNormalizer.normalize(s);
    Optional<DateMatch> free = firstMatch(FREE_TEXT_GRAMMARS, normalized);
    if (free.isEmpty()) {
      return ParsedExpiry.unparsable();
    }
    DateMatch m = free.get();
    if (!m.isYearless()) {
      return ParsedExpiry.resolved(m.instant());
    }

    Instant archived = archivedHint == null ? null : parseTimestamp(archivedHint).orElse(null);
    return disambiguator
        .choose(m.monthDay(), ref, archived)
        .map(ParsedExpiry::resolved)
        .orElseGet(ParsedExpiry::unparsable);
  }

  /**
   * Parses a strict ISO-8601 timestamp or date, as accepted for the reference instant and the
   * archived hint. Values without an offset are civil-local.
   *
   * @param raw the raw text, may be null
   * @return the instant, or empty if the text is not strict ISO
   */
  public Optional<Instant> parseTimestamp(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return firstMatch(STRICT_GRAMMARS, raw.strip()).map(DateMatch::instant);
  }

  private Optional<DateMatch> firstMatch(List<DateGrammar> grammars, String text) {
    for (DateGrammar grammar : grammars) {
      Optional<DateMatch> m = grammar.match(text, zone);
      if (m.isPresent()) {
        log.trace("{} matched '{}'", grammar.name(), text);
        return m;
      }
    }
    return Optional.empty();
  }
}
