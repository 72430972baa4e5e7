package io.lapse.parser;

import io.lapse.CivilZone;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ISO-8601 date-times such as {@code 2025-10-01T05:00:00Z}, {@code 2025-10-01 05:00:00.5-0500} or
 * {@code 2025-10-01T05:00}.
 *
 * <p>An explicit offset is honored exactly. A value without an offset is civil-local time, not
 * UTC. Accepted offset spellings: {@code Z}, {@code z}, {@code +HH:MM}, {@code +HHMM}, {@code +HH}.
 * The time may stop at the hour ({@code 2025-10-01T05Z}), and the basic format without separators
 * ({@code 20251001T050000Z}, {@code 20251001T0500}) is read as its extended equivalent.
 */
public final class IsoTimestampGrammar implements DateGrammar {
  /** Shared instance. */
  public static final IsoTimestampGrammar INSTANCE = new IsoTimestampGrammar();

  private static final DateTimeFormatter FORMAT =
      new DateTimeFormatterBuilder()
          .parseCaseInsensitive()
          .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .optionalStart()
          .appendOffsetId()
          .optionalEnd()
          .toFormatter(Locale.ROOT)
          .withChronology(IsoChronology.INSTANCE)
          .withResolverStyle(ResolverStyle.STRICT);

  private static final Pattern SPACE_SEPARATOR = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (?=\\d)");
  private static final Pattern BASIC =
      Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})T(\\d{2})(\\d{2})(\\d{2})?(?=$|[.+\\-Z])");
  private static final Pattern HOUR_ONLY =
      Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T\\d{2})(?=$|[+\\-Z])");
  private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-])(\\d{2})(\\d{2})$");
  private static final Pattern HOUR_OFFSET = Pattern.compile("(:\\d{2}(?:\\.\\d+)?)([+-]\\d{2})$");

  private IsoTimestampGrammar() {}

  @Override
  public String name() {
    return "iso-timestamp";
  }

  @Override
  public Optional<DateMatch> match(String text, CivilZone zone) {
    String s = canonicalize(text);
    try {
      TemporalAccessor parsed = FORMAT.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime odt) {
        return Optional.of(DateMatch.exact(odt.toInstant()));
      }
      return Optional.of(DateMatch.exact(zone.atLocal((LocalDateTime) parsed)));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /** Rewrites the accepted spellings into the form java.time's ISO parser reads. */
  static String canonicalize(String text) {
    String s = text;
    if (s.endsWith("z")) {
      s = s.substring(0, s.length() - 1) + "Z";
    }
    s = SPACE_SEPARATOR.matcher(s).replaceFirst("$1T");
    if (s.indexOf('T') < 0) {
      return s;
    }
    s = extended(s);
    s = HOUR_ONLY.matcher(s).replaceFirst("$1:00");
    s = COMPACT_OFFSET.matcher(s).replaceFirst("$1$2:$3");
    s = HOUR_OFFSET.matcher(s).replaceFirst("$1$2:00");
    return s;
  }

  private static String extended(String s) {
    Matcher m = BASIC.matcher(s);
    if (!m.find()) {
      return s;
    }
    StringBuilder sb = new StringBuilder();
    sb.append(m.group(1)).append('-').append(m.group(2)).append('-').append(m.group(3));
    sb.append('T').append(m.group(4)).append(':').append(m.group(5));
    if (m.group(6) != null) {
      sb.append(':').append(m.group(6));
    }
    return sb.append(s, m.end(), s.length()).toString();
  }
}
