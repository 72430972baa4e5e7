package io.lapse.parser;

import io.lapse.CivilZone;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Dates that spell out the month, such as {@code Sep 28, 2025}, {@code 28 September 2025}, {@code
 * Sep 28, 2025 2:11 PM} or {@code Sep 28}.
 *
 * <p>Formats are tried in the order of {@link #FORMATS}; the first one that reads the whole text
 * wins. Month names are English and case-insensitive. Formats without a year yield a {@link
 * DateMatch#yearless(MonthDay)} match.
 */
public final class NamedMonthGrammar implements DateGrammar {
  /** Shared instance. */
  public static final NamedMonthGrammar INSTANCE = new NamedMonthGrammar();

  /** What a format produces. */
  enum Shape {
    DATE,
    DATE_TIME,
    MONTH_DAY
  }

  /**
   * One named-month pattern.
   *
   * @param pattern the java.time pattern
   * @param shape what the pattern produces
   * @param formatter the compiled formatter
   */
  record Format(String pattern, Shape shape, DateTimeFormatter formatter) {
    static Format of(String pattern, Shape shape) {
      DateTimeFormatter f =
          new DateTimeFormatterBuilder()
              .parseCaseInsensitive()
              .appendPattern(pattern)
              .toFormatter(Locale.US)
              .withChronology(IsoChronology.INSTANCE)
              .withResolverStyle(ResolverStyle.STRICT);
      return new Format(pattern, shape, f);
    }
  }

  static final List<Format> FORMATS =
      List.of(
          // With year
          Format.of("MMM d, uuuu", Shape.DATE),
          Format.of("MMMM d, uuuu", Shape.DATE),
          Format.of("MMM d uuuu", Shape.DATE),
          Format.of("MMMM d uuuu", Shape.DATE),
          Format.of("d MMM uuuu", Shape.DATE),
          Format.of("d MMMM uuuu", Shape.DATE),
          Format.of("uuuu-M-d", Shape.DATE),
          // With a 12-hour clock
          Format.of("MMM d, uuuu h:mm a", Shape.DATE_TIME),
          Format.of("MMMM d, uuuu h:mm a", Shape.DATE_TIME),
          // Month and day only
          Format.of("MMM d", Shape.MONTH_DAY),
          Format.of("MMMM d", Shape.MONTH_DAY));

  private NamedMonthGrammar() {}

  @Override
  public String name() {
    return "named-month";
  }

  @Override
  public Optional<DateMatch> match(String text, CivilZone zone) {
    for (Format format : FORMATS) {
      Optional<DateMatch> m = tryFormat(format, text, zone);
      if (m.isPresent()) {
        return m;
      }
    }
    return Optional.empty();
  }

  private static Optional<DateMatch> tryFormat(Format format, String text, CivilZone zone) {
    try {
      return Optional.of(
          switch (format.shape()) {
            case DATE -> DateMatch.exact(
                zone.atStartOfDay(format.formatter().parse(text, LocalDate::from)));
            case DATE_TIME -> DateMatch.exact(
                zone.atLocal(format.formatter().parse(text, LocalDateTime::from)));
            case MONTH_DAY -> DateMatch.yearless(format.formatter().parse(text, MonthDay::from));
          });
    } catch (DateTimeException e) {
      // DateTimeParseException included: this format does not fit, try the next one
      return Optional.empty();
    }
  }
}
