package io.lapse.parser;

import io.lapse.CivilZone;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric dates such as {@code 09/28/2025}, {@code 28/09/2025} or {@code 9/28/25}, read as civil
 * midnight.
 *
 * <p>The field order is guessed by {@link #isDayFirst(int)} and short years are widened by {@link
 * #promoteYear(int)}.
 */
public final class NumericSlashGrammar implements DateGrammar {
  /** Shared instance. */
  public static final NumericSlashGrammar INSTANCE = new NumericSlashGrammar();

  private static final Pattern SHAPE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{2,4})");

  private NumericSlashGrammar() {}

  @Override
  public String name() {
    return "numeric-slash";
  }

  @Override
  public Optional<DateMatch> match(String text, CivilZone zone) {
    Matcher m = SHAPE.matcher(text);
    if (!m.matches()) {
      return Optional.empty();
    }
    int first = Integer.parseInt(m.group(1));
    int second = Integer.parseInt(m.group(2));
    int year = promoteYear(Integer.parseInt(m.group(3)));

    int month = isDayFirst(first) ? second : first;
    int day = isDayFirst(first) ? first : second;
    try {
      return Optional.of(DateMatch.exact(zone.atStartOfDay(LocalDate.of(year, month, day))));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  /**
   * Day-first when the leading number cannot be a month, month-first otherwise.
   *
   * @param first the leading number
   * @return true if the leading number is the day
   */
  public static boolean isDayFirst(int first) {
    return first > 12;
  }

  /**
   * Widens two-digit years into the 2000s. Longer years are returned unchanged.
   *
   * @param year the year as written
   * @return the full year
   */
  public static int promoteYear(int year) {
    return year < 100 ? year + 2000 : year;
  }
}
