package io.lapse.parser;

import java.time.Instant;
import java.time.MonthDay;

/**
 * A successful grammar match: either a full instant or a month/day that still needs a year.
 *
 * @param instant the resolved UTC instant (null when yearless)
 * @param monthDay the month and day (for yearless matches)
 */
public record DateMatch(Instant instant, MonthDay monthDay) {
  /**
   * Creates a match carrying a complete instant.
   *
   * @param instant the UTC instant
   * @return a new match
   */
  public static DateMatch exact(Instant instant) {
    return new DateMatch(instant, null);
  }

  /**
   * Creates a match that named no year.
   *
   * @param monthDay the month and day
   * @return a new match
   */
  public static DateMatch yearless(MonthDay monthDay) {
    return new DateMatch(null, monthDay);
  }

  /**
   * Returns whether a year still has to be chosen.
   *
   * @return true for month/day-only matches
   */
  public boolean isYearless() {
    return instant == null;
  }
}
