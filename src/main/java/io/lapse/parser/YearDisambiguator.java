package io.lapse.parser;

import io.lapse.CivilZone;
import java.time.Duration;
import java.time.Instant;
import java.time.MonthDay;
import java.util.Optional;

/**
 * Chooses the calendar year for an expiry that named only a month and day.
 *
 * <p>Such expiries are posted close to when the code was archived or observed, so the chosen
 * occurrence is the one within {@value #WINDOW_DAYS} days of the anchor:
 *
 * <ol>
 *   <li>Anchor is the archived instant if known, else the reference instant.
 *   <li>Candidate is civil midnight of the month/day in the anchor's civil year.
 *   <li>More than {@value #WINDOW_DAYS} whole days after the anchor: use the previous year.
 *   <li>More than {@value #WINDOW_DAYS} whole days before the anchor: use the next year.
 * </ol>
 *
 * <p>Whole days are floored, so 180 days and 23 hours counts as 180.
 */
public final class YearDisambiguator {
  /** Half-width of the plausibility window in days. */
  public static final int WINDOW_DAYS = 180;

  private static final long SECONDS_PER_DAY = 86_400L;

  private final CivilZone zone;

  /**
   * Creates a disambiguator for the given civil zone.
   *
   * @param zone the civil zone
   */
  public YearDisambiguator(CivilZone zone) {
    this.zone = zone;
  }

  /**
   * Picks the most plausible occurrence of a month/day.
   *
   * @param monthDay the month and day
   * @param ref the reference instant
   * @param archived the archived instant, may be null
   * @return the chosen civil midnight as a UTC instant, or empty if the month/day does not exist in
   *     the anchor's year (Feb 29 outside leap years)
   */
  public Optional<Instant> choose(MonthDay monthDay, Instant ref, Instant archived) {
    Instant anchor = archived != null ? archived : ref;
    int year = zone.year(anchor);
    if (!monthDay.isValidYear(year)) {
      return Optional.empty();
    }

    Instant candidate = zone.atStartOfDay(monthDay.atYear(year));
    long days = wholeDaysBetween(anchor, candidate);
    if (days > WINDOW_DAYS && monthDay.isValidYear(year - 1)) {
      candidate = zone.atStartOfDay(monthDay.atYear(year - 1));
    } else if (days < -WINDOW_DAYS && monthDay.isValidYear(year + 1)) {
      candidate = zone.atStartOfDay(monthDay.atYear(year + 1));
    }
    return Optional.of(candidate);
  }

  /** Signed day difference, floored toward negative infinity. */
  static long wholeDaysBetween(Instant from, Instant to) {
    return Math.floorDiv(Duration.between(from, to).getSeconds(), SECONDS_PER_DAY);
  }
}
