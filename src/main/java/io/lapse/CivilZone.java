package io.lapse;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * The civil timezone used to interpret every naive date or time.
 *
 * <p>Expiry strings come from a publisher that posts in US Central time, so the default is {@code
 * America/Chicago} with its daylight-saving history. The zone is passed explicitly to the parser
 * and the formatter instead of being read from global state.
 *
 * <p>Local times that fall in a spring-forward gap move forward by the gap length. Local times
 * that occur twice on a fall-back night resolve to the earlier (daylight) offset.
 *
 * @param zone the IANA zone
 */
public record CivilZone(ZoneId zone) {
  /** US Central time. */
  public static final CivilZone CENTRAL = new CivilZone(ZoneId.of("America/Chicago"));

  /**
   * Creates a civil zone from an IANA name.
   *
   * @param name the zone name, e.g. America/Chicago
   * @return the civil zone
   */
  public static CivilZone of(String name) {
    return new CivilZone(ZoneId.of(name));
  }

  /**
   * Returns the instant of local midnight on the given date.
   *
   * @param date the civil date
   * @return the UTC instant
   */
  public Instant atStartOfDay(LocalDate date) {
    return atLocal(date.atStartOfDay());
  }

  /**
   * Interprets a wall-clock date-time in this zone.
   *
   * @param local the civil date-time
   * @return the UTC instant
   */
  public Instant atLocal(LocalDateTime local) {
    // ZonedDateTime.of shifts gap times forward and keeps the earlier offset in overlaps
    return ZonedDateTime.of(local, zone).toInstant();
  }

  /**
   * Returns the civil date-time of an instant in this zone.
   *
   * @param instant the instant
   * @return the zoned date-time
   */
  public ZonedDateTime local(Instant instant) {
    return instant.atZone(zone);
  }

  /**
   * Returns the civil calendar year of an instant.
   *
   * @param instant the instant
   * @return the year in this zone
   */
  public int year(Instant instant) {
    return local(instant).getYear();
  }

  /**
   * Returns the UTC offset in force at an instant.
   *
   * @param instant the instant
   * @return the offset
   */
  public ZoneOffset offsetAt(Instant instant) {
    return zone.getRules().getOffset(instant);
  }

  /**
   * Returns the current instant as observed in this zone.
   *
   * @param clock the clock to read
   * @return the current instant
   */
  public Instant now(Clock clock) {
    return ZonedDateTime.now(clock.withZone(zone)).toInstant();
  }
}
