package io.lapse.display;

import io.lapse.CivilZone;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/** Renders instants for people and for storage. */
public final class ExpiryDisplay {
  /** Civil rendering with the offset in force, e.g. {@code Sep 28, 2025, 02:11 AM UTC-05:00}. */
  private static final DateTimeFormatter CIVIL =
      DateTimeFormatter.ofPattern("MMM dd, uuuu, hh:mm a 'UTC'xxx", Locale.US);

  private static final DateTimeFormatter STAMP_SECONDS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx", Locale.ROOT);

  private static final DateTimeFormatter STAMP_MICROS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx", Locale.ROOT);

  private final CivilZone zone;

  /**
   * Creates a formatter for the given civil zone.
   *
   * @param zone the zone to render in
   */
  public ExpiryDisplay(CivilZone zone) {
    this.zone = zone;
  }

  /**
   * Renders an instant as civil time with a signed {@code HH:MM} offset. The offset follows
   * daylight saving: {@code UTC-05:00} in summer and {@code UTC-06:00} in winter for US Central.
   *
   * @param instant the instant
   * @return the civil rendering
   */
  public String format(Instant instant) {
    return CIVIL.format(zone.local(instant));
  }

  /**
   * Renders the ISO stamp written into a record's expires field, e.g. {@code
   * 2025-10-01T00:00:00+00:00}. Sub-second precision is kept to the microsecond and printed only
   * when present.
   *
   * @param instant the instant
   * @return the stamp in UTC
   */
  public static String isoStamp(Instant instant) {
    Instant t = instant.truncatedTo(ChronoUnit.MICROS);
    DateTimeFormatter f = t.getNano() == 0 ? STAMP_SECONDS : STAMP_MICROS;
    return f.format(t.atOffset(ZoneOffset.UTC));
  }

  /**
   * Renders both forms side by side, as shown in report headers.
   *
   * @param instant the instant
   * @return {@code "<iso stamp> | <civil>"}
   */
  public String stampPair(Instant instant) {
    return isoStamp(instant) + " | " + format(instant);
  }
}
