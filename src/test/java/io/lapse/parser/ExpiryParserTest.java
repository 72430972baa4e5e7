package io.lapse.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.lapse.CivilZone;
import io.lapse.model.ParsedExpiry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/** Grammar order and outcomes of expiry parsing. */
public class ExpiryParserTest {
  private static final Instant REF = Instant.parse("2025-10-01T00:00:00Z");
  private final ExpiryParser parser = new ExpiryParser(CivilZone.CENTRAL);

  @Test
  void testSeptThirdWithArchivedHint() {
    ParsedExpiry p = parser.parse("Sept 3rd", REF, "2024-11-01T00:00:00Z");
    assertTrue(p.isResolved());
    assertEquals(Instant.parse("2024-09-03T05:00:00Z"), p.instant());
  }

  @Test
  void testUnreadableArchivedHintFallsBackToRef() {
    ParsedExpiry p = parser.parse("Sep 3", REF, "last year");
    assertEquals(Instant.parse("2025-09-03T05:00:00Z"), p.instant());
  }

  @Test
  void testUnknownIsIndeterminateNotUnparsable() {
    ParsedExpiry p = parser.parse("unknown", REF, null);
    assertEquals(ParsedExpiry.Kind.INDETERMINATE, p.kind());
    assertTrue(p.unknownToken());
    assertFalse(p.isResolved());
  }

  @Test
  void testParseTimestampIsStrict() {
    assertEquals(
        Instant.parse("2025-10-01T00:00:00Z"), parser.parseTimestamp("2025-10-01T00:00:00Z").orElseThrow());
    assertEquals(
        Instant.parse("2025-10-01T05:00:00Z"), parser.parseTimestamp("2025-10-01").orElseThrow());
    assertTrue(parser.parseTimestamp("Oct 1, 2025").isEmpty());
    assertTrue(parser.parseTimestamp("10/01/2025").isEmpty());
    assertTrue(parser.parseTimestamp("").isEmpty());
    assertTrue(parser.parseTimestamp(null).isEmpty());
  }

  @Test
  void testZoneIsExposed() {
    assertEquals(CivilZone.CENTRAL, parser.zone());
  }
}
