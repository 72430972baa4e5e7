package io.lapse.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.lapse.LapseException;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Flag parsing for the command line. */
public class CliOptionsTest {

  @Test
  void testDefaults() throws LapseException {
    CliOptions o = CliOptions.parse(new String[0]);
    assertTrue(o.codes.isEmpty());
    assertNull(o.expires);
    assertNull(o.file);
    assertFalse(o.dryRun);
    assertFalse(o.help);
  }

  @Test
  void testAllOptions() throws LapseException {
    CliOptions o =
        CliOptions.parse(
            new String[] {
              "AAA,", "BBB", "--expires", "2025-10-01", "--file", "x.json", "--dry-run",
              "--user", "octo", "--repo", "codes", "--token", "t", "--branch", "dev"
            });
    assertEquals(List.of("AAA", "BBB"), o.codes);
    assertEquals("2025-10-01", o.expires);
    assertEquals("x.json", o.file);
    assertTrue(o.dryRun);
    assertEquals("octo", o.user);
    assertEquals("codes", o.repo);
    assertEquals("t", o.token);
    assertEquals("dev", o.branch);
  }

  @Test
  void testMissingValue() {
    assertThrows(LapseException.class, () -> CliOptions.parse(new String[] {"--file"}));
    assertThrows(
        LapseException.class, () -> CliOptions.parse(new String[] {"--expires", "--dry-run"}));
  }

  @Test
  void testUnknownOption() {
    LapseException e =
        assertThrows(LapseException.class, () -> CliOptions.parse(new String[] {"--force"}));
    assertEquals("--force", e.input().orElseThrow());
  }

  @Test
  void testInlineValues() throws LapseException {
    CliOptions o =
        CliOptions.parse(
            new String[] {
              "--expires=2025-10-01T00:00:00+02:00", "--file=x.json", "--branch=dev", "AAA"
            });
    assertEquals("2025-10-01T00:00:00+02:00", o.expires);
    assertEquals("x.json", o.file);
    assertEquals("dev", o.branch);
    assertEquals(List.of("AAA"), o.codes);
  }

  @Test
  void testInlineValueOnFlag() {
    LapseException e =
        assertThrows(
            LapseException.class, () -> CliOptions.parse(new String[] {"--dry-run=yes"}));
    assertEquals("option takes no value", e.getMessage());
    assertEquals("--dry-run=yes", e.input().orElseThrow());
  }

  @Test
  void testUnknownInlineOption() {
    LapseException e =
        assertThrows(LapseException.class, () -> CliOptions.parse(new String[] {"--force=1"}));
    assertEquals("unknown option", e.getMessage());
    assertEquals("--force=1", e.input().orElseThrow());
  }
}
