package io.lapse.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.typesafe.config.ConfigFactory;
import io.lapse.CivilZone;
import io.lapse.ErrorKind;
import io.lapse.LapseException;
import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

/** Configuration defaults and flag precedence. */
public class LapseConfigTest {

  private static LapseConfig parse(String hocon) throws LapseException {
    return LapseConfig.from(
        ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve());
  }

  @Test
  void testReferenceDefaults() throws LapseException {
    LapseConfig c = parse("lapse.file = \"data/shiftcodes.json\", lapse.github.branch = \"\"");
    assertEquals(Path.of("data/shiftcodes.json"), c.file);
    assertEquals(CivilZone.CENTRAL, c.zone);
    assertNull(c.github.branch());
    assertEquals(URI.create("https://api.github.com"), c.github.apiUrl());
  }

  @Test
  void testFlagsOverrideConfiguration() throws LapseException {
    LapseConfig c =
        parse(
            "lapse { file = \"a.json\", zone = \"UTC\","
                + " github { user = \"conf\", repo = \"r\", token = \"\", branch = \"main\" } }");
    assertFalse(c.github.complete());

    LapseConfig merged =
        c.withOptions(CliOptions.parse(new String[] {"--file", "b.json", "--token", "t"}));
    assertEquals(Path.of("b.json"), merged.file);
    assertEquals(CivilZone.of("UTC"), merged.zone);
    assertEquals("conf", merged.github.user());
    assertEquals("main", merged.github.branch());
    assertTrue(merged.github.complete());
  }

  @Test
  void testUnknownZone() {
    LapseException e =
        assertThrows(LapseException.class, () -> parse("lapse.zone = \"Mars/Olympus\""));
    assertEquals(ErrorKind.INPUT, e.kind());
    assertEquals("invalid configuration: unknown time zone for lapse.zone", e.getMessage());
    assertEquals("Mars/Olympus", e.input().orElseThrow());
  }

  @Test
  void testMalformedApiUrl() {
    LapseException e =
        assertThrows(
            LapseException.class, () -> parse("lapse.github.api-url = \"http://bad host\""));
    assertEquals(ErrorKind.INPUT, e.kind());
    assertEquals("http://bad host", e.input().orElseThrow());
  }

  @Test
  void testWrongValueType() {
    LapseException e =
        assertThrows(LapseException.class, () -> parse("lapse.github = 5"));
    assertEquals(ErrorKind.INPUT, e.kind());
    assertTrue(e.getMessage().startsWith("invalid configuration: "), e.getMessage());
  }
}
