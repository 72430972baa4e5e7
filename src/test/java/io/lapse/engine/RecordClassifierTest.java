package io.lapse.engine;

import static org.junit.jupiter.api.Assertions.*;

import io.lapse.CivilZone;
import io.lapse.LapseException;
import io.lapse.display.ExpiryDisplay;
import io.lapse.model.CodeDocument;
import io.lapse.model.Verdict;
import io.lapse.parser.ExpiryParser;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/** Verdicts for single records. */
public class RecordClassifierTest {
  private static final Instant REF = Instant.parse("2025-10-01T00:00:00Z");
  private final RecordClassifier classifier =
      new RecordClassifier(
          new ExpiryParser(CivilZone.CENTRAL), new ExpiryDisplay(CivilZone.CENTRAL));

  private Classification classify(String record) throws LapseException {
    CodeDocument doc = Documents.of(record);
    return classifier.classify(doc.records().get(0), REF);
  }

  @Test
  void testPastIsWillExpire() throws LapseException {
    Classification c = classify("{\"code\": \"A\", \"expires\": \"09/15/2024\"}");
    assertEquals(Verdict.WILL_EXPIRE, c.verdict());
    assertEquals("Sep 15, 2024, 12:00 AM UTC-05:00", c.display());
    assertEquals("YES", c.verdict().token());
  }

  @Test
  void testFutureIsNotYet() throws LapseException {
    Classification c = classify("{\"code\": \"A\", \"expires\": \"2025-12-31\"}");
    assertEquals(Verdict.NOT_YET, c.verdict());
    assertEquals("NO", c.verdict().token());
  }

  @Test
  void testExactlyRefIsNotYet() throws LapseException {
    Classification c = classify("{\"code\": \"A\", \"expires\": \"2025-10-01T00:00:00Z\"}");
    assertEquals(Verdict.NOT_YET, c.verdict());
  }

  @Test
  void testMissingFieldIsIndeterminate() throws LapseException {
    Classification c = classify("{\"code\": \"A\"}");
    assertEquals(Verdict.INDETERMINATE, c.verdict());
    assertEquals(RecordClassifier.NOT_FOUND, c.display());
    assertEquals("NA", c.verdict().token());

    assertEquals(Verdict.INDETERMINATE, classify("{\"code\": \"A\", \"expires\": null}").verdict());
    assertEquals(Verdict.INDETERMINATE, classify("{\"code\": \"A\", \"expires\": \"\"}").verdict());
  }

  @Test
  void testUnknownTokenDisplay() throws LapseException {
    Classification c = classify("{\"code\": \"A\", \"expires\": \"Unknown\"}");
    assertEquals(Verdict.INDETERMINATE, c.verdict());
    assertEquals(RecordClassifier.UNKNOWN, c.display());
  }

  @Test
  void testGarbageAndNonTextAreUnparsable() throws LapseException {
    assertEquals(Verdict.UNPARSABLE, classify("{\"code\": \"A\", \"expires\": \"soon\"}").verdict());
    assertEquals(Verdict.UNPARSABLE, classify("{\"code\": \"A\", \"expires\": 42}").verdict());
    assertEquals(RecordClassifier.NOT_FOUND, classify("{\"code\": \"A\", \"expires\": \"soon\"}").display());
  }

  @Test
  void testArchivedHintAnchorsYearlessExpiry() throws LapseException {
    Classification c =
        classify(
            "{\"code\": \"A\", \"expires\": \"Sept 3rd\", \"archived\": \"2024-11-01T00:00:00Z\"}");
    assertEquals(Instant.parse("2024-09-03T05:00:00Z"), c.parsed().instant());
    assertEquals(Verdict.WILL_EXPIRE, c.verdict());
  }

  @Test
  void testDoesNotMutate() throws LapseException {
    CodeDocument doc = Documents.of("{\"code\": \"A\", \"expires\": \"09/15/2024\"}");
    String before = doc.root().toString();
    classifier.classify(doc.records().get(0), REF);
    assertEquals(before, doc.root().toString());
  }
}
