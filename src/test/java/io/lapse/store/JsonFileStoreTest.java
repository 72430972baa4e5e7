package io.lapse.store;

import static org.junit.jupiter.api.Assertions.*;

import io.lapse.ErrorKind;
import io.lapse.LapseException;
import io.lapse.model.CodeDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Reading and atomically rewriting the collection file. */
public class JsonFileStoreTest {
  private static final String DOCUMENT =
      "[{\"meta\": {\"source\": \"Café\", \"count\": 1},"
          + " \"codes\": [{\"code\": \"AAAAA\", \"expires\": \"Sep 15, 2024\","
          + " \"expired\": false, \"reward\": \"3 Golden Keys\"}]}]";

  @TempDir Path dir;

  @Test
  void testRoundTripPreservesUnknownFields() throws IOException, LapseException {
    Path file = dir.resolve("shiftcodes.json");
    Files.writeString(file, DOCUMENT, StandardCharsets.UTF_8);
    JsonFileStore store = new JsonFileStore(file);

    CodeDocument doc = store.load();
    doc.records().get(0).setExpired(true);
    store.save(doc);

    String saved = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(saved.contains("\"expired\": true"), saved);
    assertTrue(saved.contains("\"reward\": \"3 Golden Keys\""), saved);
    assertTrue(saved.contains("\n  {"), saved);
    // non-ASCII is escaped
    assertTrue(saved.chars().allMatch(c -> c < 128), saved);

    CodeDocument reloaded = store.load();
    assertTrue(reloaded.records().get(0).isExpired());
    assertEquals("Sep 15, 2024", reloaded.records().get(0).expires());
    assertEquals("Café", reloaded.root().get(0).get("meta").get("source").asText());
  }

  @Test
  void testSaveLeavesNoTempFiles() throws IOException, LapseException {
    Path file = dir.resolve("shiftcodes.json");
    Files.writeString(file, DOCUMENT, StandardCharsets.UTF_8);
    JsonFileStore store = new JsonFileStore(file);
    store.save(store.load());

    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void testSaveCreatesParentDirectories() throws IOException, LapseException {
    Path source = dir.resolve("in.json");
    Files.writeString(source, DOCUMENT, StandardCharsets.UTF_8);
    CodeDocument doc = new JsonFileStore(source).load();

    Path nested = dir.resolve("data").resolve("shiftcodes.json");
    new JsonFileStore(nested).save(doc);
    assertTrue(Files.exists(nested));
  }

  @Test
  void testMissingFile() {
    JsonFileStore store = new JsonFileStore(dir.resolve("absent.json"));
    LapseException e = assertThrows(LapseException.class, store::load);
    assertEquals(ErrorKind.DOCUMENT, e.kind());
    assertTrue(e.getMessage().startsWith("file not found"));
    assertTrue(e.hint().orElseThrow().contains("--file"));
  }

  @Test
  void testMalformedJson() throws IOException {
    Path file = dir.resolve("broken.json");
    Files.writeString(file, "[{\"codes\": [", StandardCharsets.UTF_8);
    LapseException e = assertThrows(LapseException.class, new JsonFileStore(file)::load);
    assertEquals(ErrorKind.DOCUMENT, e.kind());
    assertTrue(e.getMessage().startsWith("malformed JSON"));
  }

  @Test
  void testUnexpectedShape() throws IOException {
    Path file = dir.resolve("object.json");
    Files.writeString(file, "{\"codes\": []}", StandardCharsets.UTF_8);
    LapseException e = assertThrows(LapseException.class, new JsonFileStore(file)::load);
    assertEquals(ErrorKind.DOCUMENT, e.kind());
  }

  @Test
  void testSaveFailureIsStorageError() throws IOException, LapseException {
    Path source = dir.resolve("in.json");
    Files.writeString(source, DOCUMENT, StandardCharsets.UTF_8);
    CodeDocument doc = new JsonFileStore(source).load();

    // a regular file where the parent directory should be
    Path blocker = dir.resolve("blocker");
    Files.writeString(blocker, "x");
    JsonFileStore store = new JsonFileStore(blocker.resolve("shiftcodes.json"));
    LapseException e = assertThrows(LapseException.class, () -> store.save(doc));
    assertEquals(ErrorKind.STORAGE, e.kind());
  }
}
