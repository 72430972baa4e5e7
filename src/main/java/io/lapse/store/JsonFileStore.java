package io.lapse.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.lapse.LapseException;
import io.lapse.model.CodeDocument;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the collection as a JSON file.
 *
 * <p>Output uses two-space indentation and ASCII escapes, so diffs of the published file stay
 * small. Writes go to a temporary file next to the target which is then moved over it.
 */
public final class JsonFileStore implements CodeStore {
  private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

  private static final ObjectMapper MAPPER =
      JsonMapper.builder().enable(JsonWriteFeature.ESCAPE_NON_ASCII).build();

  private static final ObjectWriter WRITER = MAPPER.writer(prettyPrinter());

  private final Path path;

  /**
   * Creates a store for the given file.
   *
   * @param path the JSON file
   */
  public JsonFileStore(Path path) {
    this.path = path;
  }

  @Override
  public CodeDocument load() throws LapseException {
    if (!Files.exists(path)) {
      throw LapseException.document(
          "file not found: " + path,
          "run the scraper first to generate data/shiftcodes.json,\n"
              + "or pass the correct file path with --file <PATH>",
          null);
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(path.toFile());
    } catch (JsonProcessingException e) {
      throw LapseException.document(
          "malformed JSON in " + path + ": " + e.getOriginalMessage(), null, e);
    } catch (IOException e) {
      throw LapseException.document("cannot read " + path + ": " + e.getMessage(), null, e);
    }
    CodeDocument document = CodeDocument.from(root);
    log.debug("Loaded {} records from {}", document.records().size(), path);
    return document;
  }

  @Override
  public void save(CodeDocument document) throws LapseException {
    Path dir = path.toAbsolutePath().getParent();
    Path tmp = null;
    try {
      Files.createDirectories(dir);
      tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
      WRITER.writeValue(tmp.toFile(), document.root());
      move(tmp, path);
      log.debug("Saved {} records to {}", document.records().size(), path);
    } catch (IOException e) {
      LapseException failure = LapseException.storage("cannot write " + path, e);
      if (tmp != null) {
        try {
          Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
          failure.addSuppressed(cleanup);
        }
      }
      throw failure;
    }
  }

  @Override
  public Path location() {
    return path;
  }

  private static void move(Path from, Path to) throws IOException {
    try {
      Files.move(
          from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Two-space indentation, {@code "key": value}, empty containers as {@code []} and {@code {}}. */
  private static DefaultPrettyPrinter prettyPrinter() {
    Separators separators =
        Separators.createDefaultInstance()
            .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
            .withObjectEmptySeparator("")
            .withArrayEmptySeparator("");
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    return new DefaultPrettyPrinter(separators)
        .withObjectIndenter(indenter)
        .withArrayIndenter(indenter);
  }
}
