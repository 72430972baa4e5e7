package io.lapse.store;

import io.lapse.LapseException;
import io.lapse.model.CodeDocument;
import java.nio.file.Path;

/** Loads and saves the whole code collection in one piece. */
public interface CodeStore {
  /**
   * Loads the collection.
   *
   * @return the document
   * @throws LapseException with kind DOCUMENT if the source is missing or malformed
   */
  CodeDocument load() throws LapseException;

  /**
   * Replaces the stored collection. Either the whole document is written or nothing is.
   *
   * @param document the document to write
   * @throws LapseException with kind STORAGE if the write failed
   */
  void save(CodeDocument document) throws LapseException;

  /**
   * Returns where the collection lives, for publishing.
   *
   * @return the document path
   */
  Path location();
}
