package io.lapse.parser;

import io.lapse.CivilZone;
import java.util.Optional;

/**
 * One accepted shape of expiry text. Grammars are tried in a fixed order and the first match
 * wins, so each heuristic can be replaced without touching callers.
 */
public interface DateGrammar {
  /**
   * Returns a short name for diagnostics.
   *
   * @return the grammar name
   */
  String name();

  /**
   * Attempts to read the whole text.
   *
   * @param text the trimmed text
   * @param zone the civil zone used for naive values
   * @return the match, or empty if this grammar does not accept the text
   */
  Optional<DateMatch> match(String text, CivilZone zone);
}
