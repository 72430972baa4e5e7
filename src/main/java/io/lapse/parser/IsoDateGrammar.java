package io.lapse.parser;

import io.lapse.CivilZone;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/** Date-only ISO values ({@code YYYY-MM-DD}), read as civil midnight. */
public final class IsoDateGrammar implements DateGrammar {
  /** Shared instance. */
  public static final IsoDateGrammar INSTANCE = new IsoDateGrammar();

  private static final Pattern SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private IsoDateGrammar() {}

  @Override
  public String name() {
    return "iso-date";
  }

  @Override
  public Optional<DateMatch> match(String text, CivilZone zone) {
    if (!SHAPE.matcher(text).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(DateMatch.exact(zone.atStartOfDay(LocalDate.parse(text))));
    } catch (DateTimeParseException e) {
      // 2025-02-30 and friends
      return Optional.empty();
    }
  }
}
