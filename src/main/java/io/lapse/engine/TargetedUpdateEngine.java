package io.lapse.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.lapse.LapseException;
import io.lapse.display.ExpiryDisplay;
import io.lapse.model.CodeDocument;
import io.lapse.model.CodeRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Targeted mode: stamps the reference instant into the {@code expires} field of the requested
 * codes, whatever their current expiry.
 *
 * <ul>
 *   <li>Stamp-only (an explicit expiry was supplied): {@code expires} is overwritten, {@code
 *       expired} is left alone.
 *   <li>Stamp-and-expire (no expiry supplied, the reference is "now"): {@code expires} is
 *       overwritten and {@code expired} set to true.
 * </ul>
 *
 * <p>Codes match case-insensitively after trimming. Requested codes that match nothing are
 * returned, sorted, and otherwise ignored.
 */
public final class TargetedUpdateEngine {
  private static final Logger log = LoggerFactory.getLogger(TargetedUpdateEngine.class);

  private final RecordClassifier classifier;
  private final ExpiryDisplay display;

  /**
   * Creates a targeted update engine.
   *
   * @param classifier the record classifier
   * @param display the formatter for the new expiry
   */
  public TargetedUpdateEngine(RecordClassifier classifier, ExpiryDisplay display) {
    this.classifier = classifier;
    this.display = display;
  }

  /**
   * Updates the requested codes.
   *
   * @param document the document, mutated in place unless dry run
   * @param codes the requested codes
   * @param ref the reference instant, written as the new expiry
   * @param forcedExpiresSupplied true for stamp-only, false for stamp-and-expire
   * @param dryRun count what would change without writing anything
   * @return the result
   * @throws LapseException if no non-blank code was requested
   */
  public TargetedResult update(
      CodeDocument document,
      Collection<String> codes,
      Instant ref,
      boolean forcedExpiresSupplied,
      boolean dryRun)
      throws LapseException {
    Set<String> targets = normalizeTargets(codes);
    Set<String> unmatched = new TreeSet<>(targets);

    String stamp = ExpiryDisplay.isoStamp(ref);
    String stampDisplay = display.format(ref);
    boolean expire = !forcedExpiresSupplied;

    int scanned = 0;
    int setExpired = 0;
    int setExpires = 0;
    int indeterminate = 0;
    int unparsable = 0;
    int updatedExpiresOnly = 0;
    boolean changed = false;
    List<RecordReport> reports = new ArrayList<>();

    for (CodeRecord record : document.records()) {
      String key = record.matchKey();
      if (!targets.contains(key)) {
        continue;
      }
      unmatched.remove(key);
      scanned++;

      // Classify before writing: the report shows the stored value
      Classification c = classifier.classify(record, ref);
      switch (c.verdict()) {
        case INDETERMINATE -> indeterminate++;
        case UNPARSABLE -> unparsable++;
        default -> {
          // time verdicts are only reported
        }
      }

      setExpires++;
      if (expire) {
        if (!record.isExpired()) {
          setExpired++;
        }
      } else {
        updatedExpiresOnly++;
      }

      if (!dryRun) {
        changed |= writeStamp(record, stamp);
        if (expire && !record.isExpired()) {
          record.setExpired(true);
          changed = true;
        }
      }
      reports.add(RecordReport.targeted(key, c, stampDisplay, expire));
    }

    TargetedStats stats =
        new TargetedStats(
            scanned, setExpired, setExpires, indeterminate, unparsable, updatedExpiresOnly);
    log.info(
        "Targeted update{} ({}): matched={} setExpired={} setExpires={} unmatched={}",
        dryRun ? " (dry run)" : "",
        expire ? "stamp and expire" : "stamp only",
        scanned,
        setExpired,
        setExpires,
        unmatched);
    return new TargetedResult(changed, stats, reports, new ArrayList<>(unmatched));
  }

  /** Returns true if the stored value differed from the stamp. */
  private static boolean writeStamp(CodeRecord record, String stamp) {
    JsonNode current = record.expiresNode();
    if (current != null && current.isTextual() && current.asText().equals(stamp)) {
      return false;
    }
    record.setExpires(stamp);
    return true;
  }

  private static Set<String> normalizeTargets(Collection<String> codes) throws LapseException {
    Set<String> targets = new TreeSet<>();
    if (codes != null) {
      for (String code : codes) {
        String key = CodeRecord.normalizeCode(code);
        if (!key.isEmpty()) {
          targets.add(key);
        }
      }
    }
    if (targets.isEmpty()) {
      throw LapseException.input("no code(s) provided", null, "pass CODE1, CODE2, ...");
    }
    return targets;
  }
}
