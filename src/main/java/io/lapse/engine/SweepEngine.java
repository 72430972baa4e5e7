package io.lapse.engine;

import io.lapse.model.CodeDocument;
import io.lapse.model.CodeRecord;
import io.lapse.model.Verdict;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk mode: flags every record whose stored expiry lies before the reference instant.
 *
 * <p>Only the {@code expired} flag is ever written; {@code expires} is left as found. A record
 * already flagged expired is not counted again, so a second sweep with the same reference instant
 * changes nothing.
 */
public final class SweepEngine {
  private static final Logger log = LoggerFactory.getLogger(SweepEngine.class);

  private final RecordClassifier classifier;

  /**
   * Creates a sweep engine.
   *
   * @param classifier the record classifier
   */
  public SweepEngine(RecordClassifier classifier) {
    this.classifier = classifier;
  }

  /**
   * Sweeps the whole document.
   *
   * @param document the document, mutated in place unless dry run
   * @param ref the reference instant, shared by every record
   * @param dryRun count what would change without writing anything
   * @return the result
   */
  public SweepResult sweep(CodeDocument document, Instant ref, boolean dryRun) {
    int scanned = 0;
    int setExpired = 0;
    int indeterminate = 0;
    int unparsable = 0;
    boolean changed = false;
    List<RecordReport> reports = new ArrayList<>();

    for (CodeRecord record : document.records()) {
      scanned++;
      Classification c = classifier.classify(record, ref);
      switch (c.verdict()) {
        case INDETERMINATE -> indeterminate++;
        case UNPARSABLE -> unparsable++;
        case WILL_EXPIRE -> {
          if (!record.isExpired()) {
            setExpired++;
            if (!dryRun) {
              record.setExpired(true);
              changed = true;
            }
          }
        }
        case NOT_YET -> {
          // nothing to do
        }
      }
      if (c.verdict() == Verdict.UNPARSABLE) {
        log.debug("Unparsable expires for {}: {}", record.code(), record.expiresNode());
      }
      reports.add(RecordReport.sweep(record.code(), c));
    }

    SweepStats stats = new SweepStats(scanned, setExpired, indeterminate, unparsable);
    log.info(
        "Sweep{}: scanned={} setExpired={} indeterminate={} unparsable={}",
        dryRun ? " (dry run)" : "",
        scanned,
        setExpired,
        indeterminate,
        unparsable);
    return new SweepResult(changed, stats, reports);
  }
}
