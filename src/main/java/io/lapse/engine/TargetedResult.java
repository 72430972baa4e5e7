package io.lapse.engine;

import java.util.List;

/**
 * Outcome of a targeted update.
 *
 * @param changed true iff a record field actually changed
 * @param stats the counters
 * @param reports one item per matched record, in document order
 * @param unmatched requested codes found nowhere in the document, sorted
 */
public record TargetedResult(
    boolean changed, TargetedStats stats, List<RecordReport> reports, List<String> unmatched) {
  /** Creates a new TargetedResult with defensive copies of lists. */
  public TargetedResult {
    reports = List.copyOf(reports);
    unmatched = List.copyOf(unmatched);
  }
}
