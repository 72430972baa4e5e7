package io.lapse.engine;

import java.util.List;

/**
 * Outcome of a bulk sweep.
 *
 * @param changed true iff at least one expired flag was actually flipped
 * @param stats the counters
 * @param reports one item per record, in document order
 */
public record SweepResult(boolean changed, SweepStats stats, List<RecordReport> reports) {
  /** Creates a new SweepResult with a defensive copy of the reports. */
  public SweepResult {
    reports = List.copyOf(reports);
  }
}
