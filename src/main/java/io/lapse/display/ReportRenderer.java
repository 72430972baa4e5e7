package io.lapse.display;

import io.lapse.engine.RecordReport;
import io.lapse.engine.SweepResult;
import io.lapse.engine.SweepStats;
import io.lapse.engine.TargetedResult;
import io.lapse.engine.TargetedStats;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders run reports as plain-text lines.
 *
 * <pre>
 * DRY-RUN:
 * Date &amp; Time (ISO): 2025-10-01T00:00:00+00:00 | Sep 30, 2025, 07:00 PM UTC-05:00
 * ----------------------------------------------------------------
 * Code: ABCDE-FGHIJ-KLMNO-PQRST-UVWXY
 * Expires: Sep 15, 2025, 12:00 AM UTC-05:00
 * Will Set Expired: YES
 * ----------------------------------------------------------------
 * Scanned: 1
 * ...
 * </pre>
 *
 * <p>Separators are as wide as the longest line printed, at least {@value #MIN_SEPARATOR}.
 */
public final class ReportRenderer {
  private static final int MIN_SEPARATOR = 8;

  private static final List<String> NOTES =
      List.of(
          "Notes:",
          "- 'Skipped' looks only at the 'expires' field (missing, empty, or 'Unknown').",
          "- 'Unparsable' means the 'expires' field could not be parsed as an ISO or common date"
              + " format.");

  private final ExpiryDisplay display;

  /**
   * Creates a renderer.
   *
   * @param display the formatter used for the reference instant
   */
  public ReportRenderer(ExpiryDisplay display) {
    this.display = display;
  }

  /**
   * Renders a bulk sweep report.
   *
   * @param result the sweep result
   * @param ref the reference instant
   * @param dryRun whether the run was a dry run
   * @return the report lines
   */
  public List<String> renderSweep(SweepResult result, Instant ref, boolean dryRun) {
    List<List<String>> blocks = new ArrayList<>();
    for (RecordReport r : result.reports()) {
      blocks.add(block(r.code(), r.expiresDisplay(), r.willSet()));
    }
    SweepStats s = result.stats();
    List<String> summary =
        summary(s.scanned(), s.setExpired(), 0, s.indeterminate(), s.unparsable());
    return assemble(header(ref, dryRun), blocks, summary, dryRun, List.of());
  }

  /**
   * Renders a targeted update report.
   *
   * @param result the targeted result
   * @param ref the reference instant, which is also the stamped expiry
   * @param forcedExpiresSupplied true for stamp-only runs
   * @param dryRun whether the run was a dry run
   * @return the report lines
   */
  public List<String> renderTargeted(
      TargetedResult result, Instant ref, boolean forcedExpiresSupplied, boolean dryRun) {
    List<List<String>> blocks = new ArrayList<>();
    for (RecordReport r : result.reports()) {
      String expires = forcedExpiresSupplied ? r.newExpiresDisplay() : display.stampPair(ref);
      blocks.add(block(r.code(), expires, r.willSet()));
    }

    TargetedStats s = result.stats();
    List<String> summary =
        summary(s.scanned(), s.setExpired(), s.setExpires(), s.indeterminate(), s.unparsable());
    if (s.updatedExpiresOnly() > 0) {
      summary.add("Updated expires only: " + s.updatedExpiresOnly());
    }

    List<String> unmatched = new ArrayList<>();
    for (String code : result.unmatched()) {
      unmatched.add("No matches found for " + code);
    }
    return assemble(header(ref, dryRun), blocks, summary, dryRun, unmatched);
  }

  private List<String> header(Instant ref, boolean dryRun) {
    List<String> header = new ArrayList<>();
    if (dryRun) {
      header.add("DRY-RUN:");
    }
    header.add("Date & Time (ISO): " + display.stampPair(ref));
    return header;
  }

  private static List<String> block(String code, String expires, String willSet) {
    return List.of("Code: " + code, "Expires: " + expires, "Will Set Expired: " + willSet);
  }

  private static List<String> summary(
      int scanned, int setExpired, int setExpires, int skipped, int unparsable) {
    List<String> summary = new ArrayList<>();
    summary.add("Scanned: " + scanned);
    summary.add("Set expired: " + setExpired);
    summary.add("Set expires field: " + setExpires);
    summary.add("Skipped (expires missing/empty or 'Unknown'): " + skipped);
    summary.add("Unparsable (invalid 'expires' timestamp): " + unparsable);
    return summary;
  }

  private static List<String> assemble(
      List<String> header,
      List<List<String>> blocks,
      List<String> summary,
      boolean dryRun,
      List<String> unmatched) {
    List<String> printed = new ArrayList<>(header);
    blocks.forEach(printed::addAll);
    printed.addAll(summary);
    printed.addAll(unmatched);
    if (dryRun) {
      printed.addAll(NOTES);
    }
    String sep = separator(printed);

    List<String> out = new ArrayList<>(header);
    out.add(sep);
    if (!blocks.isEmpty()) {
      for (int i = 0; i < blocks.size(); i++) {
        out.addAll(blocks.get(i));
        if (i < blocks.size() - 1) {
          out.add(sep);
        }
      }
      out.add(sep);
    }
    out.addAll(summary);
    if (dryRun) {
      out.add(sep);
      out.addAll(NOTES);
    }
    if (!unmatched.isEmpty()) {
      out.add(sep);
      out.addAll(unmatched);
    }
    return out;
  }

  private static String separator(List<String> lines) {
    int longest = MIN_SEPARATOR;
    for (String line : lines) {
      longest = Math.max(longest, line.length());
    }
    return "-".repeat(longest);
  }
}
