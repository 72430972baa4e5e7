package io.lapse.engine;

import io.lapse.model.Verdict;

/**
 * One line item of a run report.
 *
 * @param code the record's code
 * @param expiresDisplay the stored expiry as displayed before the run
 * @param newExpiresDisplay the expiry that targeted mode writes (null in sweep mode)
 * @param verdict the verdict of the stored expiry
 * @param willSet the "will set expired" token: YES, NO or NA
 */
public record RecordReport(
    String code, String expiresDisplay, String newExpiresDisplay, Verdict verdict, String willSet) {

  /**
   * Creates a sweep report item. The will-set token follows the verdict.
   *
   * @param code the code
   * @param c the classification
   * @return a new report item
   */
  public static RecordReport sweep(String code, Classification c) {
    return new RecordReport(code, c.display(), null, c.verdict(), c.verdict().token());
  }

  /**
   * Creates a targeted report item.
   *
   * @param code the code
   * @param c the classification of the stored value
   * @param newExpiresDisplay the value being written
   * @param setsExpired true when the run also flags the record expired
   * @return a new report item
   */
  public static RecordReport targeted(
      String code, Classification c, String newExpiresDisplay, boolean setsExpired) {
    return new RecordReport(
        code, c.display(), newExpiresDisplay, c.verdict(), setsExpired ? "YES" : "NA");
  }
}
