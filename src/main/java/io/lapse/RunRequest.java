package io.lapse;

import java.time.Instant;
import java.util.List;

/**
 * One invocation of the engine.
 *
 * @param codes the requested codes; empty selects bulk mode
 * @param ref the reference instant, fixed for the whole run
 * @param forcedExpiresSupplied true when the reference came from an explicit expiry value
 * @param dryRun report the intended effect without writing
 */
public record RunRequest(
    List<String> codes, Instant ref, boolean forcedExpiresSupplied, boolean dryRun) {
  /** Creates a new RunRequest with a defensive copy of the codes. */
  public RunRequest {
    codes = codes == null ? List.of() : List.copyOf(codes);
  }

  /**
   * Creates a bulk sweep request.
   *
   * @param ref the reference instant
   * @param dryRun whether to skip writing
   * @return a new request
   */
  public static RunRequest sweep(Instant ref, boolean dryRun) {
    return new RunRequest(List.of(), ref, false, dryRun);
  }

  /**
   * Creates a targeted update request.
   *
   * @param codes the requested codes
   * @param ref the reference instant
   * @param forcedExpiresSupplied true for stamp-only
   * @param dryRun whether to skip writing
   * @return a new request
   */
  public static RunRequest targeted(
      List<String> codes, Instant ref, boolean forcedExpiresSupplied, boolean dryRun) {
    return new RunRequest(codes, ref, forcedExpiresSupplied, dryRun);
  }

  /**
   * Returns whether this is a targeted update.
   *
   * @return true if codes were requested
   */
  public boolean isTargeted() {
    return !codes.isEmpty();
  }
}
