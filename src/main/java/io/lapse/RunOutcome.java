package io.lapse;

import io.lapse.engine.SweepResult;
import io.lapse.engine.TargetedResult;
import io.lapse.publish.PublishRequest;
import java.util.Optional;

/**
 * Result of {@link ExpiryRun#execute(RunRequest)}.
 *
 * @param mode which engine ran
 * @param sweep the sweep result (for SWEEP)
 * @param targeted the targeted result (for TARGETED)
 * @param persisted true if the document was saved
 * @param publishRequest what to publish (present only when persisted)
 */
public record RunOutcome(
    Mode mode,
    SweepResult sweep,
    TargetedResult targeted,
    boolean persisted,
    PublishRequest publishRequest) {

  /** The engine that ran. */
  public enum Mode {
    /** Whole-collection sweep. */
    SWEEP,
    /** Update of requested codes. */
    TARGETED
  }

  /**
   * Returns whether the run changed the document.
   *
   * @return the engine's changed flag
   */
  public boolean changed() {
    return mode == Mode.SWEEP ? sweep.changed() : targeted.changed();
  }

  /**
   * Returns the publish request, if the run persisted a change.
   *
   * @return the request, or empty
   */
  public Optional<PublishRequest> publication() {
    return Optional.ofNullable(publishRequest);
  }
}
