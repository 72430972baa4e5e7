package io.lapse;

import io.lapse.display.ExpiryDisplay;
import io.lapse.engine.RecordClassifier;
import io.lapse.engine.SweepEngine;
import io.lapse.engine.SweepResult;
import io.lapse.engine.TargetedResult;
import io.lapse.engine.TargetedUpdateEngine;
import io.lapse.model.CodeDocument;
import io.lapse.parser.ExpiryParser;
import io.lapse.publish.PublishRequest;
import io.lapse.publish.Publisher;
import io.lapse.store.CodeStore;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point: loads the code collection, runs one engine over it, and saves it.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ExpiryRun run = new ExpiryRun(new JsonFileStore(Path.of("data/shiftcodes.json")), CivilZone.CENTRAL);
 * RunOutcome outcome = run.execute(RunRequest.sweep(Instant.now(), false));
 * run.publish(outcome, publisher);
 * }</pre>
 *
 * <p>A run is all or nothing. The classification pass completes before anything is written, the
 * store is called at most once, and only when a field changed outside a dry run. A failed save
 * raises instead of returning an outcome. Publishing is a separate step whose failure never undoes
 * the local save.
 */
public final class ExpiryRun {
  private static final Logger log = LoggerFactory.getLogger(ExpiryRun.class);

  private final CodeStore store;
  private final ExpiryParser parser;
  private final ExpiryDisplay display;
  private final SweepEngine sweepEngine;
  private final TargetedUpdateEngine targetedEngine;

  /**
   * Creates a run over the given store.
   *
   * @param store where the collection is loaded from and saved to
   * @param zone the civil zone for naive expiry values
   */
  public ExpiryRun(CodeStore store, CivilZone zone) {
    this.store = store;
    this.parser = new ExpiryParser(zone);
    this.display = new ExpiryDisplay(zone);
    RecordClassifier classifier = new RecordClassifier(parser, display);
    this.sweepEngine = new SweepEngine(classifier);
    this.targetedEngine = new TargetedUpdateEngine(classifier, display);
  }

  /**
   * Executes one run.
   *
   * @param request the run parameters
   * @return the outcome
   * @throws LapseException if the document cannot be loaded, the code set is empty, or the save
   *     fails
   */
  public RunOutcome execute(RunRequest request) throws LapseException {
    CodeDocument document = store.load();

    if (request.isTargeted()) {
      TargetedResult result =
          targetedEngine.update(
              document,
              request.codes(),
              request.ref(),
              request.forcedExpiresSupplied(),
              request.dryRun());
      boolean persisted = persist(document, result.changed(), request.dryRun());
      return new RunOutcome(
          RunOutcome.Mode.TARGETED,
          null,
          result,
          persisted,
          persisted ? new PublishRequest(store.location(), commitMessage(request)) : null);
    }

    SweepResult result = sweepEngine.sweep(document, request.ref(), request.dryRun());
    boolean persisted = persist(document, result.changed(), request.dryRun());
    return new RunOutcome(
        RunOutcome.Mode.SWEEP,
        result,
        null,
        persisted,
        persisted ? new PublishRequest(store.location(), commitMessage(request)) : null);
  }

  /**
   * Publishes a persisted outcome. Failures are logged and reported, never thrown.
   *
   * @param outcome the outcome of {@link #execute(RunRequest)}
   * @param publisher the publisher
   * @return true if the document was published
   */
  public boolean publish(RunOutcome outcome, Publisher publisher) {
    if (outcome.publication().isEmpty()) {
      return false;
    }
    try {
      return publisher.publish(outcome.publication().get());
    } catch (LapseException e) {
      log.warn("Upload attempt failed: {}", e.displayRich());
      return false;
    }
  }

  /**
   * Returns the parser used by this run, for reading reference timestamps.
   *
   * @return the parser
   */
  public ExpiryParser parser() {
    return parser;
  }

  /**
   * Returns the formatter used by this run.
   *
   * @return the display formatter
   */
  public ExpiryDisplay display() {
    return display;
  }

  private boolean persist(CodeDocument document, boolean changed, boolean dryRun)
      throws LapseException {
    if (!changed || dryRun) {
      return false;
    }
    store.save(document);
    log.info("Saved updated collection to {}", store.location());
    return true;
  }

  static String commitMessage(RunRequest request) {
    if (!request.isTargeted()) {
      return "Sweep expired by timestamp (" + ExpiryDisplay.isoStamp(request.ref()) + ")";
    }
    String codes = request.codes().stream().map(String::trim).collect(Collectors.joining(", "));
    return request.forcedExpiresSupplied()
        ? "Targeted overwrite 'expires' for: " + codes
        : "Targeted mark expired for: " + codes;
  }
}
