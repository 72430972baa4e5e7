package io.lapse.cli;

import io.lapse.ExpiryRun;
import io.lapse.LapseException;
import io.lapse.RunOutcome;
import io.lapse.RunRequest;
import io.lapse.display.ReportRenderer;
import io.lapse.publish.GitHubPublisher;
import io.lapse.publish.Publisher;
import io.lapse.store.JsonFileStore;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command-line entry point. */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, LapseConfig::load, Clock.systemUTC(), System.out, System.err));
  }

  /** Supplies the configuration once the command line has been parsed. */
  @FunctionalInterface
  interface ConfigSource {
    LapseConfig load() throws LapseException;
  }

  static int run(
      String[] args, ConfigSource config, Clock clock, PrintStream out, PrintStream err) {
    try {
      CliOptions options = CliOptions.parse(args);
      if (options.help) {
        out.println(CliOptions.USAGE);
        return 0;
      }
      LapseConfig effective = config.load().withOptions(options);
      ExpiryRun run = new ExpiryRun(new JsonFileStore(effective.file), effective.zone);
      return execute(run, options, effective, clock, out);
    } catch (LapseException e) {
      log.debug("Run failed", e);
      err.println(e.displayRich());
      return 1;
    }
  }

  private static int execute(
      ExpiryRun run, CliOptions options, LapseConfig config, Clock clock, PrintStream out)
      throws LapseException {
    boolean forced = options.expires != null;
    Instant ref = forced ? referenceInstant(run, options.expires) : config.zone.now(clock);

    RunRequest request =
        options.codes.isEmpty()
            ? RunRequest.sweep(ref, options.dryRun)
            : RunRequest.targeted(options.codes, ref, forced, options.dryRun);
    RunOutcome outcome = run.execute(request);

    ReportRenderer renderer = new ReportRenderer(run.display());
    List<String> lines =
        outcome.mode() == RunOutcome.Mode.SWEEP
            ? renderer.renderSweep(outcome.sweep(), ref, options.dryRun)
            : renderer.renderTargeted(outcome.targeted(), ref, forced, options.dryRun);
    lines.forEach(out::println);

    if (outcome.publication().isPresent() && config.github.complete()) {
      Publisher publisher = new GitHubPublisher(config.github);
      if (run.publish(outcome, publisher)) {
        out.println("Uploaded updated " + config.file.getFileName() + " to GitHub.");
      } else {
        out.println("Upload attempt failed.");
      }
    }
    return 0;
  }

  private static Instant referenceInstant(ExpiryRun run, String expires) throws LapseException {
    return run.parser()
        .parseTimestamp(expires)
        .orElseThrow(
            () ->
                LapseException.input(
                    "invalid ISO timestamp for --expires",
                    expires,
                    "use e.g. 2025-10-01T00:00:00Z or 2025-10-01"));
  }
}
