package io.lapse.cli;

import io.lapse.LapseException;
import java.util.ArrayList;
import java.util.List;

/** Parsed command-line options. Unset values are null so configuration can fill them in. */
final class CliOptions {
  static final String USAGE =
      String.join(
          "\n",
          "usage: lapse [CODE[, CODE...]] [--expires ISO] [--file PATH] [--dry-run]",
          "             [--user USER --repo REPO --token TOKEN] [--branch BRANCH]",
          "",
          "With CODE(s): targeted update. With --expires, only the 'expires' field is overwritten.",
          "  Without --expires, 'expires' is set to the current time and 'expired' to true.",
          "With no CODE: bulk sweep sets 'expired' to true for entries whose 'expires' has passed.",
          "",
          "  --expires ISO   reference timestamp, e.g. 2025-10-01T00:00:00Z",
          "  --file PATH     path to the code collection (default: data/shiftcodes.json)",
          "  --dry-run       report what would change without writing",
          "  --user USER     GitHub user or organization that owns the repository",
          "  --repo REPO     GitHub repository name",
          "  --token TOKEN   GitHub token with contents write permission",
          "  --branch NAME   branch to commit to (default: the repository's default branch)");

  final List<String> codes;
  final String expires;
  final String file;
  final boolean dryRun;
  final String user;
  final String repo;
  final String token;
  final String branch;
  final boolean help;

  private CliOptions(
      List<String> codes,
      String expires,
      String file,
      boolean dryRun,
      String user,
      String repo,
      String token,
      String branch,
      boolean help) {
    this.codes = codes;
    this.expires = expires;
    this.file = file;
    this.dryRun = dryRun;
    this.user = user;
    this.repo = repo;
    this.token = token;
    this.branch = branch;
    this.help = help;
  }

  static CliOptions parse(String[] args) throws LapseException {
    List<String> positional = new ArrayList<>();
    String expires = null;
    String file = null;
    boolean dryRun = false;
    String user = null;
    String repo = null;
    String token = null;
    String branch = null;
    boolean help = false;

    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      String inline = null;
      int eq = a.indexOf('=');
      if (a.startsWith("--") && eq > 2) {
        inline = a.substring(eq + 1);
        a = a.substring(0, eq);
      }
      switch (a) {
        case "--dry-run", "-h", "--help" -> {
          if (inline != null) {
            throw LapseException.input(
                "option takes no value", args[i], "run with --help for usage");
          }
          if (a.equals("--dry-run")) {
            dryRun = true;
          } else {
            help = true;
          }
        }
        case "--expires" -> expires = inline != null ? inline : value(args, ++i, a);
        case "--file" -> file = inline != null ? inline : value(args, ++i, a);
        case "--user" -> user = inline != null ? inline : value(args, ++i, a);
        case "--repo" -> repo = inline != null ? inline : value(args, ++i, a);
        case "--token" -> token = inline != null ? inline : value(args, ++i, a);
        case "--branch" -> branch = inline != null ? inline : value(args, ++i, a);
        default -> {
          if (a.startsWith("--")) {
            throw LapseException.input("unknown option", args[i], "run with --help for usage");
          }
          positional.add(a);
        }
      }
    }

    return new CliOptions(
        CodeArguments.parse(positional), expires, file, dryRun, user, repo, token, branch, help);
  }

  private static String value(String[] args, int i, String option) throws LapseException {
    if (i >= args.length || args[i].startsWith("--")) {
      throw LapseException.input("missing value for " + option, null, "run with --help for usage");
    }
    return args[i];
  }
}
