package io.lapse.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.lapse.CivilZone;
import io.lapse.LapseException;
import io.lapse.publish.GitHubSettings;
import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DateTimeException;

/**
 * Settings read from {@code reference.conf}/{@code application.conf} under {@code lapse}.
 *
 * <p>Environment variables are wired in through the configuration itself ({@code
 * SHIFTCODESJSONPATH}, {@code GITHUB_USER}, ...). Command-line flags are applied on top by {@link
 * #withOptions(CliOptions)}.
 */
final class LapseConfig {
  final Path file;
  final CivilZone zone;
  final GitHubSettings github;

  private LapseConfig(Path file, CivilZone zone, GitHubSettings github) {
    this.file = file;
    this.zone = zone;
    this.github = github;
  }

  static LapseConfig load() throws LapseException {
    Config root;
    try {
      root = ConfigFactory.load();
    } catch (ConfigException e) {
      throw invalid(e.getMessage(), null);
    }
    return from(root);
  }

  static LapseConfig from(Config root) throws LapseException {
    try {
      Config c = root.getConfig("lapse");
      Config gh = c.getConfig("github");
      GitHubSettings github =
          new GitHubSettings(
              blankToNull(gh.getString("user")),
              blankToNull(gh.getString("repo")),
              blankToNull(gh.getString("token")),
              blankToNull(gh.getString("branch")),
              apiUrl(gh.getString("api-url")));
      return new LapseConfig(path(c.getString("file")), zone(c.getString("zone")), github);
    } catch (ConfigException e) {
      throw invalid(e.getMessage(), null);
    }
  }

  private static CivilZone zone(String name) throws LapseException {
    try {
      return CivilZone.of(name);
    } catch (DateTimeException e) {
      throw invalid("unknown time zone for lapse.zone", name);
    }
  }

  private static URI apiUrl(String url) throws LapseException {
    try {
      return URI.create(url);
    } catch (IllegalArgumentException e) {
      throw invalid("malformed URL for lapse.github.api-url", url);
    }
  }

  private static Path path(String file) throws LapseException {
    try {
      return Path.of(file);
    } catch (InvalidPathException e) {
      throw invalid("invalid path for lapse.file", file);
    }
  }

  private static LapseException invalid(String detail, String value) {
    return LapseException.input(
        "invalid configuration: " + detail,
        value,
        "check application.conf and the SHIFTCODESJSONPATH and GITHUB_* environment variables");
  }

  /** Returns a copy with any flags given on the command line taking precedence. */
  LapseConfig withOptions(CliOptions options) {
    GitHubSettings github =
        new GitHubSettings(
            pick(options.user, this.github.user()),
            pick(options.repo, this.github.repo()),
            pick(options.token, this.github.token()),
            pick(options.branch, this.github.branch()),
            this.github.apiUrl());
    Path file = options.file != null ? Path.of(options.file) : this.file;
    return new LapseConfig(file, zone, github);
  }

  private static String pick(String flag, String configured) {
    return flag != null ? flag : configured;
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
