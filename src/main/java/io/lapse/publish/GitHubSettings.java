package io.lapse.publish;

import java.net.URI;

/**
 * Where and as whom to publish on GitHub.
 *
 * @param user the account or organization owning the repository
 * @param repo the repository name
 * @param token a token with contents write permission
 * @param branch the branch to commit to, or null for the repository default
 * @param apiUrl the REST API root
 */
public record GitHubSettings(String user, String repo, String token, String branch, URI apiUrl) {
  /** The public GitHub REST API. */
  public static final URI DEFAULT_API = URI.create("https://api.github.com");

  /** Creates new settings, defaulting the API root. */
  public GitHubSettings {
    apiUrl = apiUrl == null ? DEFAULT_API : apiUrl;
    branch = branch == null || branch.isBlank() ? null : branch;
  }

  /**
   * Returns whether user, repository and token are all present.
   *
   * @return true if publishing can be attempted
   */
  public boolean complete() {
    return present(user) && present(repo) && present(token);
  }

  private static boolean present(String s) {
    return s != null && !s.isBlank();
  }

  @Override
  public String toString() {
    // keep the token out of logs
    return "GitHubSettings[" + user + "/" + repo + (branch != null ? "@" + branch : "") + "]";
  }
}
