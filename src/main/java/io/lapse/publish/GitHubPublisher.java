package io.lapse.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lapse.LapseException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commits the updated document to a GitHub repository through the contents API.
 *
 * <p>The file lands at the repository root under the document's file name. The target branch is
 * the configured one, else the repository's default branch, else {@code main}. An existing file is
 * updated in place (its blob SHA is fetched first); a missing one is created, which also works for
 * an empty repository.
 */
public final class GitHubPublisher implements Publisher {
  private static final Logger log = LoggerFactory.getLogger(GitHubPublisher.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String FALLBACK_BRANCH = "main";
  private static final String PERMISSION_HINT =
      "fine-grained token: grant 'Contents: Read and write' and include this repository\n"
          + "classic token: enable the 'repo' scope\n"
          + "organization repository: complete SSO authorization for the token";

  private final HttpClient client;
  private final GitHubSettings settings;

  /**
   * Creates a publisher with a default HTTP client.
   *
   * @param settings the repository and credentials
   */
  public GitHubPublisher(GitHubSettings settings) {
    this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(20)).build(), settings);
  }

  /**
   * Creates a publisher with the given HTTP client.
   *
   * @param client the HTTP client
   * @param settings the repository and credentials
   */
  public GitHubPublisher(HttpClient client, GitHubSettings settings) {
    this.client = client;
    this.settings = settings;
  }

  @Override
  public boolean publish(PublishRequest request) throws LapseException {
    if (!settings.complete()) {
      log.info("GitHub credentials incomplete; skipping upload");
      return false;
    }

    String name = request.document().getFileName().toString();
    byte[] content;
    try {
      content = Files.readAllBytes(request.document());
    } catch (IOException e) {
      throw LapseException.publish("cannot read " + request.document(), null, e);
    }

    String branch = settings.branch() != null ? settings.branch() : defaultBranch();
    String sha = existingSha(name, branch);

    ObjectNode body = MAPPER.createObjectNode();
    body.put("message", request.message());
    body.put("content", Base64.getEncoder().encodeToString(content));
    body.put("branch", branch);
    if (sha != null) {
      body.put("sha", sha);
    }

    HttpResponse<String> resp = send(request(contentsPath(name)).PUT(bodyOf(body)).build());
    if (resp.statusCode() / 100 != 2) {
      throw failure(resp);
    }
    log.info(
        "{} {} in {}/{}@{}",
        sha != null ? "Updated" : "Created",
        name,
        settings.user(),
        settings.repo(),
        branch);
    return true;
  }

  private String defaultBranch() throws LapseException {
    HttpResponse<String> resp = send(request(repoPath()).GET().build());
    if (resp.statusCode() != 200) {
      throw failure(resp);
    }
    JsonNode branch = readJson(resp).get("default_branch");
    return branch != null && branch.isTextual() && !branch.asText().isEmpty()
        ? branch.asText()
        : FALLBACK_BRANCH;
  }

  /** Returns the blob SHA of the current file, or null if it does not exist yet. */
  private String existingSha(String name, String branch) throws LapseException {
    String path = contentsPath(name) + "?ref=" + encode(branch);
    HttpResponse<String> resp = send(request(path).GET().build());
    if (resp.statusCode() == 404) {
      return null;
    }
    if (resp.statusCode() != 200) {
      throw failure(resp);
    }
    JsonNode sha = readJson(resp).get("sha");
    return sha != null && sha.isTextual() ? sha.asText() : null;
  }

  private HttpRequest.Builder request(String path) {
    return HttpRequest.newBuilder(resolve(path))
        .timeout(Duration.ofSeconds(60))
        .header("Accept", "application/vnd.github+json")
        .header("Authorization", "Bearer " + settings.token())
        .header("X-GitHub-Api-Version", "2022-11-28")
        .header("User-Agent", "lapse");
  }

  private URI resolve(String path) {
    String base = settings.apiUrl().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  private String repoPath() {
    return "/repos/" + encode(settings.user()) + "/" + encode(settings.repo());
  }

  private String contentsPath(String name) {
    return repoPath() + "/contents/" + encode(name);
  }

  private HttpResponse<String> send(HttpRequest req) throws LapseException {
    try {
      return client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw LapseException.publish("GitHub request failed: " + e.getMessage(), null, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw LapseException.publish("GitHub request interrupted", null, e);
    }
  }

  private static HttpRequest.BodyPublisher bodyOf(JsonNode body) {
    return HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8);
  }

  private static JsonNode readJson(HttpResponse<String> resp) throws LapseException {
    try {
      return MAPPER.readTree(resp.body());
    } catch (IOException e) {
      throw LapseException.publish("unexpected GitHub response: " + e.getMessage(), null, e);
    }
  }

  private static LapseException failure(HttpResponse<String> resp) {
    int status = resp.statusCode();
    String detail = errorMessage(resp.body());
    if (status == 401 || status == 403) {
      return LapseException.publish(
          "GitHub upload failed: auth/permission error (HTTP " + status + ")",
          PERMISSION_HINT,
          null);
    }
    return LapseException.publish("GitHub upload failed: HTTP " + status + detail, null, null);
  }

  private static String errorMessage(String body) {
    try {
      JsonNode message = MAPPER.readTree(body).get("message");
      return message != null && message.isTextual() ? ": " + message.asText() : "";
    } catch (IOException e) {
      return "";
    }
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
