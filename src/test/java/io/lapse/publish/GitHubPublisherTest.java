package io.lapse.publish;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.lapse.ErrorKind;
import io.lapse.LapseException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs the publisher against a local stand-in for the GitHub contents API. */
public class GitHubPublisherTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String CONTENT = "[{\"codes\": []}]";

  @TempDir Path dir;

  private HttpServer server;
  private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
  private volatile String putBody;
  private volatile String authorization;

  // stub behavior
  private volatile int getStatus = 404;
  private volatile String getBody = "{\"message\": \"Not Found\"}";
  private volatile int putStatus = 201;

  private Path document;

  @BeforeEach
  void start() throws IOException {
    document = dir.resolve("shiftcodes.json");
    Files.writeString(document, CONTENT, StandardCharsets.UTF_8);

    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/repos/octo/codes",
        exchange -> {
          capture(exchange);
          respond(exchange, 200, "{\"default_branch\": \"trunk\"}");
        });
    server.createContext(
        "/repos/octo/codes/contents/",
        exchange -> {
          capture(exchange);
          authorization = exchange.getRequestHeaders().getFirst("Authorization");
          if ("PUT".equals(exchange.getRequestMethod())) {
            putBody =
                new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            respond(exchange, putStatus, "{\"message\": \"stub\"}");
          } else {
            respond(exchange, getStatus, getBody);
          }
        });
    server.start();
  }

  @AfterEach
  void stop() {
    server.stop(0);
  }

  private void capture(HttpExchange exchange) {
    requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI());
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private GitHubPublisher publisher(String branch) {
    URI api = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    return new GitHubPublisher(new GitHubSettings("octo", "codes", "t0ken", branch, api));
  }

  @Test
  void testIncompleteCredentialsSkip() throws LapseException {
    GitHubPublisher p =
        new GitHubPublisher(new GitHubSettings("octo", "codes", " ", null, null));
    assertFalse(p.publish(new PublishRequest(document, "msg")));
    assertTrue(requests.isEmpty());
  }

  @Test
  void testCreatesFileOnDefaultBranch() throws Exception {
    assertTrue(publisher(null).publish(new PublishRequest(document, "Sweep expired")));

    assertEquals(
        List.of(
            "GET /repos/octo/codes",
            "GET /repos/octo/codes/contents/shiftcodes.json?ref=trunk",
            "PUT /repos/octo/codes/contents/shiftcodes.json"),
        requests);
    assertEquals("Bearer t0ken", authorization);

    JsonNode body = MAPPER.readTree(putBody);
    assertEquals("Sweep expired", body.get("message").asText());
    assertEquals("trunk", body.get("branch").asText());
    assertFalse(body.has("sha"));
    assertEquals(
        CONTENT,
        new String(Base64.getDecoder().decode(body.get("content").asText()), StandardCharsets.UTF_8));
  }

  @Test
  void testUpdatesExistingFileOnConfiguredBranch() throws Exception {
    getStatus = 200;
    getBody = "{\"sha\": \"abc123\", \"name\": \"shiftcodes.json\"}";
    putStatus = 200;

    assertTrue(publisher("dev").publish(new PublishRequest(document, "Targeted mark expired")));

    assertEquals(
        List.of(
            "GET /repos/octo/codes/contents/shiftcodes.json?ref=dev",
            "PUT /repos/octo/codes/contents/shiftcodes.json"),
        requests);
    JsonNode body = MAPPER.readTree(putBody);
    assertEquals("abc123", body.get("sha").asText());
    assertEquals("dev", body.get("branch").asText());
  }

  @Test
  void testPermissionErrorCarriesHint() {
    putStatus = 403;
    LapseException e =
        assertThrows(
            LapseException.class,
            () -> publisher("main").publish(new PublishRequest(document, "msg")));
    assertEquals(ErrorKind.PUBLISH, e.kind());
    assertTrue(e.getMessage().contains("403"));
    assertTrue(e.hint().orElseThrow().contains("Contents: Read and write"));
  }

  @Test
  void testServerErrorOnLookup() {
    getStatus = 500;
    getBody = "{\"message\": \"boom\"}";
    LapseException e =
        assertThrows(
            LapseException.class,
            () -> publisher("main").publish(new PublishRequest(document, "msg")));
    assertEquals(ErrorKind.PUBLISH, e.kind());
    assertEquals("GitHub upload failed: HTTP 500: boom", e.getMessage());
  }

  @Test
  void testTokenHiddenFromToString() {
    GitHubSettings s = new GitHubSettings("octo", "codes", "t0ken", "dev", null);
    assertFalse(s.toString().contains("t0ken"));
    assertEquals(GitHubSettings.DEFAULT_API, s.apiUrl());
  }
}
