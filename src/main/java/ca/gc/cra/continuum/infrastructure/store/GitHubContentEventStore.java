package ca.gc.cra.continuum.infrastructure.store;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.port.EventStorePort;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventStorePort} that creates one file per event through the GitHub contents API.
 * <p><strong>Wire:</strong> {@code PUT {api}/repos/{owner}/{repo}/contents/{path}} with a JSON body carrying a
 * commit message, the base64 payload and an optional branch.</p>
 * <p><strong>Failure:</strong> One attempt per event, bounded by the call timeout. Non-2xx answers raise
 * {@link IOException}; paths are unique per event so there is nothing to retry against.</p>
 * <p><strong>Thread-safety:</strong> {@link OkHttpClient} is thread-safe; so is this adapter.</p>
 *
 * @since 0.1.0
 */
public final class GitHubContentEventStore implements EventStorePort {
  private static final Logger log = LoggerFactory.getLogger(GitHubContentEventStore.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final String DEFAULT_API_URL = "https://api.github.com";

  private final OkHttpClient client;
  private final HttpUrl apiUrl;
  private final String repo;
  private final String token;
  private final String branch;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a store.
   *
   * @param apiUrl API base URL; blank means {@code https://api.github.com}
   * @param repo {@code owner/name}
   * @param token bearer token
   * @param branch target branch; blank means the repository default
   * @param timeout call timeout for a single write
   */
  public GitHubContentEventStore(String apiUrl, String repo, String token, String branch, Duration timeout) {
    this(newClient(timeout), apiUrl, repo, token, branch);
  }

  GitHubContentEventStore(OkHttpClient client, String apiUrl, String repo, String token, String branch) {
    this.client = Objects.requireNonNull(client, "client");
    String base = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl.trim();
    HttpUrl parsed = HttpUrl.parse(base);
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid GitHub API url: " + base);
    }
    this.apiUrl = parsed;
    this.repo = requireRepo(repo);
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("GitHub token must not be blank");
    }
    this.token = token.trim();
    this.branch = branch == null || branch.isBlank() ? null : branch.trim();
  }

  @Override
  public void write(String path, byte[] payload) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(payload, "payload");

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", "audit: add " + path);
    body.put("content", Base64.getEncoder().encodeToString(payload));
    if (branch != null) {
      body.put("branch", branch);
    }

    Request request = new Request.Builder()
        .url(contentsUrl(path))
        .header("Authorization", "Bearer " + token)
        .header("Accept", "application/vnd.github+json")
        .header("X-GitHub-Api-Version", "2022-11-28")
        .put(RequestBody.create(json.write(body), JSON))
        .build();

    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new IOException("GitHub contents API returned HTTP " + response.code() + " for " + path);
      }
      log.debug("GitHub accepted {} (HTTP {})", path, response.code());
    }
  }

  @Override
  public String kind() {
    return "github";
  }

  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }

  String repo() {
    return repo;
  }

  HttpUrl contentsUrl(String path) {
    String[] ownerAndName = repo.split("/", 2);
    HttpUrl.Builder builder = apiUrl.newBuilder()
        .addPathSegment("repos")
        .addPathSegment(ownerAndName[0])
        .addPathSegment(ownerAndName[1])
        .addPathSegment("contents");
    for (String segment : path.split("/")) {
      if (!segment.isEmpty()) {
        builder.addPathSegment(segment);
      }
    }
    return builder.build();
  }

  private static String requireRepo(String repo) {
    if (repo == null || repo.isBlank()) {
      throw new IllegalArgumentException("GitHub repo must not be blank");
    }
    String trimmed = repo.trim();
    int slash = trimmed.indexOf('/');
    if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("GitHub repo must be owner/name (was " + trimmed + ")");
    }
    return trimmed;
  }

  private static OkHttpClient newClient(Duration timeout) {
    Duration effective = timeout == null || timeout.isZero() || timeout.isNegative()
        ? Duration.ofSeconds(10)
        : timeout;
    return new OkHttpClient.Builder()
        .callTimeout(effective)
        .retryOnConnectionFailure(false)
        .build();
  }
}
