package ca.gc.cra.continuum.infrastructure.engine;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.port.DecisionEngineException;
import ca.gc.cra.continuum.application.port.DecisionEnginePort;
import ca.gc.cra.continuum.domain.decision.Verdict;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DecisionEnginePort} that posts {@code {"text": ...}} to a remote Decision Engine and parses its verdict.
 *
 * <p>HTTP 4xx answers whose JSON body carries {@code error} reach the caller as a refusal verdict
 * ({@link Verdict#error()}). Any other non-2xx answer, transport failures and unreadable bodies raise
 * {@link DecisionEngineException}. Neither the request text nor the response body is logged.</p>
 *
 * @since 0.1.0
 */
public final class HttpDecisionEngine implements DecisionEnginePort {
  private static final Logger log = LoggerFactory.getLogger(HttpDecisionEngine.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final HttpUrl endpoint;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates an engine client.
   *
   * @param endpoint evaluation URL
   * @param timeout call timeout per evaluation
   */
  public HttpDecisionEngine(String endpoint, Duration timeout) {
    this(new OkHttpClient.Builder()
        .callTimeout(timeout == null ? Duration.ofSeconds(30) : timeout)
        .build(), endpoint);
  }

  HttpDecisionEngine(OkHttpClient client, String endpoint) {
    this.client = Objects.requireNonNull(client, "client");
    HttpUrl parsed = endpoint == null ? null : HttpUrl.parse(endpoint.trim());
    if (parsed == null) {
      throw new IllegalArgumentException("engine.url must be an http(s) URL");
    }
    this.endpoint = parsed;
  }

  @Override
  public Verdict evaluate(String text) throws DecisionEngineException {
    Objects.requireNonNull(text, "text");
    Request request = new Request.Builder()
        .url(endpoint)
        .header("Accept", "application/json")
        .post(RequestBody.create(json.write(Map.of("text", text)), JSON))
        .build();
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      String payload = body == null ? "" : body.string();
      if (response.code() >= 500 || (!response.isSuccessful() && payload.isBlank())) {
        throw new DecisionEngineException("Decision engine returned HTTP " + response.code());
      }
      Verdict verdict = VerdictParser.parse(json.parseObject(payload));
      if (!response.isSuccessful()) {
        if (!verdict.failed()) {
          throw new DecisionEngineException(
              "Decision engine returned HTTP " + response.code() + " without an error verdict");
        }
        log.debug("Decision engine refused request with HTTP {} ({})", response.code(), verdict.error());
      }
      return verdict;
    } catch (IOException ex) {
      throw new DecisionEngineException("Decision engine unreachable: " + ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new DecisionEngineException("Decision engine answer unreadable", ex);
    }
  }
}
