package ca.gc.cra.continuum.infrastructure.license;

import ca.gc.cra.continuum.application.json.JsonSupport;
import ca.gc.cra.continuum.application.port.LicenseBackendPort;
import ca.gc.cra.continuum.domain.license.LicenseGrant;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Fetches license grants from a licensing service over HTTP.
 *
 * <p>Issues {@code GET {endpoint}} with the key in the {@code X-License-Key} header and expects a JSON object
 * {@code {license_id, expiry_date (yyyy-MM-dd), quota_limit, active}}. {@code expiry_date} and {@code quota_limit}
 * may be {@code null} for open-ended grants; a missing {@code active} counts as revoked.</p>
 *
 * @since 0.1.0
 */
public final class HttpLicenseBackend implements LicenseBackendPort {
  static final String KEY_HEADER = "X-License-Key";

  private final OkHttpClient client;
  private final HttpUrl endpoint;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a backend.
   *
   * @param endpoint grant lookup URL
   * @param timeout call timeout per lookup
   */
  public HttpLicenseBackend(String endpoint, Duration timeout) {
    this(new OkHttpClient.Builder()
        .callTimeout(timeout == null ? Duration.ofSeconds(5) : timeout)
        .build(), endpoint);
  }

  HttpLicenseBackend(OkHttpClient client, String endpoint) {
    this.client = Objects.requireNonNull(client, "client");
    HttpUrl parsed = endpoint == null ? null : HttpUrl.parse(endpoint.trim());
    if (parsed == null) {
      throw new IllegalArgumentException("license.endpoint must be an http(s) URL");
    }
    this.endpoint = parsed;
  }

  @Override
  public LicenseGrant fetch(String licenseKey) throws IOException {
    Objects.requireNonNull(licenseKey, "licenseKey");
    Request request = new Request.Builder()
        .url(endpoint)
        .header(KEY_HEADER, licenseKey)
        .header("Accept", "application/json")
        .get()
        .build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new IOException("License service returned HTTP " + response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new IOException("License service returned an empty body");
      }
      return toGrant(body.string());
    }
  }

  private LicenseGrant toGrant(String payload) throws IOException {
    Map<String, Object> doc;
    try {
      doc = json.parseObject(payload);
    } catch (IllegalArgumentException ex) {
      throw new IOException("License service returned malformed JSON", ex);
    }
    Object id = doc.get("license_id");
    Object active = doc.get("active");
    return new LicenseGrant(
        id == null ? null : String.valueOf(id),
        parseDate(doc.get("expiry_date")),
        parseQuota(doc.get("quota_limit")),
        Boolean.TRUE.equals(active));
  }

  private static LocalDate parseDate(Object raw) throws IOException {
    if (raw == null) {
      return null;
    }
    try {
      return LocalDate.parse(String.valueOf(raw).trim());
    } catch (DateTimeParseException ex) {
      throw new IOException("Unreadable expiry_date: " + raw, ex);
    }
  }

  private static Long parseQuota(Object raw) throws IOException {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number number) {
      return number.longValue();
    }
    throw new IOException("quota_limit must be a number");
  }
}
