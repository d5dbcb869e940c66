package proxyotel.communication.serialization.json;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.communication.http.OkHttpUtils;

/**
 * Exports spans to an OTLP collector over HTTP with JSON encoded bodies.
 *
 * <p>Calls are made synchronously on the thread invoking {@link #export}, which for a batch span
 * processor is its own worker thread. Failed exports are logged and reported through the result
 * code; they are not retried.
 */
public final class OtlpJsonHttpSpanExporter implements SpanExporter {
  private static final Logger log = LoggerFactory.getLogger(OtlpJsonHttpSpanExporter.class);

  private final OkHttpClient client;
  private final HttpUrl url;
  private final Map<String, String> headers;
  private final AtomicBoolean isShutdown = new AtomicBoolean();

  OtlpJsonHttpSpanExporter(OkHttpClient client, HttpUrl url, Map<String, String> headers) {
    this.client = client;
    this.url = url;
    this.headers = headers;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public CompletableResultCode export(Collection<SpanData> spans) {
    if (isShutdown.get()) {
      return CompletableResultCode.ofFailure();
    }
    if (spans.isEmpty()) {
      return CompletableResultCode.ofSuccess();
    }

    OtlpJsonRequestBody body;
    try {
      body = OtlpJsonRequestBody.of(spans);
    } catch (OtlpJsonRequestBody.SerializationException e) {
      log.warn("Dropping {} spans: {}", spans.size(), e.getMessage(), e);
      return CompletableResultCode.ofFailure();
    }

    Request request = OkHttpUtils.prepareRequest(url, headers).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      if (response.isSuccessful()) {
        log.debug("Exported {} spans to {}", spans.size(), url);
        return CompletableResultCode.ofSuccess();
      }
      log.warn(
          "Failed to export {} spans to {}: HTTP {} {}",
          spans.size(),
          url,
          response.code(),
          response.message());
      return CompletableResultCode.ofFailure();
    } catch (IOException e) {
      log.warn("Failed to export {} spans to {}: {}", spans.size(), url, e.toString());
      return CompletableResultCode.ofFailure();
    }
  }

  @Override
  public CompletableResultCode flush() {
    return CompletableResultCode.ofSuccess();
  }

  @Override
  public CompletableResultCode shutdown() {
    if (!isShutdown.compareAndSet(false, true)) {
      log.debug("Calling shutdown() multiple times.");
      return CompletableResultCode.ofSuccess();
    }
    client.dispatcher().cancelAll();
    client.connectionPool().evictAll();
    return CompletableResultCode.ofSuccess();
  }

  @Override
  public String toString() {
    return "OtlpJsonHttpSpanExporter{url=" + url + '}';
  }

  public static final class Builder {
    private String endpoint;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private long timeoutMillis = TimeUnit.SECONDS.toMillis(10);

    private Builder() {}

    /** Full traces URL, including the {@code /v1/traces} path. */
    public Builder setEndpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder addHeader(String name, String value) {
      headers.put(name, value);
      return this;
    }

    public Builder setTimeout(long timeout, TimeUnit unit) {
      if (timeout <= 0) {
        throw new IllegalArgumentException("timeout must be positive");
      }
      this.timeoutMillis = unit.toMillis(timeout);
      return this;
    }

    /**
     * @throws IllegalArgumentException when the endpoint is missing or is not an http(s) URL
     */
    public OtlpJsonHttpSpanExporter build() {
      if (endpoint == null) {
        throw new IllegalArgumentException("endpoint must be set");
      }
      HttpUrl url = HttpUrl.parse(endpoint);
      if (url == null) {
        throw new IllegalArgumentException("Invalid OTLP endpoint: " + endpoint);
      }
      return new OtlpJsonHttpSpanExporter(
          OkHttpUtils.buildHttpClient(url, timeoutMillis),
          url,
          Collections.unmodifiableMap(new LinkedHashMap<>(headers)));
    }
  }
}
