package proxyotel.communication.http;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.Collections;
import java.util.Map;
import okhttp3.ConnectionSpec;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OkHttpUtils {
  private static final Logger log = LoggerFactory.getLogger(OkHttpUtils.class);

  private static final String USER_AGENT = "User-Agent";
  private static final String USER_AGENT_VALUE = "proxy-otel-java";

  private OkHttpUtils() {}

  /**
   * Builds a client for synchronous calls to a single collector.
   *
   * @param url the collector URL, plain http URLs get a clear text only client
   * @param timeoutMillis connect, read, write and overall call timeout
   */
  public static OkHttpClient buildHttpClient(final HttpUrl url, final long timeoutMillis) {
    final OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(timeoutMillis, MILLISECONDS)
            .writeTimeout(timeoutMillis, MILLISECONDS)
            .readTimeout(timeoutMillis, MILLISECONDS)
            .callTimeout(timeoutMillis, MILLISECONDS);

    if (isPlainHttp(url)) {
      // force clear text when using http to avoid failures for JVMs without TLS
      builder.connectionSpecs(Collections.singletonList(ConnectionSpec.CLEARTEXT));
      log.debug("Using clear text http transport for {}", url);
    }

    return builder.build();
  }

  public static Request.Builder prepareRequest(final HttpUrl url, Map<String, String> headers) {
    final Request.Builder builder =
        new Request.Builder().url(url).header(USER_AGENT, USER_AGENT_VALUE);

    for (Map.Entry<String, String> e : headers.entrySet()) {
      builder.header(e.getKey(), e.getValue());
    }

    return builder;
  }

  public static boolean isPlainHttp(final HttpUrl url) {
    return url != null && "http".equalsIgnoreCase(url.scheme());
  }
}
