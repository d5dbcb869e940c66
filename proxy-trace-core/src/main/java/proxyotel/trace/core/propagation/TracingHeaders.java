package proxyotel.trace.core.propagation;

import io.opentelemetry.context.propagation.TextMapGetter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import proxyotel.trace.api.HttpMessage;

/**
 * The subset of request headers handed to propagators when looking for a parent context.
 *
 * <p>Only the host header and known propagation headers are kept: W3C {@code traceparent} and
 * {@code tracestate}, B3 single ({@code b3}) and multi ({@code x-b3-*}) headers and Jaeger's
 * {@code uber-*} headers. Names are lowercased and the first value of a repeated header wins.
 */
public final class TracingHeaders {
  public static final String HOST = "host";

  private final Map<String, String> headers;

  private TracingHeaders(Map<String, String> headers) {
    this.headers = headers;
  }

  public static TracingHeaders extract(HttpMessage msg) {
    Map<String, String> headers = new LinkedHashMap<>();
    msg.forEachHeader(
        (name, value) -> {
          String lowerName = name.toLowerCase(Locale.ROOT);
          if (isAllowed(lowerName) && !headers.containsKey(lowerName)) {
            headers.put(lowerName, value);
          }
        });
    return new TracingHeaders(Collections.unmodifiableMap(headers));
  }

  static boolean isAllowed(String lowerName) {
    return lowerName.equals(HOST)
        || lowerName.equals("traceparent")
        || lowerName.equals("tracestate")
        || lowerName.equals("b3")
        || lowerName.startsWith("x-b3")
        || lowerName.startsWith("uber");
  }

  /** The host header, empty when the request has none. */
  public String host() {
    String host = headers.get(HOST);
    return host != null ? host : "";
  }

  public Map<String, String> asMap() {
    return headers;
  }

  @Override
  public String toString() {
    return "TracingHeaders" + headers;
  }

  /** Case insensitive lookups, propagators ask for names like {@code X-B3-TraceId}. */
  public enum Getter implements TextMapGetter<TracingHeaders> {
    INSTANCE;

    @Override
    public Iterable<String> keys(TracingHeaders carrier) {
      return carrier.headers.keySet();
    }

    @Nullable
    @Override
    public String get(@Nullable TracingHeaders carrier, String key) {
      if (carrier == null) {
        return null;
      }
      return carrier.headers.get(key.toLowerCase(Locale.ROOT));
    }
  }
}
