package proxyotel.trace.core;

import io.opentelemetry.api.common.AttributeKey;

/** Attribute keys recorded on proxy spans. */
public final class SpanAttributes {
  public static final AttributeKey<String> HTTP_REQUEST_METHOD =
      AttributeKey.stringKey("http.request.method");
  public static final AttributeKey<String> URL_PATH = AttributeKey.stringKey("url.path");
  public static final AttributeKey<String> URL_QUERY = AttributeKey.stringKey("url.query");
  public static final AttributeKey<String> HTTP_REQUEST_HEADER_HOST =
      AttributeKey.stringKey("http.request.header.host");
  public static final AttributeKey<String> NETWORK_PEER_ADDRESS =
      AttributeKey.stringKey("network.peer.address");
  public static final AttributeKey<Long> HTTP_RESPONSE_STATUS_CODE =
      AttributeKey.longKey("http.response.status_code");

  public static final AttributeKey<String> FRONTEND_NAME =
      AttributeKey.stringKey("haproxy.frontend.name");
  public static final AttributeKey<String> BACKEND_NAME =
      AttributeKey.stringKey("haproxy.backend.name");
  public static final AttributeKey<String> SERVER_NAME =
      AttributeKey.stringKey("haproxy.server.name");
  public static final AttributeKey<String> TERMINATION_STATE =
      AttributeKey.stringKey("haproxy.termination_state");

  private SpanAttributes() {}
}
