package proxyotel.config;

import java.util.Locale;
import javax.annotation.Nullable;

public final class OtlpConfig {

  public static final String OTLP_ENDPOINT = "otlp.endpoint";
  public static final String OTLP_PROTOCOL = "otlp.protocol";
  public static final String OTLP_HEADERS = "otlp.headers";
  public static final String OTLP_TIMEOUT = "otlp.timeout";

  public static final String OTLP_TRACES_ENDPOINT_ENV = "OTEL_EXPORTER_OTLP_TRACES_ENDPOINT";
  public static final String OTLP_ENDPOINT_ENV = "OTEL_EXPORTER_OTLP_ENDPOINT";
  public static final String OTLP_TRACES_PROTOCOL_ENV = "OTEL_EXPORTER_OTLP_TRACES_PROTOCOL";
  public static final String OTLP_PROTOCOL_ENV = "OTEL_EXPORTER_OTLP_PROTOCOL";
  public static final String OTLP_TRACES_HEADERS_ENV = "OTEL_EXPORTER_OTLP_TRACES_HEADERS";
  public static final String OTLP_HEADERS_ENV = "OTEL_EXPORTER_OTLP_HEADERS";
  public static final String OTLP_TRACES_TIMEOUT_ENV = "OTEL_EXPORTER_OTLP_TRACES_TIMEOUT";
  public static final String OTLP_TIMEOUT_ENV = "OTEL_EXPORTER_OTLP_TIMEOUT";

  public static final String DEFAULT_HTTP_ENDPOINT = "http://localhost:4318";
  public static final String DEFAULT_GRPC_ENDPOINT = "http://localhost:4317";
  public static final String TRACES_PATH = "v1/traces";
  public static final long DEFAULT_TIMEOUT_MILLIS = 10_000L;

  public enum Protocol {
    GRPC("grpc"),
    HTTP_PROTOBUF("http/protobuf"),
    HTTP_JSON("http/json");

    public final String displayName;

    Protocol(String displayName) {
      this.displayName = displayName;
    }

    /**
     * Case insensitive conversion of an OTLP protocol token, accepting the legacy {@code binary}
     * and {@code json} aliases.
     *
     * @return the matching protocol, or {@code null} when the token is not recognized
     */
    @Nullable
    public static Protocol fromString(String value) {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "grpc":
          return GRPC;
        case "http/protobuf":
        case "binary":
          return HTTP_PROTOBUF;
        case "http/json":
        case "json":
          return HTTP_JSON;
        default:
          return null;
      }
    }

    public boolean isHttp() {
      return this != GRPC;
    }

    public String defaultEndpoint() {
      return isHttp() ? DEFAULT_HTTP_ENDPOINT : DEFAULT_GRPC_ENDPOINT;
    }

    @Override
    public String toString() {
      return displayName;
    }
  }

  private OtlpConfig() {}
}
