package proxyotel.trace.core.bootstrap;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporterBuilder;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporterBuilder;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Map;
import proxyotel.communication.serialization.json.OtlpJsonHttpSpanExporter;
import proxyotel.config.ResolvedConfig;

final class SpanExporters {

  private SpanExporters() {}

  /**
   * @throws IllegalArgumentException when the endpoint is not a usable URL for the protocol
   */
  static SpanExporter create(ResolvedConfig config) {
    String endpoint = config.getEndpoint().value;
    long timeoutMillis = config.getTimeoutMillis().value;
    Map<String, String> headers = config.getHeaders().value;

    switch (config.getProtocol().value) {
      case GRPC:
        {
          OtlpGrpcSpanExporterBuilder builder =
              OtlpGrpcSpanExporter.builder()
                  .setEndpoint(endpoint)
                  .setTimeout(timeoutMillis, MILLISECONDS);
          headers.forEach(builder::addHeader);
          return builder.build();
        }
      case HTTP_JSON:
        {
          OtlpJsonHttpSpanExporter.Builder builder =
              OtlpJsonHttpSpanExporter.builder()
                  .setEndpoint(endpoint)
                  .setTimeout(timeoutMillis, MILLISECONDS);
          headers.forEach(builder::addHeader);
          return builder.build();
        }
      case HTTP_PROTOBUF:
      default:
        {
          OtlpHttpSpanExporterBuilder builder =
              OtlpHttpSpanExporter.builder()
                  .setEndpoint(endpoint)
                  .setTimeout(timeoutMillis, MILLISECONDS);
          headers.forEach(builder::addHeader);
          return builder.build();
        }
    }
  }
}
