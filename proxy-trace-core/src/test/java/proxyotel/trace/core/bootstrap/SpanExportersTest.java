package proxyotel.trace.core.bootstrap;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import proxyotel.communication.serialization.json.OtlpJsonHttpSpanExporter;
import proxyotel.config.ConfigResolver;
import proxyotel.config.ModuleOptions;
import proxyotel.config.ResolvedConfig;

class SpanExportersTest {

  static ResolvedConfig config(String protocol, String endpoint) {
    ModuleOptions options =
        ModuleOptions.builder()
            .otlpProtocol(protocol)
            .otlpEndpoint(endpoint)
            .otlpHeaders("api-key=secret")
            .build();
    return new ConfigResolver(options, name -> null).resolve();
  }

  @Test
  void grpcProtocolUsesTheGrpcExporter() {
    assertExporter(OtlpGrpcSpanExporter.class, config("grpc", "http://collector:4317"));
  }

  @Test
  void protobufProtocolUsesTheHttpExporter() {
    assertExporter(OtlpHttpSpanExporter.class, config("http/protobuf", "http://collector:4318"));
  }

  @Test
  void jsonProtocolUsesTheJsonExporter() {
    assertExporter(OtlpJsonHttpSpanExporter.class, config("http/json", "http://collector:4318"));
  }

  @Test
  void defaultsUseTheHttpExporter() {
    assertExporter(
        OtlpHttpSpanExporter.class,
        new ConfigResolver(ModuleOptions.EMPTY, name -> null).resolve());
  }

  @ParameterizedTest
  @ValueSource(strings = {"grpc", "http/protobuf", "http/json"})
  void malformedEndpointIsRejected(String protocol) {
    ResolvedConfig config = config(protocol, "ftp://collector:4318");

    assertThrows(IllegalArgumentException.class, () -> SpanExporters.create(config));
  }

  private static void assertExporter(Class<?> expected, ResolvedConfig config) {
    SpanExporter exporter = SpanExporters.create(config);
    try {
      assertTrue(expected.isInstance(exporter), exporter.toString());
    } finally {
      exporter.shutdown();
    }
  }
}
