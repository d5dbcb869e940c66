package proxyotel.trace.core.bootstrap;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import proxyotel.config.ResolvedConfig;

class TracingRuntimeTest {

  @AfterEach
  void uninstall() {
    TracingRuntime.shutdown();
  }

  @Test
  void noopUntilInstalled() {
    assertFalse(TracingRuntime.isInstalled());
    assertSame(TracingRuntime.NOOP, TracingRuntime.current());

    Span span = TracingRuntime.current().tracer().spanBuilder("ignored").startSpan();
    assertFalse(span.getSpanContext().isValid());
    span.end();
  }

  @Test
  void installsOnce() throws TracingInitializationException {
    ResolvedConfig config = SpanExportersTest.config("http/protobuf", "http://127.0.0.1:1");

    TracingRuntime first = TracingRuntime.install(config);
    TracingRuntime second =
        TracingRuntime.install(SpanExportersTest.config("grpc", "http://127.0.0.1:2"));

    assertTrue(TracingRuntime.isInstalled());
    assertSame(first, second);
    assertSame(first, TracingRuntime.current());
  }

  @Test
  void shutdownUninstalls() throws TracingInitializationException {
    TracingRuntime.install(SpanExportersTest.config("http/json", "http://127.0.0.1:1"));

    TracingRuntime.shutdown();
    TracingRuntime.shutdown();

    assertFalse(TracingRuntime.isInstalled());
    assertSame(TracingRuntime.NOOP, TracingRuntime.current());
  }

  @Test
  void malformedEndpointFailsInstallation() {
    ResolvedConfig config = SpanExportersTest.config("http/protobuf", "ftp://collector");

    assertThrows(TracingInitializationException.class, () -> TracingRuntime.install(config));
    assertFalse(TracingRuntime.isInstalled());
  }

  @Test
  void reinstallingKeepsOneShutdownHook() throws TracingInitializationException {
    TracingRuntime.install(SpanExportersTest.config("http/protobuf", "http://127.0.0.1:1"));
    Thread hook = TracingRuntime.shutdownHook();
    assertNotNull(hook);

    TracingRuntime.shutdown();
    TracingRuntime.install(SpanExportersTest.config("http/protobuf", "http://127.0.0.1:1"));

    assertSame(hook, TracingRuntime.shutdownHook());
  }

  @Test
  void failedInstallationIsRemembered() throws TracingInitializationException {
    TracingRuntime.checkInstallable();

    assertThrows(
        TracingInitializationException.class,
        () -> TracingRuntime.install(SpanExportersTest.config("grpc", "ftp://collector")));

    assertThrows(TracingInitializationException.class, TracingRuntime::checkInstallable);

    TracingRuntime.install(SpanExportersTest.config("grpc", "http://127.0.0.1:1"));
    TracingRuntime.checkInstallable();
  }

  @Test
  void installedRuntimeRecordsSpans() throws TracingInitializationException {
    TracingRuntime runtime =
        TracingRuntime.install(SpanExportersTest.config("http/protobuf", "http://127.0.0.1:1"));

    Span span = runtime.tracer().spanBuilder("GET example.com").startSpan();
    assertTrue(span.getSpanContext().isValid());
    assertTrue(span.getSpanContext().isSampled());
    span.end();
  }
}
