package proxyotel.trace.core.bootstrap;

import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.extension.trace.propagation.B3Propagator;
import io.opentelemetry.extension.trace.propagation.JaegerPropagator;
import proxyotel.config.PropagationStyle;

final class Propagators {

  private Propagators() {}

  static TextMapPropagator create(PropagationStyle style) {
    switch (style) {
      case JAEGER:
        return JaegerPropagator.getInstance();
      case ZIPKIN:
        return B3Propagator.injectingMultiHeaders();
      case W3C:
      default:
        return W3CTraceContextPropagator.getInstance();
    }
  }
}
