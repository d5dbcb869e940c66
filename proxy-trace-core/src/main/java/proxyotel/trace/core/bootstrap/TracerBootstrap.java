package proxyotel.trace.core.bootstrap;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.IdGenerator;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.config.ResolvedConfig;

/** Builds the export pipeline described by a resolved configuration. */
public final class TracerBootstrap {
  private static final Logger log = LoggerFactory.getLogger(TracerBootstrap.class);

  static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

  private TracerBootstrap() {}

  /**
   * Creates an SDK whose spans are batched and exported in the background. The SDK is not
   * registered globally.
   *
   * @throws TracingInitializationException when the exporter cannot be created, typically for a
   *     malformed endpoint
   */
  public static OpenTelemetrySdk bootstrap(ResolvedConfig config)
      throws TracingInitializationException {
    SpanExporter exporter;
    try {
      exporter = SpanExporters.create(config);
    } catch (RuntimeException e) {
      throw new TracingInitializationException(
          "Failed to create the "
              + config.getProtocol().value
              + " span exporter for "
              + config.getEndpoint().value,
          e);
    }
    log.debug("Created span exporter {}", exporter);

    Resource resource =
        Resource.getDefault()
            .merge(Resource.create(Attributes.of(SERVICE_NAME, config.getServiceName().value)));
    SdkTracerProvider tracerProvider =
        SdkTracerProvider.builder()
            .setResource(resource)
            .setSampler(Samplers.create(config.getSampler().value))
            .setIdGenerator(IdGenerator.random())
            .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
            .build();

    return OpenTelemetrySdk.builder()
        .setTracerProvider(tracerProvider)
        .setPropagators(
            ContextPropagators.create(Propagators.create(config.getPropagator().value)))
        .build();
  }
}
