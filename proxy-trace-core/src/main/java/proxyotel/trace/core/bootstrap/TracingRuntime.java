package proxyotel.trace.core.bootstrap;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.config.ResolvedConfig;

/**
 * The tracer and propagator shared by every worker thread of the process.
 *
 * <p>The first worker installs the runtime; the others pick it up through {@link #current()}.
 * Until then {@link #current()} returns {@link #NOOP}, whose spans are never recorded.
 */
public final class TracingRuntime {
  private static final Logger log = LoggerFactory.getLogger(TracingRuntime.class);

  public static final String INSTRUMENTATION_NAME = "haproxy-otel";
  static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  public static final TracingRuntime NOOP = new TracingRuntime(OpenTelemetry.noop(), null);

  private static volatile TracingRuntime installed;
  @Nullable private static volatile TracingInitializationException installFailure;
  @Nullable private static Thread shutdownHook;

  private final OpenTelemetry openTelemetry;
  @Nullable private final SdkTracerProvider tracerProvider;
  private final Tracer tracer;

  private TracingRuntime(OpenTelemetry openTelemetry, @Nullable SdkTracerProvider tracerProvider) {
    this.openTelemetry = openTelemetry;
    this.tracerProvider = tracerProvider;
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
  }

  public static TracingRuntime of(OpenTelemetrySdk sdk) {
    return new TracingRuntime(sdk, sdk.getSdkTracerProvider());
  }

  /**
   * Bootstraps the export pipeline once per process. Later calls return the runtime installed by
   * the first one, whatever configuration they pass.
   */
  public static TracingRuntime install(ResolvedConfig config)
      throws TracingInitializationException {
    synchronized (TracingRuntime.class) {
      TracingRuntime runtime = installed;
      if (runtime != null) {
        log.debug("Tracing runtime already installed");
        return runtime;
      }
      try {
        runtime = of(TracerBootstrap.bootstrap(config));
      } catch (TracingInitializationException e) {
        installFailure = e;
        throw e;
      }
      installFailure = null;
      installed = runtime;
      if (shutdownHook == null) {
        shutdownHook = new Thread(TracingRuntime::shutdown, "proxy-otel-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
      }
      return runtime;
    }
  }

  /**
   * Fails when the last installation attempt failed, so that workers which do not install the
   * runtime themselves stay inactive too.
   */
  public static void checkInstallable() throws TracingInitializationException {
    TracingInitializationException failure = installFailure;
    if (failure != null) {
      throw new TracingInitializationException(
          "Tracing runtime failed to install: " + failure.getMessage(), failure);
    }
  }

  @Nullable
  static Thread shutdownHook() {
    synchronized (TracingRuntime.class) {
      return shutdownHook;
    }
  }

  public static TracingRuntime current() {
    TracingRuntime runtime = installed;
    return runtime != null ? runtime : NOOP;
  }

  public static boolean isInstalled() {
    return installed != null;
  }

  /** Flushes pending spans and uninstalls the process runtime, if any. */
  public static void shutdown() {
    TracingRuntime runtime;
    synchronized (TracingRuntime.class) {
      runtime = installed;
      installed = null;
      installFailure = null;
    }
    if (runtime != null) {
      runtime.close();
    }
  }

  public Tracer tracer() {
    return tracer;
  }

  public TextMapPropagator propagator() {
    return openTelemetry.getPropagators().getTextMapPropagator();
  }

  /** Flushes and shuts down this runtime's tracer provider. */
  public void close() {
    if (tracerProvider == null) {
      return;
    }
    CompletableResultCode result =
        tracerProvider.shutdown().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    if (!result.isSuccess()) {
      log.warn("Pending spans could not be exported within {}s", SHUTDOWN_TIMEOUT_SECONDS);
    }
  }
}
