package proxyotel.trace.core;

import static proxyotel.trace.api.ActionPhase.HTTP_AFTER_RES;
import static proxyotel.trace.api.ActionPhase.HTTP_REQ;
import static proxyotel.trace.api.ActionPhase.HTTP_RES;

import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.config.ConfigResolver;
import proxyotel.config.ModuleOptions;
import proxyotel.config.ResolvedConfig;
import proxyotel.trace.api.ProxyHost;
import proxyotel.trace.core.bootstrap.TracingInitializationException;
import proxyotel.trace.core.bootstrap.TracingRuntime;
import proxyotel.trace.logging.GlobalLogLevelSwitcher;
import proxyotel.trace.logging.LogLevelSwitcher;

/**
 * Entry point called by the host on every worker thread when the module is loaded.
 *
 * <pre>
 *   http-request opentelemetry.start_server_span
 *   http-request opentelemetry.set_span_attribute_var(user.id,txn.user_id)
 *   filter opentelemetry-trace start_client_span=true
 * </pre>
 */
public final class ProxyOtelModule {
  private static final Logger log = LoggerFactory.getLogger(ProxyOtelModule.class);

  public static final String START_SERVER_SPAN = "start_server_span";
  public static final String SET_SPAN_ATTRIBUTE_VAR = "set_span_attribute_var";
  public static final String END_SERVER_SPAN = "end_server_span";

  private ProxyOtelModule() {}

  public static void register(ProxyHost host, ModuleOptions options)
      throws TracingInitializationException {
    register(host, new ConfigResolver(options).resolve(), GlobalLogLevelSwitcher.get());
  }

  /**
   * Installs the tracing runtime when called from the first worker thread, then registers the
   * module's actions and filter. Nothing is registered when the runtime cannot be installed, on
   * the first worker or on any later one.
   */
  static void register(ProxyHost host, ResolvedConfig config, LogLevelSwitcher levelSwitcher)
      throws TracingInitializationException {
    levelSwitcher.switchLevel(config.getLogLevel().value);

    if (host.threadId() <= 1) {
      TracingRuntime.install(config);
      log.info(config.describe());
    } else {
      TracingRuntime.checkInstallable();
      log.debug("Worker {} uses the shared tracing runtime", host.threadId());
    }

    SpanLifecycle lifecycle =
        new SpanLifecycle(
            TracingRuntime::current,
            TraceContextStore.global(),
            config.getSampler().value.suppressesSamplingHeader());

    host.registerAction(
        START_SERVER_SPAN, EnumSet.of(HTTP_REQ), 0, (txn, args) -> lifecycle.startServerSpan(txn));
    host.registerAction(
        SET_SPAN_ATTRIBUTE_VAR,
        EnumSet.of(HTTP_REQ, HTTP_RES, HTTP_AFTER_RES),
        2,
        (txn, args) -> lifecycle.setSpanAttribute(txn, args.get(0), args.get(1)));
    host.registerAction(
        END_SERVER_SPAN,
        EnumSet.of(HTTP_RES, HTTP_AFTER_RES),
        0,
        (txn, args) -> lifecycle.completeServerSpan(txn));
    host.registerFilter(
        TraceFilter.NAME, args -> new TraceFilter(lifecycle, TraceFilter.Options.parse(args)));
  }
}
