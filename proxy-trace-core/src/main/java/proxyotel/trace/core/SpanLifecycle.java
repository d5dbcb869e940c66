package proxyotel.trace.core;

import static proxyotel.trace.core.SpanAttributes.BACKEND_NAME;
import static proxyotel.trace.core.SpanAttributes.FRONTEND_NAME;
import static proxyotel.trace.core.SpanAttributes.HTTP_REQUEST_HEADER_HOST;
import static proxyotel.trace.core.SpanAttributes.HTTP_REQUEST_METHOD;
import static proxyotel.trace.core.SpanAttributes.HTTP_RESPONSE_STATUS_CODE;
import static proxyotel.trace.core.SpanAttributes.NETWORK_PEER_ADDRESS;
import static proxyotel.trace.core.SpanAttributes.SERVER_NAME;
import static proxyotel.trace.core.SpanAttributes.TERMINATION_STATE;
import static proxyotel.trace.core.SpanAttributes.URL_PATH;
import static proxyotel.trace.core.SpanAttributes.URL_QUERY;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.trace.api.Fetch;
import proxyotel.trace.api.HostAccessException;
import proxyotel.trace.api.HttpMessage;
import proxyotel.trace.api.Transaction;
import proxyotel.trace.core.bootstrap.TracingRuntime;
import proxyotel.trace.core.propagation.HeaderInjector;
import proxyotel.trace.core.propagation.TracingHeaders;

/**
 * Creates, enriches and ends the spans of proxied requests.
 *
 * <p>Each request gets a server span, started by an explicit action when its headers arrive and
 * ended once the response has been analyzed. Every attempt to reach an upstream server may add a
 * client span, child of the server span. Hooks for one request share no state other than the
 * transaction variables and the {@link TraceContextStore}; a hook that cannot find the request's
 * context does nothing.
 *
 * <p>Host fields are read before any span is started and the context is stored after every
 * transaction variable has been written, so a failing accessor leaves no cache entry behind.
 */
public final class SpanLifecycle {
  private static final Logger log = LoggerFactory.getLogger(SpanLifecycle.class);

  public static final String SERVER_SPAN_VAR = "txn.__otel_server_span";
  static final String CLIENT_SPAN_NAME = "upstream";
  static final String RESPONSE_HEADERS_EVENT = "received response headers";
  static final String SERVER_ERROR_DESCRIPTION = "5xx status code";

  private final Supplier<TracingRuntime> runtime;
  private final TraceContextStore store;
  private final HeaderInjector injector;

  /**
   * @param runtime where to get the tracer and propagator from, looked up on every call
   * @param suppressSampledHeader whether to leave the B3 sampled header out of injected headers
   */
  public SpanLifecycle(
      Supplier<TracingRuntime> runtime, TraceContextStore store, boolean suppressSampledHeader) {
    this.runtime = runtime;
    this.store = store;
    this.injector = HeaderInjector.of(suppressSampledHeader);
  }

  /**
   * Starts the server span of a request, continuing the trace found in its propagation headers,
   * and makes it reachable from the request's later hooks.
   *
   * <p>Starting a second server span for the same request replaces the first one, which is ended
   * as is.
   */
  public void startServerSpan(Transaction txn) {
    String method = fetch(txn, Fetch.METHOD);
    RequestTarget target = RequestTarget.parse(fetch(txn, Fetch.PATHQ));
    String peerAddress = fetch(txn, Fetch.SRC);
    TracingHeaders headers = TracingHeaders.extract(txn.requestHeaders());

    TracingRuntime tracing = runtime.get();
    Context parent =
        tracing.propagator().extract(Context.root(), headers, TracingHeaders.Getter.INSTANCE);
    Span span =
        tracing
            .tracer()
            .spanBuilder(method + " " + headers.host())
            .setSpanKind(SpanKind.SERVER)
            .setParent(parent)
            .setAttribute(HTTP_REQUEST_METHOD, method)
            .setAttribute(URL_PATH, target.path)
            .setAttribute(URL_QUERY, target.query)
            .setAttribute(HTTP_REQUEST_HEADER_HOST, headers.host())
            .setAttribute(NETWORK_PEER_ADDRESS, peerAddress)
            .startSpan();

    if (RequestTraceState.of(txn) != RequestTraceState.NO_TRACE) {
      Context replaced = store.remove(txn);
      if (replaced != null) {
        log.debug("Replacing server span of trace {}", txn.getVar(TraceContextStore.TRACE_ID_VAR));
        Span.fromContext(replaced).end();
      }
    }

    if (!span.getSpanContext().isValid()) {
      // nothing to correlate without a tracer
      span.end();
      return;
    }
    // the cache entry is written last, a failing variable write must not leave it orphaned
    try {
      txn.setVar(SERVER_SPAN_VAR, true);
      RequestTraceState.SERVER_SPAN_OPEN.record(txn);
      store.store(txn, parent.with(span));
    } catch (RuntimeException e) {
      span.end();
      throw e;
    }
  }

  /**
   * Sets a string attribute on the request's active span, read from a transaction variable.
   * Nothing happens when the request has no span or the variable is not set.
   */
  public void setSpanAttribute(Transaction txn, String attributeName, String varName) {
    String value = txn.getVar(varName);
    if (value == null) {
      return;
    }
    Context context = store.get(txn);
    if (context == null) {
      return;
    }
    Span.fromContext(context).setAttribute(AttributeKey.stringKey(attributeName), value);
  }

  /**
   * Starts a client span for the request being forwarded and injects its context into the
   * forwarded headers.
   *
   * @return the client span's context, or {@code null} when the request has no server span
   */
  @Nullable
  Context startClientSpan(Transaction txn, HttpMessage request) {
    Context parent = store.get(txn);
    if (parent == null) {
      return null;
    }
    String method = fetch(txn, Fetch.METHOD);
    RequestTarget target = RequestTarget.parse(fetch(txn, Fetch.PATHQ));

    TracingRuntime tracing = runtime.get();
    Span span =
        tracing
            .tracer()
            .spanBuilder(CLIENT_SPAN_NAME)
            .setSpanKind(SpanKind.CLIENT)
            .setParent(parent)
            .setAttribute(HTTP_REQUEST_METHOD, method)
            .setAttribute(URL_PATH, target.path)
            .setAttribute(URL_QUERY, target.query)
            .startSpan();
    Context context = parent.with(span);
    tracing.propagator().inject(context, request, injector);
    RequestTraceState.CLIENT_SPAN_OPEN.record(txn);
    return context;
  }

  /** Records the upstream response on the client span and ends it. */
  void completeClientSpan(Transaction txn, Context context, HttpMessage response) {
    Span span = Span.fromContext(context);
    try {
      span.addEvent(RESPONSE_HEADERS_EVENT);
      int status = response.statusCode();
      span.setAttribute(HTTP_RESPONSE_STATUS_CODE, (long) status);
      if (status < 500) {
        span.setStatus(StatusCode.OK);
      } else {
        span.setStatus(StatusCode.ERROR, response.reason());
      }
      span.setAttribute(SERVER_NAME, fetch(txn, Fetch.SERVER_NAME));
    } finally {
      span.end();
      RequestTraceState.SERVER_SPAN_OPEN.record(txn);
    }
  }

  /** Ends a client span whose upstream never answered with headers. */
  void abandonClientSpan(Transaction txn, Context context) {
    Span.fromContext(context).end();
    RequestTraceState.SERVER_SPAN_OPEN.record(txn);
  }

  /**
   * Ends the server span of the request that started it, recording the final status and the
   * proxy sections that handled it. Does nothing for other requests or when the span was already
   * ended.
   */
  public void completeServerSpan(Transaction txn) {
    if (!Boolean.TRUE.equals(txn.getBooleanVar(SERVER_SPAN_VAR))) {
      return;
    }
    Context context = store.remove(txn);
    if (context == null) {
      return;
    }
    Span span = Span.fromContext(context);
    try {
      Long status = txn.fetchLong(Fetch.TXN_STATUS);
      long code = status != null ? status : 0L;
      span.setAttribute(HTTP_RESPONSE_STATUS_CODE, code);
      if (code < 500) {
        span.setStatus(StatusCode.OK);
      } else {
        span.setStatus(StatusCode.ERROR, SERVER_ERROR_DESCRIPTION);
      }
      span.setAttribute(FRONTEND_NAME, fetch(txn, Fetch.FRONTEND_NAME));
      span.setAttribute(BACKEND_NAME, fetch(txn, Fetch.BACKEND_NAME));
      String terminationState = txn.fetchString(Fetch.TERMINATION_STATE);
      span.setAttribute(TERMINATION_STATE, terminationState != null ? terminationState : "");
    } finally {
      span.end();
      RequestTraceState.SERVER_SPAN_CLOSED.record(txn);
    }
  }

  private static String fetch(Transaction txn, Fetch fetch) {
    String value = txn.fetchString(fetch);
    if (value == null) {
      throw new HostAccessException("No value for '" + fetch + "'");
    }
    return value;
  }

  /** Request path and query, split on the first {@code ?}. */
  static final class RequestTarget {
    final String path;
    final String query;

    private RequestTarget(String path, String query) {
      this.path = path;
      this.query = query;
    }

    static RequestTarget parse(String pathq) {
      int separator = pathq.indexOf('?');
      if (separator < 0) {
        return new RequestTarget(pathq, "");
      }
      return new RequestTarget(pathq.substring(0, separator), pathq.substring(separator + 1));
    }
  }
}
