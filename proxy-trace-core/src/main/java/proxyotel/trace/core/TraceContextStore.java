package proxyotel.trace.core;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import javax.annotation.Nullable;
import proxyotel.trace.api.Transaction;
import proxyotel.trace.api.cache.CorrelationCache;
import proxyotel.trace.api.cache.CorrelationCaches;

/**
 * Correlation ledger linking the independent hook invocations of one request.
 *
 * <p>Contexts are keyed by the lowercase hex trace id of their span. The key is also written to
 * the {@value #TRACE_ID_VAR} transaction variable, which is how later hooks for the same request
 * find the context again.
 */
public final class TraceContextStore {
  public static final String TRACE_ID_VAR = "txn.otel_trace_id";

  private static final class Holder {
    static final TraceContextStore GLOBAL =
        new TraceContextStore(
            CorrelationCaches.<Context>newFixedSizeLruCache(CorrelationCaches.DEFAULT_CAPACITY));
  }

  /** The process-wide store, created on first use. */
  public static TraceContextStore global() {
    return Holder.GLOBAL;
  }

  private final CorrelationCache<Context> cache;

  public TraceContextStore(CorrelationCache<Context> cache) {
    this.cache = cache;
  }

  /**
   * Stores the context under the trace id of its span and records the key in the transaction.
   *
   * @return the key, or {@code null} when the context carries no valid span and nothing was stored
   */
  @Nullable
  public String store(Transaction txn, Context context) {
    SpanContext spanContext = Span.fromContext(context).getSpanContext();
    if (!spanContext.isValid()) {
      return null;
    }
    String key = spanContext.getTraceId();
    txn.setVar(TRACE_ID_VAR, key);
    cache.store(key, context);
    return key;
  }

  @Nullable
  public Context get(Transaction txn) {
    String key = txn.getVar(TRACE_ID_VAR);
    return key != null ? cache.get(key) : null;
  }

  @Nullable
  public Context remove(Transaction txn) {
    String key = txn.getVar(TRACE_ID_VAR);
    return key != null ? cache.remove(key) : null;
  }

  int size() {
    return cache.size();
  }
}
