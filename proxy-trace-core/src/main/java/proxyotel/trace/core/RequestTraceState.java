package proxyotel.trace.core;

import javax.annotation.Nullable;
import proxyotel.trace.api.Transaction;

/**
 * Where a request stands in its span lifecycle. Persisted in the transaction so that every hook
 * invocation for the request sees the transitions made by the previous ones.
 */
public enum RequestTraceState {
  /** No server span was started for the request; every tracing hook is a no-op. */
  NO_TRACE,
  SERVER_SPAN_OPEN,
  /** A client span for the current upstream attempt is in flight. */
  CLIENT_SPAN_OPEN,
  SERVER_SPAN_CLOSED;

  static final String VAR = "txn.__otel_state";

  public static RequestTraceState of(Transaction txn) {
    RequestTraceState state = fromString(txn.getVar(VAR));
    return state != null ? state : NO_TRACE;
  }

  @Nullable
  static RequestTraceState fromString(@Nullable String name) {
    if (name == null) {
      return null;
    }
    for (RequestTraceState state : values()) {
      if (state.name().equals(name)) {
        return state;
      }
    }
    return null;
  }

  void record(Transaction txn) {
    txn.setVar(VAR, name());
  }
}
